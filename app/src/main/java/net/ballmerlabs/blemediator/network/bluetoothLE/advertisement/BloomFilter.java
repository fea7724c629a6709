package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import net.ballmerlabs.blemediator.network.LibsodiumInterface;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;

/**
 * Fixed size bloom filter summarizing the service ids hosted behind a header.
 *
 * <p>Bit positions are derived from a single BLAKE2b digest by double hashing,
 * so an item always sets the same bits. Nothing can be removed; shrink the set
 * by building a new filter.
 */
public class BloomFilter {
    private static final int NUM_HASHES = 5;

    private final BitSet bits;
    private final int bitLength;

    public BloomFilter(int bitLength) {
        if (bitLength < 1) {
            throw new IllegalArgumentException("bloom filter needs at least one bit");
        }
        this.bitLength = bitLength;
        this.bits = new BitSet(bitLength);
    }

    /**
     * Rebuilds a filter received inside a header.
     *
     * @param bytes bytes as produced by {@link #getBytes()}
     * @return the bloom filter
     */
    public static BloomFilter fromBytes(byte[] bytes) {
        final BloomFilter filter = new BloomFilter(bytes.length * 8);
        for (int i = 0; i < filter.bitLength; i++) {
            if ((bytes[i / 8] & (1 << (i % 8))) != 0) {
                filter.bits.set(i);
            }
        }
        return filter;
    }

    public void add(String item) {
        add(item.getBytes(StandardCharsets.UTF_8));
    }

    public void add(byte[] item) {
        for (int position : positions(item)) {
            bits.set(position);
        }
    }

    public boolean mightContain(String item) {
        return mightContain(item.getBytes(StandardCharsets.UTF_8));
    }

    public boolean mightContain(byte[] item) {
        for (int position : positions(item)) {
            if (!bits.get(position)) {
                return false;
            }
        }
        return true;
    }

    public int getBitLength() {
        return bitLength;
    }

    /**
     * Bit n is stored in byte n/8 at bit n%8.
     *
     * @return exactly ceil(bitLength / 8) bytes
     */
    public byte[] getBytes() {
        final byte[] out = new byte[(bitLength + 7) / 8];
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            out[i / 8] |= (byte) (1 << (i % 8));
        }
        return out;
    }

    private int[] positions(byte[] item) {
        final ByteBuffer digest = ByteBuffer.wrap(LibsodiumInterface.genericHash(item));
        final int hash1 = digest.getInt();
        final int hash2 = digest.getInt();
        final int[] positions = new int[NUM_HASHES];
        for (int i = 1; i <= NUM_HASHES; i++) {
            int combined = hash1 + (i * hash2);
            if (combined < 0) {
                combined = ~combined;
            }
            positions[i - 1] = combined % bitLength;
        }
        return positions;
    }
}
