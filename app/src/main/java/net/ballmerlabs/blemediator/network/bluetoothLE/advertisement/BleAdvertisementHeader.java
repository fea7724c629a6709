package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import java.nio.ByteBuffer;

/**
 * Compact summary broadcast in place of the advertisements hosted over GATT.
 *
 * <p>Layout: one byte holding version (3 bits), extended flag (1 bit) and slot
 * count (4 bits), the service id bloom filter, the chained advertisement hash
 * and a 2 byte psm. The psm may be absent on the wire, in which case it is
 * {@link #DEFAULT_PSM}.
 */
public class BleAdvertisementHeader implements BleSerializable {
    public static final int SERVICE_ID_BLOOM_FILTER_LENGTH = 10;
    public static final int ADVERTISEMENT_HASH_LENGTH = 4;
    public static final int MAX_NUM_SLOTS = 0x0F;
    public static final int DEFAULT_PSM = 0;
    private static final int MAX_PSM = 0xFFFF;
    private static final int PSM_LENGTH = 2;
    private static final int MIN_LENGTH = 1 + SERVICE_ID_BLOOM_FILTER_LENGTH + ADVERTISEMENT_HASH_LENGTH;
    private static final int LENGTH = MIN_LENGTH + PSM_LENGTH;
    private static final int EXTENDED_FLAG = 0x10;

    public enum Version {
        V1(1),
        V2(2);

        private final int val;

        Version(int val) {
            this.val = val;
        }

        public int getVal() {
            return val;
        }

        static Version fromVal(int val) {
            for (Version v : values()) {
                if (v.val == val) {
                    return v;
                }
            }
            return null;
        }
    }

    private final Version version;
    private final boolean extendedAdvertisement;
    private final int numSlots;
    private final byte[] serviceIdBloomFilter;
    private final byte[] advertisementHash;
    private final int psm;

    private BleAdvertisementHeader(Builder builder) {
        this.version = builder.version;
        this.extendedAdvertisement = builder.extendedAdvertisement;
        this.numSlots = builder.numSlots;
        this.serviceIdBloomFilter = builder.serviceIdBloomFilter.clone();
        this.advertisementHash = builder.advertisementHash.clone();
        this.psm = builder.psm;
    }

    /**
     * Decodes a header read from scan response service data.
     *
     * @param bytes encoded header
     * @return the header
     * @throws InvalidAdvertisementException on a wrong length or unknown version
     */
    public static BleAdvertisementHeader parseFrom(byte[] bytes) throws InvalidAdvertisementException {
        if (bytes == null || (bytes.length != MIN_LENGTH && bytes.length != LENGTH)) {
            throw new InvalidAdvertisementException("invalid header length "
                    + (bytes == null ? 0 : bytes.length));
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes);
        final int first = buffer.get() & 0xFF;
        final Version version = Version.fromVal((first >> 5) & 0x07);
        if (version == null) {
            throw new InvalidAdvertisementException("unsupported header version " + ((first >> 5) & 0x07));
        }
        final byte[] bloom = new byte[SERVICE_ID_BLOOM_FILTER_LENGTH];
        buffer.get(bloom);
        final byte[] hash = new byte[ADVERTISEMENT_HASH_LENGTH];
        buffer.get(hash);
        final int psm = buffer.remaining() == PSM_LENGTH ? buffer.getShort() & 0xFFFF : DEFAULT_PSM;

        return newBuilder()
                .setVersion(version)
                .setExtendedAdvertisement((first & EXTENDED_FLAG) != 0)
                .setNumSlots(first & MAX_NUM_SLOTS)
                .setServiceIdBloomFilter(bloom)
                .setAdvertisementHash(hash)
                .setPsm(psm)
                .build();
    }

    @Override
    public byte[] getBytes() {
        final ByteBuffer buffer = ByteBuffer.allocate(LENGTH);
        buffer.put((byte) ((version.getVal() << 5)
                | (extendedAdvertisement ? EXTENDED_FLAG : 0)
                | numSlots));
        buffer.put(serviceIdBloomFilter);
        buffer.put(advertisementHash);
        buffer.putShort((short) psm);
        return buffer.array();
    }

    public Version getVersion() {
        return version;
    }

    public boolean isExtendedAdvertisement() {
        return extendedAdvertisement;
    }

    public int getNumSlots() {
        return numSlots;
    }

    public byte[] getServiceIdBloomFilter() {
        return serviceIdBloomFilter.clone();
    }

    public BloomFilter getBloomFilter() {
        return BloomFilter.fromBytes(serviceIdBloomFilter);
    }

    public byte[] getAdvertisementHash() {
        return advertisementHash.clone();
    }

    public int getPsm() {
        return psm;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private Version version = Version.V2;
        private boolean extendedAdvertisement;
        private int numSlots;
        private byte[] serviceIdBloomFilter;
        private byte[] advertisementHash;
        private int psm = DEFAULT_PSM;

        public Builder setVersion(Version version) {
            this.version = version;
            return this;
        }

        public Builder setExtendedAdvertisement(boolean extendedAdvertisement) {
            this.extendedAdvertisement = extendedAdvertisement;
            return this;
        }

        public Builder setNumSlots(int numSlots) {
            this.numSlots = numSlots;
            return this;
        }

        public Builder setServiceIdBloomFilter(byte[] serviceIdBloomFilter) {
            this.serviceIdBloomFilter = serviceIdBloomFilter;
            return this;
        }

        public Builder setAdvertisementHash(byte[] advertisementHash) {
            this.advertisementHash = advertisementHash;
            return this;
        }

        public Builder setPsm(int psm) {
            this.psm = psm;
            return this;
        }

        /**
         * Build advertisement header.
         *
         * @return the header, or null if a field is missing or out of range
         */
        public BleAdvertisementHeader build() {
            if (version == null || numSlots < 0 || numSlots > MAX_NUM_SLOTS) {
                return null;
            }
            if (serviceIdBloomFilter == null || serviceIdBloomFilter.length != SERVICE_ID_BLOOM_FILTER_LENGTH) {
                return null;
            }
            if (advertisementHash == null || advertisementHash.length != ADVERTISEMENT_HASH_LENGTH) {
                return null;
            }
            if (psm < 0 || psm > MAX_PSM) {
                return null;
            }
            return new BleAdvertisementHeader(this);
        }
    }
}
