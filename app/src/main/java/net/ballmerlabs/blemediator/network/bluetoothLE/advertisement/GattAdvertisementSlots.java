package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import net.ballmerlabs.blemediator.network.LibsodiumInterface;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Advertisements hosted on the local GATT server, keyed by slot index.
 * Slots are allocated lowest-free-first so indices stay dense from 0.
 *
 * <p>Not thread safe; the owner serializes access.
 */
public class GattAdvertisementSlots {
    public static final int DUMMY_SERVICE_ID_LENGTH = 128;
    public static final int NO_SLOT = -1;

    private final TreeMap<Integer, Slot> slots = new TreeMap<>();

    public static final class Slot {
        private final String serviceId;
        private final byte[] advertisement;

        Slot(String serviceId, byte[] advertisement) {
            this.serviceId = serviceId;
            this.advertisement = advertisement.clone();
        }

        public String getServiceId() {
            return serviceId;
        }

        public byte[] getAdvertisement() {
            return advertisement.clone();
        }
    }

    /**
     * Stores an advertisement in the lowest free slot.
     *
     * @param serviceId     service id the advertisement belongs to
     * @param advertisement encoded {@link BleAdvertisement}
     * @return the slot index, or {@link #NO_SLOT} if every slot is taken
     */
    public int allocateSlot(String serviceId, byte[] advertisement) {
        for (int slot = 0; slot < BleAdvertisementHeader.MAX_NUM_SLOTS; slot++) {
            if (!slots.containsKey(slot)) {
                slots.put(slot, new Slot(serviceId, advertisement));
                return slot;
            }
        }
        return NO_SLOT;
    }

    public void removeSlot(int slot) {
        slots.remove(slot);
    }

    public Optional<Slot> getSlot(int slot) {
        return Optional.ofNullable(slots.get(slot));
    }

    public SortedMap<Integer, Slot> getSlots() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(slots));
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public void clear() {
        slots.clear();
    }

    /**
     * Builds the header for the current slots, anonymized with a random dummy service id.
     *
     * @param psm psm to publish
     * @return the header
     */
    public BleAdvertisementHeader buildHeader(int psm) {
        return buildHeader(LibsodiumInterface.randomBytes(DUMMY_SERVICE_ID_LENGTH), psm);
    }

    /**
     * Builds the header for the current slots. The dummy service id seeds both
     * the bloom filter and the hash chain so that a header never reveals whether
     * zero or one real service is hosted. Slots are folded into the chain in
     * ascending order; the same dummy id and slots always yield the same header.
     *
     * @param dummyServiceId seed service id
     * @param psm            psm to publish
     * @return the header
     */
    public BleAdvertisementHeader buildHeader(byte[] dummyServiceId, int psm) {
        final BloomFilter bloomFilter = new BloomFilter(BleAdvertisementHeader.SERVICE_ID_BLOOM_FILTER_LENGTH * 8);
        bloomFilter.add(dummyServiceId);

        byte[] advertisementHash = BleUtils.generateAdvertisementHash(dummyServiceId);
        for (Map.Entry<Integer, Slot> entry : slots.entrySet()) {
            final Slot slot = entry.getValue();
            bloomFilter.add(slot.serviceId);
            advertisementHash = BleUtils.generateAdvertisementHash(
                    ByteBuffer.allocate(advertisementHash.length + slot.advertisement.length)
                            .put(advertisementHash)
                            .put(slot.advertisement)
                            .array()
            );
        }

        return BleAdvertisementHeader.newBuilder()
                .setVersion(BleAdvertisementHeader.Version.V2)
                .setExtendedAdvertisement(false)
                .setNumSlots(slots.size())
                .setServiceIdBloomFilter(bloomFilter.getBytes())
                .setAdvertisementHash(advertisementHash)
                .setPsm(psm)
                .build();
    }
}
