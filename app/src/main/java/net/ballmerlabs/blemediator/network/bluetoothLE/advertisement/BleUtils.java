package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import net.ballmerlabs.blemediator.network.LibsodiumInterface;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

/**
 * Hashing and uuid helpers shared by the advertisement codecs.
 */
public final class BleUtils {
    private static final long BLUETOOTH_BASE_UUID_MSB = 0x0000000000001000L;
    private static final long BLUETOOTH_BASE_UUID_LSB = 0x800000805F9B34FBL;

    private static final long ADVERTISEMENT_UUID_MSB = 0x0000000000003000L;
    private static final long ADVERTISEMENT_UUID_LSB = 0x8000000000000000L;

    private static final int DEVICE_TOKEN_SEED_LENGTH = 4;

    /**
     * Well known service under which hosted advertisements and headers are published.
     */
    public static final UUID COPRESENCE_SERVICE_UUID = fromShortUuid(0xFEF3);

    private BleUtils() {}

    /**
     * Expands a 16 bit assigned number into a full uuid using the bluetooth base uuid.
     *
     * @param shortUuid 16 bit uuid
     * @return the 128 bit uuid
     */
    public static UUID fromShortUuid(int shortUuid) {
        return new UUID(((long) (shortUuid & 0xFFFF) << 32) | BLUETOOTH_BASE_UUID_MSB, BLUETOOTH_BASE_UUID_LSB);
    }

    public static byte[] generateHash(byte[] source, int size) {
        return Arrays.copyOf(LibsodiumInterface.sha256(source), size);
    }

    public static byte[] generateHash(String source, int size) {
        return generateHash(source.getBytes(StandardCharsets.UTF_8), size);
    }

    /**
     * V1 and V2 share the same service id hash.
     */
    public static byte[] generateServiceIdHash(String serviceId, BleAdvertisement.Version version) {
        return generateHash(serviceId, BleAdvertisement.SERVICE_ID_HASH_LENGTH);
    }

    /**
     * Random device token, fresh on every call.
     */
    public static byte[] generateDeviceToken() {
        return generateHash(
                LibsodiumInterface.randomBytes(DEVICE_TOKEN_SEED_LENGTH),
                BleAdvertisement.DEVICE_TOKEN_LENGTH
        );
    }

    public static byte[] generateAdvertisementHash(byte[] advertisementBytes) {
        return generateHash(advertisementBytes, BleAdvertisementHeader.ADVERTISEMENT_HASH_LENGTH);
    }

    /**
     * Characteristic uuid for the advertisement hosted at a slot. Distinct slots
     * always map to distinct uuids.
     *
     * @param slot slot index, non-negative
     * @return characteristic uuid
     */
    public static UUID generateAdvertisementUuid(int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative: " + slot);
        }
        return new UUID(ADVERTISEMENT_UUID_MSB, ADVERTISEMENT_UUID_LSB | slot);
    }
}
