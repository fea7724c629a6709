package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.Optional;
import java.util.UUID;

/**
 * Blocking client connection to a remote GATT server.
 */
public interface GattClient {
    boolean isValid();

    boolean discoverService(UUID serviceUuid);

    Optional<GattCharacteristic> getCharacteristic(UUID serviceUuid, UUID characteristicUuid);

    Optional<byte[]> readCharacteristic(GattCharacteristic characteristic);

    void disconnect();
}
