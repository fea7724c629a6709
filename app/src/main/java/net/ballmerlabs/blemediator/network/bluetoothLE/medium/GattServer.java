package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A locally hosted GATT server started through {@link BleMedium#startGattServer()}.
 */
public interface GattServer {
    boolean isValid();

    Optional<GattCharacteristic> createCharacteristic(
            UUID serviceUuid,
            UUID characteristicUuid,
            Set<GattCharacteristic.Permission> permissions,
            Set<GattCharacteristic.Property> properties
    );

    boolean updateCharacteristic(GattCharacteristic characteristic, byte[] value);

    void stop();
}
