package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Radio driver for BLE advertising, scanning and GATT. All calls block until
 * the driver reports success or failure.
 */
public interface BleMedium {
    /**
     * @return true if the underlying BLE medium can currently be used
     */
    boolean isValid();

    boolean startAdvertising(
            BleAdvertisementData advertisingData,
            BleAdvertisementData scanResponseData,
            PowerMode powerMode
    );

    boolean stopAdvertising();

    boolean startScanning(List<UUID> serviceUuids, PowerMode powerMode, ScanCallback callback);

    boolean stopScanning();

    Optional<GattServer> startGattServer();

    Optional<GattClient> connectToGattServer(BlePeripheral peripheral, PowerMode powerMode);
}
