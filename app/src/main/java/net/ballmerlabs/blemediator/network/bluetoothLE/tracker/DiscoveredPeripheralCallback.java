package net.ballmerlabs.blemediator.network.bluetoothLE.tracker;

import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;

public interface DiscoveredPeripheralCallback {
    void onPeripheralDiscovered(
            BlePeripheral peripheral,
            String serviceId,
            byte[] advertisementData,
            boolean fastAdvertisement
    );

    default void onPeripheralLost(BlePeripheral peripheral, String serviceId) {
    }
}
