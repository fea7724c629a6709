package net.ballmerlabs.blemediator.network.bluetoothLE.tracker;

import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleAdvertisementData;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;

import java.util.UUID;

/**
 * Turns raw scan results into per-service discovery and loss events.
 */
public interface DiscoveredPeripheralTracker {
    /**
     * @param fastAdvertisementServiceUuid uuid of fast advertisements for the service, or null
     */
    void startTracking(String serviceId, DiscoveredPeripheralCallback callback, UUID fastAdvertisementServiceUuid);

    void stopTracking(String serviceId);

    void processFoundBleAdvertisement(
            BlePeripheral peripheral,
            BleAdvertisementData advertisementData,
            AdvertisementFetcher advertisementFetcher
    );

    void processLostGattAdvertisements();
}
