package net.ballmerlabs.blemediator.network.bluetoothLE;

import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.AdvertisementReadResult;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.AdvertisementFetcher;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.DiscoveredPeripheralCallback;

import java.util.List;
import java.util.UUID;

import io.reactivex.disposables.Disposable;

/**
 * Advertises and discovers services over BLE. Every operation reports failure
 * by returning false and leaves the module state untouched when it does.
 */
public interface BluetoothLEModule extends AdvertisementFetcher, Disposable {

    /**
     * Starts advertising bytes for a service id.
     *
     * @param serviceId                    service to advertise
     * @param advertisement                1 to 512 bytes, copied
     * @param powerLevel                   transmit power preference
     * @param fastAdvertisementServiceUuid uuid to publish a fast advertisement under, or null
     *                                     to host the advertisement over GATT
     * @return true if advertising started
     */
    boolean startAdvertising(
            String serviceId,
            byte[] advertisement,
            PowerLevel powerLevel,
            UUID fastAdvertisementServiceUuid
    );

    boolean stopAdvertising(String serviceId);

    boolean isAdvertising(String serviceId);

    /**
     * Starts scanning for a service id. Scans for several ids share one radio scan session.
     *
     * @param serviceId                    service to look for
     * @param powerLevel                   scan power preference
     * @param callback                     receives discovery and loss events for the id
     * @param fastAdvertisementServiceUuid uuid fast advertisements for the id are published under, or null
     * @return true if scanning started
     */
    boolean startScanning(
            String serviceId,
            PowerLevel powerLevel,
            DiscoveredPeripheralCallback callback,
            UUID fastAdvertisementServiceUuid
    );

    boolean stopScanning(String serviceId);

    boolean isScanning(String serviceId);

    /**
     * @return true if the radio is enabled and the medium usable
     */
    boolean isAvailable();

    /**
     * Reads the advertisements a remote device hosts in its GATT slots. Slots
     * already present in the previous result are not read again.
     */
    @Override
    AdvertisementReadResult fetchAdvertisements(
            BlePeripheral peripheral,
            int numSlots,
            int psm,
            List<String> interestingServiceIds,
            AdvertisementReadResult advertisementReadResult
    );
}
