package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

/**
 * Invoked by the radio driver, on a driver thread, for every advertisement
 * matching an active scan.
 */
public interface ScanCallback {
    void onAdvertisementFound(BlePeripheral peripheral, BleAdvertisementData advertisementData);
}
