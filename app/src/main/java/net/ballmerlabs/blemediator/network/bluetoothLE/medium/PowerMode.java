package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

/**
 * Radio-level transmit/scan power requested from the driver.
 */
public enum PowerMode {
    UNKNOWN,
    ULTRA_LOW,
    LOW,
    MEDIUM,
    HIGH
}
