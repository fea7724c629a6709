package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

/**
 * Anything with a fixed over-the-air byte representation.
 */
public interface BleSerializable {
    byte[] getBytes();
}
