package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

/**
 * Process-level view of the bluetooth adapter power state.
 */
public interface BluetoothRadio {
    boolean isEnabled();
}
