package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.Objects;

/**
 * Handle to a remote device seen while scanning.
 */
public final class BlePeripheral {
    private final String address;

    public BlePeripheral(String address) {
        this.address = address;
    }

    public String getAddress() {
        return address;
    }

    public boolean isValid() {
        return address != null && !address.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlePeripheral)) return false;
        return Objects.equals(address, ((BlePeripheral) o).address);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(address);
    }

    @Override
    public String toString() {
        return "BlePeripheral{" + address + "}";
    }
}
