package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Contents of one advertising or scan response packet.
 */
public class BleAdvertisementData {
    private final boolean connectable;
    private final Set<UUID> serviceUuids;
    private final Map<UUID, byte[]> serviceData;

    private BleAdvertisementData(Builder builder) {
        this.connectable = builder.connectable;
        this.serviceUuids = Collections.unmodifiableSet(new LinkedHashSet<>(builder.serviceUuids));
        final Map<UUID, byte[]> data = new HashMap<>();
        for (Map.Entry<UUID, byte[]> entry : builder.serviceData.entrySet()) {
            data.put(entry.getKey(), entry.getValue().clone());
        }
        this.serviceData = Collections.unmodifiableMap(data);
    }

    public boolean isConnectable() {
        return connectable;
    }

    public Set<UUID> getServiceUuids() {
        return serviceUuids;
    }

    public Map<UUID, byte[]> getServiceData() {
        return serviceData;
    }

    /**
     * Gets the service data published under a uuid.
     *
     * @param uuid service uuid
     * @return a copy of the data, or null if none
     */
    public byte[] getServiceData(UUID uuid) {
        final byte[] data = serviceData.get(uuid);
        return data == null ? null : data.clone();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private boolean connectable;
        private final Set<UUID> serviceUuids = new LinkedHashSet<>();
        private final Map<UUID, byte[]> serviceData = new HashMap<>();

        public Builder setConnectable(boolean connectable) {
            this.connectable = connectable;
            return this;
        }

        public Builder addServiceUuid(UUID uuid) {
            serviceUuids.add(uuid);
            return this;
        }

        public Builder addServiceData(UUID uuid, byte[] data) {
            serviceData.put(uuid, data);
            return this;
        }

        public BleAdvertisementData build() {
            return new BleAdvertisementData(this);
        }
    }
}
