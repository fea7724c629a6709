package net.ballmerlabs.blemediator.network.bluetoothLE.medium;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Identifies one characteristic of a GATT service, on either side of a connection.
 */
public final class GattCharacteristic {

    public enum Permission {
        READ,
        WRITE
    }

    public enum Property {
        READ,
        WRITE,
        INDICATE,
        NOTIFY
    }

    private final UUID serviceUuid;
    private final UUID uuid;
    private final Set<Permission> permissions;
    private final Set<Property> properties;

    public GattCharacteristic(UUID serviceUuid, UUID uuid, Set<Permission> permissions, Set<Property> properties) {
        this.serviceUuid = Objects.requireNonNull(serviceUuid);
        this.uuid = Objects.requireNonNull(uuid);
        this.permissions = Collections.unmodifiableSet(
                permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions));
        this.properties = Collections.unmodifiableSet(
                properties.isEmpty() ? EnumSet.noneOf(Property.class) : EnumSet.copyOf(properties));
    }

    public UUID getServiceUuid() {
        return serviceUuid;
    }

    public UUID getUuid() {
        return uuid;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public Set<Property> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GattCharacteristic)) return false;
        final GattCharacteristic that = (GattCharacteristic) o;
        return serviceUuid.equals(that.serviceUuid) && uuid.equals(that.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceUuid, uuid);
    }

    @Override
    public String toString() {
        return "GattCharacteristic{service=" + serviceUuid + ", uuid=" + uuid + "}";
    }
}
