package net.ballmerlabs.blemediator.network.bluetoothLE;

import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleAdvertisementData;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleMedium;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattCharacteristic;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattClient;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattServer;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.PowerMode;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.ScanCallback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory radio shared by several devices. Advertisements only reach
 * scanners when {@link #deliverAdvertisements()} is called.
 */
class FakeBleEnvironment {
    private final Map<String, FakeBleMedium> devices = new LinkedHashMap<>();

    synchronized FakeBleMedium newDevice(String address) {
        final FakeBleMedium medium = new FakeBleMedium(address);
        devices.put(address, medium);
        return medium;
    }

    void deliverAdvertisements() {
        final List<FakeBleMedium> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(devices.values());
        }
        for (FakeBleMedium scanner : snapshot) {
            for (FakeBleMedium advertiser : snapshot) {
                if (scanner != advertiser) {
                    scanner.receive(advertiser);
                }
            }
        }
    }

    private synchronized FakeBleMedium device(String address) {
        return devices.get(address);
    }

    class FakeBleMedium implements BleMedium {
        private final String address;
        private BleAdvertisementData advertisingData;
        private BleAdvertisementData scanResponseData;
        private List<UUID> scanUuids;
        private ScanCallback scanCallback;
        private FakeGattServer server;
        private int connections = 0;

        FakeBleMedium(String address) {
            this.address = address;
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public synchronized boolean startAdvertising(
                BleAdvertisementData advertisingData,
                BleAdvertisementData scanResponseData,
                PowerMode powerMode
        ) {
            this.advertisingData = advertisingData;
            this.scanResponseData = scanResponseData;
            return true;
        }

        @Override
        public synchronized boolean stopAdvertising() {
            advertisingData = null;
            scanResponseData = null;
            return true;
        }

        @Override
        public synchronized boolean startScanning(List<UUID> serviceUuids, PowerMode powerMode, ScanCallback callback) {
            scanUuids = new ArrayList<>(serviceUuids);
            scanCallback = callback;
            return true;
        }

        @Override
        public synchronized boolean stopScanning() {
            scanUuids = null;
            scanCallback = null;
            return true;
        }

        @Override
        public synchronized Optional<GattServer> startGattServer() {
            server = new FakeGattServer();
            return Optional.of(server);
        }

        @Override
        public Optional<GattClient> connectToGattServer(BlePeripheral peripheral, PowerMode powerMode) {
            final FakeBleMedium remote = device(peripheral.getAddress());
            if (remote == null) {
                return Optional.empty();
            }
            final FakeGattServer remoteServer;
            synchronized (remote) {
                remoteServer = remote.server;
            }
            if (remoteServer == null || !remoteServer.isValid()) {
                return Optional.empty();
            }
            synchronized (this) {
                connections++;
            }
            return Optional.of(new FakeGattClient(remoteServer));
        }

        synchronized int getConnections() {
            return connections;
        }

        private void receive(FakeBleMedium advertiser) {
            final ScanCallback callback;
            final List<UUID> uuids;
            synchronized (this) {
                callback = scanCallback;
                uuids = scanUuids;
            }
            final BleAdvertisementData advertising;
            final BleAdvertisementData scanResponse;
            synchronized (advertiser) {
                advertising = advertiser.advertisingData;
                scanResponse = advertiser.scanResponseData;
            }
            if (callback == null || advertising == null) {
                return;
            }
            if (Collections.disjoint(uuids, advertising.getServiceUuids())) {
                return;
            }
            final BleAdvertisementData.Builder merged = BleAdvertisementData.newBuilder()
                    .setConnectable(advertising.isConnectable());
            for (UUID uuid : advertising.getServiceUuids()) {
                merged.addServiceUuid(uuid);
            }
            advertising.getServiceData().forEach(merged::addServiceData);
            if (scanResponse != null) {
                scanResponse.getServiceData().forEach(merged::addServiceData);
            }
            callback.onAdvertisementFound(new BlePeripheral(advertiser.address), merged.build());
        }
    }

    static class FakeGattServer implements GattServer {
        private final Map<GattCharacteristic, byte[]> values = new LinkedHashMap<>();
        private boolean stopped = false;

        @Override
        public synchronized boolean isValid() {
            return !stopped;
        }

        @Override
        public synchronized Optional<GattCharacteristic> createCharacteristic(
                UUID serviceUuid,
                UUID characteristicUuid,
                Set<GattCharacteristic.Permission> permissions,
                Set<GattCharacteristic.Property> properties
        ) {
            if (stopped) {
                return Optional.empty();
            }
            final GattCharacteristic characteristic =
                    new GattCharacteristic(serviceUuid, characteristicUuid, permissions, properties);
            values.put(characteristic, new byte[0]);
            return Optional.of(characteristic);
        }

        @Override
        public synchronized boolean updateCharacteristic(GattCharacteristic characteristic, byte[] value) {
            if (stopped || !values.containsKey(characteristic)) {
                return false;
            }
            values.put(characteristic, value.clone());
            return true;
        }

        @Override
        public synchronized void stop() {
            stopped = true;
            values.clear();
        }

        synchronized Optional<GattCharacteristic> find(UUID serviceUuid, UUID characteristicUuid) {
            for (GattCharacteristic characteristic : values.keySet()) {
                if (characteristic.getServiceUuid().equals(serviceUuid)
                        && characteristic.getUuid().equals(characteristicUuid)) {
                    return Optional.of(characteristic);
                }
            }
            return Optional.empty();
        }

        synchronized Optional<byte[]> read(GattCharacteristic characteristic) {
            final byte[] value = values.get(characteristic);
            return value == null ? Optional.empty() : Optional.of(value.clone());
        }

        synchronized boolean hasService(UUID serviceUuid) {
            for (GattCharacteristic characteristic : values.keySet()) {
                if (characteristic.getServiceUuid().equals(serviceUuid)) {
                    return true;
                }
            }
            return false;
        }
    }

    static class FakeGattClient implements GattClient {
        private final FakeGattServer server;
        private boolean connected = true;

        FakeGattClient(FakeGattServer server) {
            this.server = server;
        }

        @Override
        public synchronized boolean isValid() {
            return connected && server.isValid();
        }

        @Override
        public boolean discoverService(UUID serviceUuid) {
            return isValid() && server.hasService(serviceUuid);
        }

        @Override
        public Optional<GattCharacteristic> getCharacteristic(UUID serviceUuid, UUID characteristicUuid) {
            return isValid() ? server.find(serviceUuid, characteristicUuid) : Optional.empty();
        }

        @Override
        public Optional<byte[]> readCharacteristic(GattCharacteristic characteristic) {
            return isValid() ? server.read(characteristic) : Optional.empty();
        }

        @Override
        public synchronized void disconnect() {
            connected = false;
        }
    }
}
