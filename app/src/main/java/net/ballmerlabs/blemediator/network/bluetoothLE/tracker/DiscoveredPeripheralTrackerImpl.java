package net.ballmerlabs.blemediator.network.bluetoothLE.tracker;

import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.AdvertisementReadResult;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleAdvertisement;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleAdvertisementHeader;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleUtils;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BloomFilter;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.InvalidAdvertisementException;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleAdvertisementData;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Tracks which peripherals advertise which service ids.
 *
 * <p>Fetches and callbacks run without holding the tracker's monitor, so a
 * callback may call back into the BLE module.
 */
@Singleton
public class DiscoveredPeripheralTrackerImpl implements DiscoveredPeripheralTracker {
    private static final String TAG = "PeripheralTracker";
    private static final Logger LOG = LoggerFactory.getLogger(TAG);

    private final Map<String, TrackedService> trackedServices = new HashMap<>();
    private final Map<DiscoveryKey, Discovery> discoveries = new HashMap<>();
    private final Map<String, HeaderReadState> headerReads = new HashMap<>();
    private long generation = 0;

    private static final class TrackedService {
        final DiscoveredPeripheralCallback callback;
        final UUID fastAdvertisementServiceUuid;

        TrackedService(DiscoveredPeripheralCallback callback, UUID fastAdvertisementServiceUuid) {
            this.callback = callback;
            this.fastAdvertisementServiceUuid = fastAdvertisementServiceUuid;
        }
    }

    private static final class DiscoveryKey {
        final String address;
        final String serviceId;

        DiscoveryKey(String address, String serviceId) {
            this.address = address;
            this.serviceId = serviceId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DiscoveryKey)) return false;
            final DiscoveryKey that = (DiscoveryKey) o;
            return address.equals(that.address) && serviceId.equals(that.serviceId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(address, serviceId);
        }
    }

    private static final class Discovery {
        final BlePeripheral peripheral;
        final byte[] data;
        long lastSeenGeneration;

        Discovery(BlePeripheral peripheral, byte[] data, long lastSeenGeneration) {
            this.peripheral = peripheral;
            this.data = data;
            this.lastSeenGeneration = lastSeenGeneration;
        }
    }

    // latest header seen from one peripheral and what was read behind it
    private static final class HeaderReadState {
        final byte[] advertisementHash;
        final AdvertisementReadResult readResult;
        long lastSeenGeneration;

        HeaderReadState(byte[] advertisementHash, AdvertisementReadResult readResult, long lastSeenGeneration) {
            this.advertisementHash = advertisementHash;
            this.readResult = readResult;
            this.lastSeenGeneration = lastSeenGeneration;
        }
    }

    @Inject
    public DiscoveredPeripheralTrackerImpl() {
    }

    @Override
    public synchronized void startTracking(
            String serviceId,
            DiscoveredPeripheralCallback callback,
            UUID fastAdvertisementServiceUuid
    ) {
        trackedServices.put(serviceId, new TrackedService(callback, fastAdvertisementServiceUuid));
        LOG.debug("tracking {}", serviceId);
    }

    @Override
    public synchronized void stopTracking(String serviceId) {
        trackedServices.remove(serviceId);
        discoveries.keySet().removeIf(key -> key.serviceId.equals(serviceId));
        LOG.debug("stopped tracking {}", serviceId);
    }

    @Override
    public void processFoundBleAdvertisement(
            BlePeripheral peripheral,
            BleAdvertisementData advertisementData,
            AdvertisementFetcher advertisementFetcher
    ) {
        if (peripheral == null || !peripheral.isValid() || advertisementData == null) {
            return;
        }
        final Map<String, TrackedService> services;
        synchronized (this) {
            if (trackedServices.isEmpty()) {
                return;
            }
            services = new HashMap<>(trackedServices);
        }

        final List<Runnable> events = new ArrayList<>();
        for (Map.Entry<String, TrackedService> entry : services.entrySet()) {
            final UUID fastUuid = entry.getValue().fastAdvertisementServiceUuid;
            if (fastUuid == null) {
                continue;
            }
            final byte[] serviceData = advertisementData.getServiceData(fastUuid);
            if (serviceData == null) {
                continue;
            }
            try {
                final BleAdvertisement advertisement = BleAdvertisement.parseFrom(serviceData);
                if (!advertisement.isFastAdvertisement()) {
                    LOG.info("dropping regular advertisement under fast uuid {} from {}", fastUuid, peripheral);
                    continue;
                }
                reportDiscovery(peripheral, entry.getKey(), advertisement.getData(), true, events);
            } catch (InvalidAdvertisementException e) {
                LOG.info("dropping undecodable fast advertisement from {}: {}", peripheral, e.getMessage());
            }
        }

        final byte[] headerBytes = advertisementData.getServiceData(BleUtils.COPRESENCE_SERVICE_UUID);
        if (headerBytes != null) {
            processHeader(peripheral, headerBytes, services, advertisementFetcher, events);
        }

        for (Runnable event : events) {
            event.run();
        }
    }

    private void processHeader(
            BlePeripheral peripheral,
            byte[] headerBytes,
            Map<String, TrackedService> services,
            AdvertisementFetcher advertisementFetcher,
            List<Runnable> events
    ) {
        final BleAdvertisementHeader header;
        try {
            header = BleAdvertisementHeader.parseFrom(headerBytes);
        } catch (InvalidAdvertisementException e) {
            LOG.info("dropping undecodable header from {}: {}", peripheral, e.getMessage());
            return;
        }

        final BloomFilter bloomFilter = header.getBloomFilter();
        final List<String> interesting = new ArrayList<>();
        for (Map.Entry<String, TrackedService> entry : services.entrySet()) {
            if (entry.getValue().fastAdvertisementServiceUuid == null && bloomFilter.mightContain(entry.getKey())) {
                interesting.add(entry.getKey());
            }
        }
        if (interesting.isEmpty() || header.getNumSlots() == 0) {
            return;
        }

        AdvertisementReadResult prior = null;
        synchronized (this) {
            final HeaderReadState state = headerReads.get(peripheral.getAddress());
            if (state != null && Arrays.equals(state.advertisementHash, header.getAdvertisementHash())) {
                state.lastSeenGeneration = generation;
                prior = state.readResult;
            }
        }

        final AdvertisementReadResult result;
        final AdvertisementReadResult.RetryStatus status = prior == null
                ? AdvertisementReadResult.RetryStatus.RETRY
                : prior.evaluateRetryStatus();
        if (status == AdvertisementReadResult.RetryStatus.RETRY) {
            result = advertisementFetcher.fetchAdvertisements(
                    peripheral,
                    header.getNumSlots(),
                    header.getPsm(),
                    interesting,
                    prior
            );
            synchronized (this) {
                headerReads.put(
                        peripheral.getAddress(),
                        new HeaderReadState(header.getAdvertisementHash(), result, generation)
                );
            }
        } else {
            LOG.trace("not reading {} again: {}", peripheral, status);
            result = prior;
        }

        for (Map.Entry<Integer, byte[]> slot : result.getAdvertisements().entrySet()) {
            final BleAdvertisement advertisement;
            try {
                advertisement = BleAdvertisement.parseFrom(slot.getValue());
            } catch (InvalidAdvertisementException e) {
                LOG.info("dropping undecodable slot {} from {}: {}", slot.getKey(), peripheral, e.getMessage());
                continue;
            }
            for (String serviceId : interesting) {
                if (advertisement.matchesServiceId(serviceId)) {
                    reportDiscovery(peripheral, serviceId, advertisement.getData(), false, events);
                }
            }
        }
    }

    private synchronized void reportDiscovery(
            BlePeripheral peripheral,
            String serviceId,
            byte[] data,
            boolean fastAdvertisement,
            List<Runnable> events
    ) {
        final TrackedService service = trackedServices.get(serviceId);
        if (service == null) {
            return;
        }
        final DiscoveryKey key = new DiscoveryKey(peripheral.getAddress(), serviceId);
        final Discovery discovery = discoveries.get(key);
        if (discovery != null && Arrays.equals(discovery.data, data)) {
            discovery.lastSeenGeneration = generation;
            return;
        }
        discoveries.put(key, new Discovery(peripheral, data, generation));
        LOG.debug("discovered {} on {} (fast={})", serviceId, peripheral, fastAdvertisement);
        events.add(() -> service.callback.onPeripheralDiscovered(peripheral, serviceId, data.clone(), fastAdvertisement));
    }

    /**
     * Reports every peripheral not seen since the previous call as lost.
     */
    @Override
    public void processLostGattAdvertisements() {
        final List<Runnable> events = new ArrayList<>();
        synchronized (this) {
            final Iterator<Map.Entry<DiscoveryKey, Discovery>> iterator = discoveries.entrySet().iterator();
            while (iterator.hasNext()) {
                final Map.Entry<DiscoveryKey, Discovery> entry = iterator.next();
                if (entry.getValue().lastSeenGeneration >= generation) {
                    continue;
                }
                iterator.remove();
                final TrackedService service = trackedServices.get(entry.getKey().serviceId);
                if (service != null) {
                    final BlePeripheral peripheral = entry.getValue().peripheral;
                    final String serviceId = entry.getKey().serviceId;
                    LOG.debug("lost {} on {}", serviceId, peripheral);
                    events.add(() -> service.callback.onPeripheralLost(peripheral, serviceId));
                }
            }
            headerReads.values().removeIf(state -> state.lastSeenGeneration < generation);
            generation++;
        }
        for (Runnable event : events) {
            event.run();
        }
    }
}
