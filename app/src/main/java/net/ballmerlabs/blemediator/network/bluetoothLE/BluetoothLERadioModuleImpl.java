package net.ballmerlabs.blemediator.network.bluetoothLE;

import net.ballmerlabs.blemediator.MediatorComponent;
import net.ballmerlabs.blemediator.MediatorPreferences;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.AdvertisementReadResult;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleAdvertisement;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleAdvertisementHeader;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.BleUtils;
import net.ballmerlabs.blemediator.network.bluetoothLE.advertisement.GattAdvertisementSlots;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleAdvertisementData;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleMedium;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BlePeripheral;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BluetoothRadio;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattCharacteristic;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattClient;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.GattServer;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.PowerMode;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.ScanCallback;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.DiscoveredPeripheralCallback;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.DiscoveredPeripheralTracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import io.reactivex.Scheduler;

@Singleton
public class BluetoothLERadioModuleImpl implements BluetoothLEModule {
    public static final String TAG = "BluetoothLE";
    private static final Logger LOG = LoggerFactory.getLogger(TAG);
    public static final UUID COPRESENCE_SERVICE_UUID = BleUtils.COPRESENCE_SERVICE_UUID;

    private final BleMedium medium;
    private final BluetoothRadio radio;
    private final DiscoveredPeripheralTracker tracker;
    private final Scheduler bleScheduler;
    private final Scheduler alarmScheduler;
    private final long lostPeripheralTimeoutMillis;
    private final long fetchInitialBackoffMillis;
    private final long fetchMaxBackoffMillis;

    private final Object stateLock = new Object();
    private final Set<String> advertisingServiceIds = new HashSet<>();
    private final Set<String> scanningServiceIds = new HashSet<>();
    private final Set<GattCharacteristic> hostedCharacteristics = new LinkedHashSet<>();
    private final Set<String> inFlightFetches = new HashSet<>();
    private final GattAdvertisementSlots advertisementSlots = new GattAdvertisementSlots();
    private GattServer gattServer;
    private CancelableAlarm lostAlarm;
    private boolean disposed = false;

    private final ScanCallback scanCallback = new ScanCallback() {
        @Override
        public void onAdvertisementFound(BlePeripheral peripheral, BleAdvertisementData advertisementData) {
            // driver threads never reach the tracker directly
            BluetoothLERadioModuleImpl.this.bleScheduler.scheduleDirect(() -> {
                try {
                    BluetoothLERadioModuleImpl.this.tracker.processFoundBleAdvertisement(
                            peripheral,
                            advertisementData,
                            BluetoothLERadioModuleImpl.this
                    );
                } catch (RuntimeException e) {
                    LOG.error("failed to process advertisement from {}", peripheral, e);
                }
            });
        }
    };

    @Inject
    public BluetoothLERadioModuleImpl(
            BleMedium medium,
            BluetoothRadio radio,
            DiscoveredPeripheralTracker tracker,
            MediatorPreferences preferences,
            @Named(MediatorComponent.NamedSchedulers.BLE_SERIAL) Scheduler bleScheduler,
            @Named(MediatorComponent.NamedSchedulers.ALARM) Scheduler alarmScheduler
    ) {
        this.medium = medium;
        this.radio = radio;
        this.tracker = tracker;
        this.bleScheduler = bleScheduler;
        this.alarmScheduler = alarmScheduler;
        final long lostTimeout = preferences.getLong(
                MediatorPreferences.PREF_LOST_PERIPHERAL_TIMEOUT_MS,
                MediatorPreferences.DEFAULT_LOST_PERIPHERAL_TIMEOUT_MS
        );
        if (lostTimeout <= 0) {
            LOG.warn("lost peripheral timeout {} is not positive, using {}",
                    lostTimeout, MediatorPreferences.DEFAULT_LOST_PERIPHERAL_TIMEOUT_MS);
            this.lostPeripheralTimeoutMillis = MediatorPreferences.DEFAULT_LOST_PERIPHERAL_TIMEOUT_MS;
        } else {
            this.lostPeripheralTimeoutMillis = lostTimeout;
        }
        this.fetchInitialBackoffMillis = preferences.getLong(
                MediatorPreferences.PREF_FETCH_INITIAL_BACKOFF_MS,
                AdvertisementReadResult.DEFAULT_INITIAL_BACKOFF_MILLIS
        );
        this.fetchMaxBackoffMillis = preferences.getLong(
                MediatorPreferences.PREF_FETCH_MAX_BACKOFF_MS,
                AdvertisementReadResult.DEFAULT_MAX_BACKOFF_MILLIS
        );
    }

    private boolean isAvailableLocked() {
        return radio.isEnabled() && medium.isValid();
    }

    @Override
    public boolean isAvailable() {
        synchronized (stateLock) {
            return isAvailableLocked();
        }
    }

    @Override
    public boolean startAdvertising(
            String serviceId,
            byte[] advertisement,
            PowerLevel powerLevel,
            UUID fastAdvertisementServiceUuid
    ) {
        synchronized (stateLock) {
            if (disposed) {
                LOG.info("refusing to advertise {}: module disposed", serviceId);
                return false;
            }
            if (advertisement == null || advertisement.length == 0) {
                LOG.info("refusing to advertise {}: empty advertisement", serviceId);
                return false;
            }
            if (advertisement.length > BleAdvertisement.MAX_DATA_LENGTH) {
                LOG.info("refusing to advertise {}: {} bytes exceeds {}",
                        serviceId, advertisement.length, BleAdvertisement.MAX_DATA_LENGTH);
                return false;
            }
            if (advertisingServiceIds.contains(serviceId)) {
                LOG.info("refusing to advertise {}: already advertising", serviceId);
                return false;
            }
            if (!radio.isEnabled()) {
                LOG.info("refusing to advertise {}: bluetooth disabled", serviceId);
                return false;
            }
            if (!medium.isValid()) {
                LOG.info("refusing to advertise {}: ble medium unavailable", serviceId);
                return false;
            }

            final boolean started;
            if (fastAdvertisementServiceUuid != null) {
                started = startFastAdvertisingLocked(
                        serviceId, advertisement, powerLevel, fastAdvertisementServiceUuid);
            } else {
                started = startGattAdvertisingLocked(serviceId, advertisement, powerLevel);
            }
            if (started) {
                advertisingServiceIds.add(serviceId);
                LOG.debug("started advertising {} ({} bytes, fast={})",
                        serviceId, advertisement.length, fastAdvertisementServiceUuid != null);
            }
            return started;
        }
    }

    private boolean startFastAdvertisingLocked(
            String serviceId,
            byte[] advertisement,
            PowerLevel powerLevel,
            UUID fastAdvertisementServiceUuid
    ) {
        final BleAdvertisement fastAdvertisement = BleAdvertisement.newBuilder()
                .setFastAdvertisement(true)
                .setData(advertisement)
                .build();
        if (fastAdvertisement == null) {
            LOG.info("refusing to advertise {}: {} bytes does not fit a fast advertisement",
                    serviceId, advertisement.length);
            return false;
        }
        final BleAdvertisementData advertisingData = BleAdvertisementData.newBuilder()
                .setConnectable(true)
                .addServiceUuid(fastAdvertisementServiceUuid)
                .build();
        final BleAdvertisementData scanResponseData = BleAdvertisementData.newBuilder()
                .addServiceData(fastAdvertisementServiceUuid, fastAdvertisement.getBytes())
                .build();
        if (!medium.startAdvertising(advertisingData, scanResponseData, powerLevel.toPowerMode())) {
            LOG.info("radio failed to start fast advertising for {}", serviceId);
            return false;
        }
        return true;
    }

    private boolean startGattAdvertisingLocked(String serviceId, byte[] advertisement, PowerLevel powerLevel) {
        final BleAdvertisement gattAdvertisement = BleAdvertisement.newBuilder()
                .setServiceId(serviceId)
                .setData(advertisement)
                .build();
        if (gattAdvertisement == null) {
            LOG.info("refusing to advertise {}: failed to encode advertisement", serviceId);
            return false;
        }

        stopGattServerLocked();
        final int slot = advertisementSlots.allocateSlot(serviceId, gattAdvertisement.getBytes());
        if (slot == GattAdvertisementSlots.NO_SLOT) {
            LOG.info("refusing to advertise {}: all {} gatt slots taken",
                    serviceId, BleAdvertisementHeader.MAX_NUM_SLOTS);
            restoreGattServerLocked();
            return false;
        }
        if (!startGattServerLocked()) {
            LOG.info("failed to host advertisement for {} in slot {}", serviceId, slot);
            advertisementSlots.removeSlot(slot);
            restoreGattServerLocked();
            return false;
        }

        final BleAdvertisementHeader header = advertisementSlots.buildHeader(BleAdvertisementHeader.DEFAULT_PSM);
        final BleAdvertisementData advertisingData = BleAdvertisementData.newBuilder()
                .setConnectable(true)
                .addServiceUuid(COPRESENCE_SERVICE_UUID)
                .build();
        final BleAdvertisementData scanResponseData = BleAdvertisementData.newBuilder()
                .addServiceData(COPRESENCE_SERVICE_UUID, header.getBytes())
                .build();
        if (!medium.startAdvertising(advertisingData, scanResponseData, powerLevel.toPowerMode())) {
            LOG.info("radio failed to start advertising header for {}", serviceId);
            advertisementSlots.removeSlot(slot);
            stopGattServerLocked();
            restoreGattServerLocked();
            return false;
        }
        return true;
    }

    /*
     * hosts every slot of the table on a fresh gatt server
     */
    private boolean startGattServerLocked() {
        final Optional<GattServer> server = medium.startGattServer();
        if (!server.isPresent() || !server.get().isValid()) {
            LOG.info("failed to start gatt server");
            return false;
        }
        final GattServer s = server.get();
        final List<GattCharacteristic> created = new ArrayList<>();
        for (Map.Entry<Integer, GattAdvertisementSlots.Slot> entry : advertisementSlots.getSlots().entrySet()) {
            final Optional<GattCharacteristic> characteristic = s.createCharacteristic(
                    COPRESENCE_SERVICE_UUID,
                    BleUtils.generateAdvertisementUuid(entry.getKey()),
                    EnumSet.of(GattCharacteristic.Permission.READ),
                    EnumSet.of(GattCharacteristic.Property.READ)
            );
            if (!characteristic.isPresent()
                    || !s.updateCharacteristic(characteristic.get(), entry.getValue().getAdvertisement())) {
                LOG.info("failed to host slot {} on gatt server", entry.getKey());
                s.stop();
                return false;
            }
            created.add(characteristic.get());
        }
        gattServer = s;
        hostedCharacteristics.addAll(created);
        return true;
    }

    private void restoreGattServerLocked() {
        if (!advertisementSlots.isEmpty() && gattServer == null && !startGattServerLocked()) {
            LOG.error("failed to restore gatt server for {} remaining slots", advertisementSlots.size());
        }
    }

    private void stopGattServerLocked() {
        hostedCharacteristics.clear();
        if (gattServer != null) {
            gattServer.stop();
            gattServer = null;
        }
    }

    /**
     * Stops advertising a service id. Hosted advertisements share one header, so
     * this invalidates the GATT slots of every other advertised id as well.
     */
    @Override
    public boolean stopAdvertising(String serviceId) {
        synchronized (stateLock) {
            if (!advertisingServiceIds.contains(serviceId)) {
                LOG.info("cannot stop advertising {}: not advertising", serviceId);
                return false;
            }
            advertisementSlots.clear();
            if (!hostedCharacteristics.isEmpty()) {
                for (GattCharacteristic characteristic : hostedCharacteristics) {
                    if (gattServer == null || !gattServer.updateCharacteristic(characteristic, new byte[0])) {
                        LOG.error("failed to clear {}", characteristic);
                    }
                }
                hostedCharacteristics.clear();
            } else {
                stopGattServerLocked();
            }
            advertisingServiceIds.remove(serviceId);
            LOG.debug("stopped advertising {}", serviceId);
            return medium.stopAdvertising();
        }
    }

    @Override
    public boolean isAdvertising(String serviceId) {
        synchronized (stateLock) {
            return advertisingServiceIds.contains(serviceId);
        }
    }

    @Override
    public boolean startScanning(
            String serviceId,
            PowerLevel powerLevel,
            DiscoveredPeripheralCallback callback,
            UUID fastAdvertisementServiceUuid
    ) {
        synchronized (stateLock) {
            if (disposed) {
                LOG.info("refusing to scan for {}: module disposed", serviceId);
                return false;
            }
            if (serviceId == null || serviceId.isEmpty()) {
                LOG.info("refusing to scan for empty service id");
                return false;
            }
            if (scanningServiceIds.contains(serviceId)) {
                LOG.info("refusing to scan for {}: already scanning", serviceId);
                return false;
            }
            if (!radio.isEnabled()) {
                LOG.info("refusing to scan for {}: bluetooth disabled", serviceId);
                return false;
            }
            if (!medium.isValid()) {
                LOG.info("refusing to scan for {}: ble medium unavailable", serviceId);
                return false;
            }

            tracker.startTracking(serviceId, callback, fastAdvertisementServiceUuid);
            if (!scanningServiceIds.isEmpty()) {
                scanningServiceIds.add(serviceId);
                LOG.debug("joined running scan for {}", serviceId);
                return true;
            }

            final UUID scanUuid = fastAdvertisementServiceUuid != null
                    ? fastAdvertisementServiceUuid
                    : COPRESENCE_SERVICE_UUID;
            if (!medium.startScanning(Collections.singletonList(scanUuid), powerLevel.toPowerMode(), scanCallback)) {
                LOG.info("radio failed to start scanning for {}", serviceId);
                tracker.stopTracking(serviceId);
                return false;
            }
            scanningServiceIds.add(serviceId);
            lostAlarm = new CancelableAlarm(
                    "lost-peripheral",
                    this::processLostPeripherals,
                    lostPeripheralTimeoutMillis,
                    TimeUnit.MILLISECONDS,
                    alarmScheduler
            );
            LOG.debug("started scanning for {} under {}", serviceId, scanUuid);
            return true;
        }
    }

    private void processLostPeripherals() {
        synchronized (stateLock) {
            tracker.processLostGattAdvertisements();
        }
    }

    @Override
    public boolean stopScanning(String serviceId) {
        synchronized (stateLock) {
            if (!scanningServiceIds.contains(serviceId)) {
                LOG.info("cannot stop scanning for {}: not scanning", serviceId);
                return false;
            }
            tracker.stopTracking(serviceId);
            scanningServiceIds.remove(serviceId);
            if (!scanningServiceIds.isEmpty()) {
                return true;
            }
            if (lostAlarm != null) {
                lostAlarm.cancel();
                lostAlarm = null;
            }
            LOG.debug("stopped scanning");
            return medium.stopScanning();
        }
    }

    @Override
    public boolean isScanning(String serviceId) {
        synchronized (stateLock) {
            return scanningServiceIds.contains(serviceId);
        }
    }

    @Override
    public AdvertisementReadResult fetchAdvertisements(
            BlePeripheral peripheral,
            int numSlots,
            int psm,
            List<String> interestingServiceIds,
            AdvertisementReadResult advertisementReadResult
    ) {
        final AdvertisementReadResult result = advertisementReadResult != null
                ? advertisementReadResult
                : new AdvertisementReadResult(fetchInitialBackoffMillis, fetchMaxBackoffMillis);

        synchronized (stateLock) {
            if (peripheral == null || !peripheral.isValid()) {
                LOG.info("cannot fetch advertisements: invalid peripheral");
                result.recordLastReadStatus(false);
                return result;
            }
            if (!isAvailableLocked()) {
                LOG.info("cannot fetch advertisements from {}: ble unavailable", peripheral);
                result.recordLastReadStatus(false);
                return result;
            }
            if (!inFlightFetches.add(peripheral.getAddress())) {
                LOG.info("fetch from {} already in flight", peripheral);
                result.recordLastReadStatus(false);
                return result;
            }
        }

        try {
            LOG.debug("fetching {} slots (psm {}) from {} for {}", numSlots, psm, peripheral, interestingServiceIds);
            readSlots(peripheral, numSlots, result);
            return result;
        } finally {
            synchronized (stateLock) {
                inFlightFetches.remove(peripheral.getAddress());
            }
        }
    }

    private void readSlots(BlePeripheral peripheral, int numSlots, AdvertisementReadResult result) {
        final Optional<GattClient> connection = medium.connectToGattServer(peripheral, PowerMode.HIGH);
        if (!connection.isPresent() || !connection.get().isValid()) {
            LOG.info("failed to connect to gatt server on {}", peripheral);
            result.recordLastReadStatus(false);
            return;
        }
        final GattClient client = connection.get();
        try {
            if (!client.discoverService(COPRESENCE_SERVICE_UUID)) {
                LOG.info("{} does not host the copresence service", peripheral);
                result.recordLastReadStatus(false);
                return;
            }
            boolean success = true;
            for (int slot = 0; slot < numSlots; slot++) {
                if (result.hasAdvertisement(slot)) {
                    continue;
                }
                final Optional<GattCharacteristic> characteristic = client.getCharacteristic(
                        COPRESENCE_SERVICE_UUID,
                        BleUtils.generateAdvertisementUuid(slot)
                );
                if (!characteristic.isPresent()) {
                    // slot freed since the header was published
                    continue;
                }
                final Optional<byte[]> value = client.readCharacteristic(characteristic.get());
                if (value.isPresent()) {
                    result.addAdvertisement(slot, value.get());
                } else {
                    LOG.info("failed to read slot {} from {}", slot, peripheral);
                    success = false;
                }
            }
            result.recordLastReadStatus(success);
        } finally {
            client.disconnect();
        }
    }

    @Override
    public void dispose() {
        final List<String> scanning;
        final List<String> advertising;
        synchronized (stateLock) {
            if (disposed) {
                return;
            }
            disposed = true;
            scanning = new ArrayList<>(scanningServiceIds);
            advertising = new ArrayList<>(advertisingServiceIds);
        }
        for (String serviceId : scanning) {
            stopScanning(serviceId);
        }
        for (String serviceId : advertising) {
            stopAdvertising(serviceId);
        }
        synchronized (stateLock) {
            stopGattServerLocked();
        }
        bleScheduler.shutdown();
        alarmScheduler.shutdown();
    }

    @Override
    public boolean isDisposed() {
        synchronized (stateLock) {
            return disposed;
        }
    }
}
