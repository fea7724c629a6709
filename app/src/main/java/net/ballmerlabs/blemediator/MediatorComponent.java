package net.ballmerlabs.blemediator;

import net.ballmerlabs.blemediator.network.bluetoothLE.BluetoothLEModule;
import net.ballmerlabs.blemediator.network.bluetoothLE.BluetoothLERadioModuleImpl;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BleMedium;
import net.ballmerlabs.blemediator.network.bluetoothLE.medium.BluetoothRadio;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.DiscoveredPeripheralTracker;
import net.ballmerlabs.blemediator.network.bluetoothLE.tracker.DiscoveredPeripheralTrackerImpl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import javax.inject.Named;
import javax.inject.Singleton;

import dagger.Binds;
import dagger.BindsInstance;
import dagger.Component;
import dagger.Module;
import dagger.Provides;
import io.reactivex.Scheduler;
import io.reactivex.plugins.RxJavaPlugins;

@Singleton
@Component(modules = MediatorComponent.MediatorModule.class)
public interface MediatorComponent {

    class NamedSchedulers {
        public static final String BLE_SERIAL = "scheduler-ble-serial";
        public static final String ALARM = "scheduler-alarm";
        private NamedSchedulers() {

        }
    }

    class NamedConfig {
        public static final String PREFERENCES = "preferences";
        public static final String PREFERENCES_RESOURCE = "/blemediator.properties";
        private NamedConfig() {

        }
    }

    @Component.Builder
    interface Builder {
        @BindsInstance
        Builder bleMedium(BleMedium medium);

        @BindsInstance
        Builder bluetoothRadio(BluetoothRadio radio);

        MediatorComponent build();
    }

    @Module
    abstract class MediatorModule {
        private static final String TAG = "MediatorModule";
        private static final Logger LOG = LoggerFactory.getLogger(TAG);

        @Provides
        @Singleton
        @Named(NamedConfig.PREFERENCES)
        static Properties providePreferences() {
            final Properties properties = new Properties();
            try (InputStream in = MediatorComponent.class.getResourceAsStream(NamedConfig.PREFERENCES_RESOURCE)) {
                if (in == null) {
                    LOG.warn("{} not found, using defaults", NamedConfig.PREFERENCES_RESOURCE);
                } else {
                    properties.load(in);
                }
            } catch (IOException e) {
                LOG.error("failed to load {}, using defaults", NamedConfig.PREFERENCES_RESOURCE, e);
            }
            return properties;
        }

        @Provides
        @Singleton
        @Named(NamedSchedulers.BLE_SERIAL)
        static Scheduler provideBleSerialScheduler() {
            return RxJavaPlugins.createSingleScheduler(new MediatorThreadFactory("ble-serial"));
        }

        @Provides
        @Singleton
        @Named(NamedSchedulers.ALARM)
        static Scheduler provideAlarmScheduler() {
            return RxJavaPlugins.createSingleScheduler(new MediatorThreadFactory("lost-alarm"));
        }

        @Binds
        @Singleton
        abstract MediatorPreferences bindPreferences(MediatorPreferencesImpl impl);

        @Binds
        @Singleton
        abstract DiscoveredPeripheralTracker bindPeripheralTracker(DiscoveredPeripheralTrackerImpl impl);

        @Binds
        @Singleton
        abstract BluetoothLEModule bindRadioModuleInternal(BluetoothLERadioModuleImpl impl);
    }

    BluetoothLEModule bluetoothLEModule();

    MediatorPreferences preferences();
}
