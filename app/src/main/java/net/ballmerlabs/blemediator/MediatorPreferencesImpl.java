package net.ballmerlabs.blemediator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

@Singleton
public class MediatorPreferencesImpl implements MediatorPreferences {
    private static final String TAG = "MediatorPreferences";
    private static final Logger LOG = LoggerFactory.getLogger(TAG);
    private final Properties preferences;

    @Inject
    public MediatorPreferencesImpl(
            @Named(MediatorComponent.NamedConfig.PREFERENCES) Properties preferences
    ) {
        this.preferences = preferences;
    }

    @Override
    public long getLong(String key, long def) {
        final String value = preferences.getProperty(key);
        if (value == null) {
            return def;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("invalid long for {}: {}, using {}", key, value, def);
            return def;
        }
    }
}
