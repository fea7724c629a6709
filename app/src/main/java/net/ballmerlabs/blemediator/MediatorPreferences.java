package net.ballmerlabs.blemediator;

public interface MediatorPreferences {
    String PREF_LOST_PERIPHERAL_TIMEOUT_MS = "lost_peripheral_timeout_ms";
    String PREF_FETCH_INITIAL_BACKOFF_MS = "fetch_initial_backoff_ms";
    String PREF_FETCH_MAX_BACKOFF_MS = "fetch_max_backoff_ms";

    long DEFAULT_LOST_PERIPHERAL_TIMEOUT_MS = 3000;

    long getLong(String key, long def);
}
