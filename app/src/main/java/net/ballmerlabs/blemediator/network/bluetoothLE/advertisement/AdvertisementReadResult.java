package net.ballmerlabs.blemediator.network.bluetoothLE.advertisement;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.LongSupplier;

/**
 * Advertisements recovered from a remote GATT server, possibly partial, along
 * with the outcome of the most recent read attempt. Passing a previous result
 * into a new fetch resumes it; slots already present are not read again.
 */
public class AdvertisementReadResult {
    public static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 1000;
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 5 * 60 * 1000;

    public enum RetryStatus {
        RETRY,
        PREVIOUSLY_SUCCEEDED,
        TOO_SOON
    }

    private final TreeMap<Integer, byte[]> advertisements = new TreeMap<>();
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;
    private final LongSupplier clock;
    private boolean hasRead = false;
    private boolean lastReadStatus = false;
    private long lastReadTimestampMillis;
    private long backoffMillis = 0;

    public AdvertisementReadResult() {
        this(DEFAULT_INITIAL_BACKOFF_MILLIS, DEFAULT_MAX_BACKOFF_MILLIS);
    }

    public AdvertisementReadResult(long initialBackoffMillis, long maxBackoffMillis) {
        this(initialBackoffMillis, maxBackoffMillis, System::currentTimeMillis);
    }

    AdvertisementReadResult(long initialBackoffMillis, long maxBackoffMillis, LongSupplier clock) {
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
        this.clock = clock;
    }

    public synchronized void addAdvertisement(int slot, byte[] advertisement) {
        advertisements.put(slot, advertisement.clone());
    }

    public synchronized boolean hasAdvertisement(int slot) {
        return advertisements.containsKey(slot);
    }

    public synchronized byte[] getAdvertisement(int slot) {
        final byte[] advertisement = advertisements.get(slot);
        return advertisement == null ? null : advertisement.clone();
    }

    public synchronized SortedMap<Integer, byte[]> getAdvertisements() {
        final TreeMap<Integer, byte[]> copy = new TreeMap<>();
        advertisements.forEach((slot, bytes) -> copy.put(slot, bytes.clone()));
        return Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Records the outcome of a read attempt. Consecutive failures double the
     * retry backoff up to the maximum; a success resets it.
     *
     * @param success true if every attempted slot read succeeded
     */
    public synchronized void recordLastReadStatus(boolean success) {
        hasRead = true;
        lastReadStatus = success;
        lastReadTimestampMillis = clock.getAsLong();
        if (success) {
            backoffMillis = 0;
        } else if (backoffMillis == 0) {
            backoffMillis = initialBackoffMillis;
        } else {
            backoffMillis = Math.min(backoffMillis * 2, maxBackoffMillis);
        }
    }

    public synchronized boolean getLastReadStatus() {
        return lastReadStatus;
    }

    public synchronized long getBackoffMillis() {
        return backoffMillis;
    }

    /**
     * Decides whether the remote server should be read again.
     *
     * @return the retry status
     */
    public synchronized RetryStatus evaluateRetryStatus() {
        if (!hasRead) {
            return RetryStatus.RETRY;
        }
        if (lastReadStatus) {
            return RetryStatus.PREVIOUSLY_SUCCEEDED;
        }
        if (clock.getAsLong() - lastReadTimestampMillis < backoffMillis) {
            return RetryStatus.TOO_SOON;
        }
        return RetryStatus.RETRY;
    }
}
