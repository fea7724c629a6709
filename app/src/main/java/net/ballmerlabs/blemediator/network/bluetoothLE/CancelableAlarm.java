package net.ballmerlabs.blemediator.network.bluetoothLE;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;

/**
 * Runs a task after a delay on a scheduler, re-arming itself after every run
 * until canceled. Canceling while the task runs lets that run finish but
 * prevents the next one.
 */
public class CancelableAlarm implements Disposable {
    private static final String TAG = "CancelableAlarm";
    private static final Logger LOG = LoggerFactory.getLogger(TAG);

    private final String name;
    private final Runnable runnable;
    private final long delay;
    private final TimeUnit unit;
    private final Scheduler scheduler;
    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final AtomicReference<Disposable> pending = new AtomicReference<>();

    public CancelableAlarm(String name, Runnable runnable, long delay, TimeUnit unit, Scheduler scheduler) {
        if (delay <= 0) {
            throw new IllegalArgumentException("alarm " + name + " needs a positive delay, got " + delay);
        }
        this.name = name;
        this.runnable = runnable;
        this.delay = delay;
        this.unit = unit;
        this.scheduler = scheduler;
        arm();
    }

    private void arm() {
        final Disposable d = scheduler.scheduleDirect(this::fire, delay, unit);
        // a run that already fired and re-armed owns the slot
        pending.compareAndSet(null, d);
        // cancel() may have run between the check in fire() and the set above
        if (canceled.get()) {
            final Disposable current = pending.getAndSet(null);
            if (current != null) {
                current.dispose();
            }
        }
    }

    private void fire() {
        pending.set(null);
        if (canceled.get()) {
            return;
        }
        try {
            runnable.run();
        } catch (RuntimeException e) {
            LOG.error("alarm {} task failed", name, e);
        }
        if (!canceled.get()) {
            arm();
        }
    }

    /**
     * Cancels the alarm.
     *
     * @return true if this call canceled it, false if it was already canceled
     */
    public boolean cancel() {
        if (!canceled.compareAndSet(false, true)) {
            return false;
        }
        final Disposable d = pending.getAndSet(null);
        if (d != null) {
            d.dispose();
        }
        LOG.debug("canceled alarm {}", name);
        return true;
    }

    public boolean isValid() {
        return !canceled.get();
    }

    @Override
    public void dispose() {
        cancel();
    }

    @Override
    public boolean isDisposed() {
        return canceled.get();
    }
}
