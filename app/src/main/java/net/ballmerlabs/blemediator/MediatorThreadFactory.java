package net.ballmerlabs.blemediator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Names the threads behind the mediator's single schedulers, e.g.
 * {@code ble-serial-1}. Errors that escape a scheduled task are logged
 * instead of going to the default handler.
 */
public class MediatorThreadFactory implements ThreadFactory {
    private static final String TAG = "MediatorThreadFactory";
    private static final Logger LOG = LoggerFactory.getLogger(TAG);

    private final String prefix;
    private final AtomicLong count = new AtomicLong();

    public MediatorThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        final Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) ->
                LOG.error("uncaught error on {}", thread.getName(), e));
        return t;
    }
}
