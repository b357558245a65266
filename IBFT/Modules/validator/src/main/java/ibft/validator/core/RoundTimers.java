package ibft.validator.core;

import ibft.common.messages.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class RoundTimers implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RoundTimers.class);

    private final ScheduledExecutorService scheduler;
    private final long baseTimeout;
    private final long maxTimeoutMillis;

    private final Object lock = new Object();
    private ScheduledFuture<?> roundTimer;
    private View pendingView;

    public RoundTimers(String name, long baseTimeoutMillis, long maxTimeoutMillis) {
        if (baseTimeoutMillis <= 0) throw new IllegalArgumentException("base timeout must be positive: " + baseTimeoutMillis);
        this.baseTimeout = baseTimeoutMillis;
        this.maxTimeoutMillis = Math.max(maxTimeoutMillis, baseTimeoutMillis);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ConsensusEngine.NamedTF(name));
    }

    // base * 2^round, capped at the maximum.
    public long timeoutFor(long round) {
        if (round >= 62) return maxTimeoutMillis;
        long factor = 1L << round;
        if (baseTimeout > maxTimeoutMillis / factor) return maxTimeoutMillis;
        return Math.min(baseTimeout * factor, maxTimeoutMillis);
    }

    public void schedule(View view, Runnable onTimeout) {
        long delay = timeoutFor(view.round());
        synchronized (lock) {
            cancelLocked();
            if (scheduler.isShutdown()) return;
            pendingView = view;
            roundTimer = scheduler.schedule(onTimeout, delay, TimeUnit.MILLISECONDS);
        }
        log.debug("Timers: round timer for {} T={}ms", view, delay);
    }

    public void cancel() {
        synchronized (lock) {
            cancelLocked();
        }
    }

    public View pendingView() {
        synchronized (lock) {
            return pendingView;
        }
    }

    private void cancelLocked() {
        if (roundTimer != null) roundTimer.cancel(false);
        roundTimer = null;
        pendingView = null;
    }

    @Override
    public void close() {
        cancel();
        scheduler.shutdownNow();
    }
}
