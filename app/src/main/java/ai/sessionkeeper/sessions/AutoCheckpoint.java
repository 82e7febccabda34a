package ai.sessionkeeper.sessions;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Periodically persists the current session on a daemon thread.
 *
 * <p>Each tick runs under {@link #tickLock}; {@link #stop()} cancels the schedule and then acquires the same lock,
 * so once it returns no checkpoint is running and none will start.
 */
public class AutoCheckpoint implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AutoCheckpoint.class);

    private static final Duration STOP_WAIT = Duration.ofSeconds(10);

    /** Work performed on each tick. */
    @FunctionalInterface
    public interface Checkpointer {
        void checkpoint(Session session) throws Exception;
    }

    private final Duration interval;
    private final Checkpointer checkpointer;
    private final ScheduledExecutorService scheduler;
    private final ReentrantLock tickLock = new ReentrantLock();

    private @Nullable ScheduledFuture<?> future;
    private volatile @Nullable Session target;
    private volatile int completedTicks;

    public AutoCheckpoint(Duration interval, Checkpointer checkpointer) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.interval = interval;
        this.checkpointer = Objects.requireNonNull(checkpointer);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "SessionCheckpoint");
            t.setDaemon(true);
            return t;
        });
    }

    /** Starts checkpointing {@code session}, replacing any previous target. */
    public synchronized void start(Session session) {
        stop();
        target = session;
        long millis = interval.toMillis();
        future = scheduler.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        logger.debug("Auto-checkpoint every {} for session {}", interval, session.getId());
    }

    public synchronized boolean isRunning() {
        return future != null;
    }

    public int completedTicks() {
        return completedTicks;
    }

    /** Cancels the schedule and waits (bounded) for an in-flight tick to finish. */
    public synchronized void stop() {
        var f = future;
        future = null;
        target = null;
        if (f == null) {
            return;
        }
        f.cancel(false);
        boolean acquired = false;
        try {
            acquired = tickLock.tryLock(STOP_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                logger.warn("Checkpoint still running after {}; continuing shutdown", STOP_WAIT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for checkpoint to finish");
        } finally {
            if (acquired) {
                tickLock.unlock();
            }
        }
    }

    private void tick() {
        tickLock.lock();
        try {
            var session = target;
            if (session == null) {
                return;
            }
            checkpointer.checkpoint(session);
            completedTicks++;
            logger.debug("Checkpointed session {}", session.getId());
        } catch (Exception e) {
            // retried on the next tick
            logger.warn("Auto-checkpoint failed: {}", e.getMessage());
        } finally {
            tickLock.unlock();
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
