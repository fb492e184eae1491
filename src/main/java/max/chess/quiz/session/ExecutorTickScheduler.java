package max.chess.quiz.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Ticks on a single daemon thread at a fixed period. */
public class ExecutorTickScheduler implements TickScheduler, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTickScheduler.class);

    private final ScheduledExecutorService executor;
    private final long periodMillis;

    public ExecutorTickScheduler() {
        this(Duration.ofSeconds(1));
    }

    public ExecutorTickScheduler(Duration period) {
        if(period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("Tick period must be positive, got " + period);
        }
        this.periodMillis = period.toMillis();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "quiz-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public TickHandle schedule(Runnable tick) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                // a throwing task would silently stop the periodic schedule
                LOGGER.error("Timer tick failed", e);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
