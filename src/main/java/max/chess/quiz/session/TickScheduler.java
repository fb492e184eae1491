package max.chess.quiz.session;

/** Source of the periodic one-unit ticks driving a session countdown. */
public interface TickScheduler {
    /**
     * Starts calling {@code tick} once per time unit until the returned handle is cancelled.
     */
    TickHandle schedule(Runnable tick);
}
