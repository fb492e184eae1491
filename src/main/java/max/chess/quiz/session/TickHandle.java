package max.chess.quiz.session;

@FunctionalInterface
public interface TickHandle {
    // Stops further ticks, calling it twice is harmless
    void cancel();
}
