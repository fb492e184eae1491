package max.chess.quiz.session;

public final class TimeFormat {
    private TimeFormat() {
    }

    // mm:ss, or --:-- for an unbounded clock
    public static String format(double timeRemaining) {
        if(Double.isInfinite(timeRemaining)) {
            return "--:--";
        }
        long seconds = (long) Math.max(0, Math.ceil(timeRemaining));
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }
}
