package max.chess.quiz.session;

public enum SessionPhase {
    // no puzzle yet, or the last start failed
    IDLE,
    LOADING,
    ACTIVE,
    ENDED
}
