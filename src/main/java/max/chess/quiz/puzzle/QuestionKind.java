package max.chess.quiz.puzzle;

public enum QuestionKind {
    ALL_LEGAL("Moves"),
    CHECKS("Checks"),
    CAPTURES("Captures");

    private final String label;

    QuestionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
