package max.chess.quiz.common;

public enum Color {
    WHITE('w', "White"),
    BLACK('b', "Black");

    private final char fenLetter;
    private final String displayName;

    Color(char fenLetter, String displayName) {
        this.fenLetter = fenLetter;
        this.displayName = displayName;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public char fenLetter() {
        return fenLetter;
    }

    public String displayName() {
        return displayName;
    }
}
