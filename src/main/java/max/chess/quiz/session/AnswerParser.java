package max.chess.quiz.session;

import java.util.OptionalInt;

// User counts are plain non-negative integers, anything else is a wrong answer
public final class AnswerParser {
    private static final int MAX_DIGITS = 9;

    private AnswerParser() {
    }

    public static OptionalInt parse(String input) {
        if(input == null) {
            return OptionalInt.empty();
        }
        String trimmed = input.trim();
        if(trimmed.isEmpty() || trimmed.length() > MAX_DIGITS) {
            return OptionalInt.empty();
        }
        for(int i = 0; i < trimmed.length(); i++) {
            if(trimmed.charAt(i) < '0' || trimmed.charAt(i) > '9') {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of(Integer.parseInt(trimmed));
    }
}
