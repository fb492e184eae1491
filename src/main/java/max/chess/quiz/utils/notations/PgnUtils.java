package max.chess.quiz.utils.notations;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

// https://en.wikipedia.org/wiki/Portable_Game_Notation
public final class PgnUtils {
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", "*");

    private PgnUtils() {
    }

    /**
     * Extracts the SAN tokens of the main line of one transcript, in playing order.
     * Tag pairs, comments, variations, NAGs, move numbers and the result are dropped.
     *
     * @throws IllegalArgumentException on an unbalanced comment or variation
     */
    public static List<String> readMoveTokens(String transcript) {
        String movetext = stripTagPairs(transcript);
        StringBuilder mainLine = new StringBuilder(movetext.length());
        int variationDepth = 0;
        int i = 0;
        while(i < movetext.length()) {
            char c = movetext.charAt(i);
            if(c == '{') {
                int end = movetext.indexOf('}', i);
                if(end == -1) {
                    throw new IllegalArgumentException("Unterminated comment in transcript");
                }
                i = end + 1;
                mainLine.append(' ');
                continue;
            }
            if(c == ';') {
                int end = movetext.indexOf('\n', i);
                i = end == -1 ? movetext.length() : end + 1;
                mainLine.append(' ');
                continue;
            }
            if(c == '(') {
                variationDepth++;
            } else if(c == ')') {
                if(variationDepth == 0) {
                    throw new IllegalArgumentException("Unbalanced variation in transcript");
                }
                variationDepth--;
                mainLine.append(' ');
            } else if(variationDepth == 0) {
                mainLine.append(c);
            }
            i++;
        }
        if(variationDepth != 0) {
            throw new IllegalArgumentException("Unterminated variation in transcript");
        }

        List<String> tokens = new ArrayList<>();
        for(String rawToken : mainLine.toString().trim().split("\\s+")) {
            // 12.e4 or 12...e5 carry the move number glued to the move
            String token = rawToken.replaceFirst("^\\d+\\.+", "");
            if(token.isEmpty() || token.startsWith("$") || RESULTS.contains(token)) {
                continue;
            }
            tokens.add(token);
        }
        return tokens;
    }

    private static String stripTagPairs(String transcript) {
        StringBuilder movetext = new StringBuilder(transcript.length());
        for(String line : transcript.split("\\R")) {
            if(line.trim().startsWith("[")) {
                continue;
            }
            movetext.append(line).append('\n');
        }
        return movetext.toString();
    }
}
