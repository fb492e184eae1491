package max.chess.quiz.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AnswerParserTest {

    @Test
    public void plainCountsAreAccepted() {
        assertEquals(OptionalInt.of(0), AnswerParser.parse("0"));
        assertEquals(OptionalInt.of(12), AnswerParser.parse(" 12\t"));
        assertEquals(OptionalInt.of(7), AnswerParser.parse("007"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "-3", "+3", "3.5", "three", "3 4", "0x10", "1234567890"})
    public void anythingElseIsRejected(String input) {
        assertEquals(OptionalInt.empty(), AnswerParser.parse(input));
    }

    @Test
    public void nullIsRejected() {
        assertEquals(OptionalInt.empty(), AnswerParser.parse(null));
    }
}
