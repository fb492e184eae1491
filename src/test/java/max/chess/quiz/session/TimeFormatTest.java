package max.chess.quiz.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TimeFormatTest {

    @Test
    public void minutesAndSeconds() {
        assertEquals("03:00", TimeFormat.format(180));
        assertEquals("01:05", TimeFormat.format(65));
        assertEquals("00:00", TimeFormat.format(0));
        assertEquals("00:00", TimeFormat.format(-4));
    }

    @Test
    public void unboundedClock() {
        assertEquals("--:--", TimeFormat.format(Double.POSITIVE_INFINITY));
    }
}
