package lovesyk.humantime;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.Test;

import lovesyk.humantime.exception.DurationParseException;

class HumanTimeTest {

    private static void assertRoundTrip(Duration duration) throws DurationParseException {
        String formatted = HumanTime.formatDuration(duration).toString();
        assertThat(HumanTime.parseDuration(formatted)).as(formatted).isEqualTo(duration);
    }

    @Test
    void parseDuration_Examples() throws DurationParseException {
        assertThat(HumanTime.parseDuration("2h 37min")).isEqualTo(Duration.ofSeconds(9420));
        assertThat(HumanTime.parseDuration("32ms")).isEqualTo(Duration.ofNanos(32_000_000));
    }

    @Test
    void formatDuration_Examples() {
        assertThat(HumanTime.formatDuration(Duration.ofSeconds(9420))).hasToString("2h 37m");
        assertThat(HumanTime.formatDuration(Duration.ofNanos(32_000_000))).hasToString("32ms");
        assertThat(HumanTime.formatDuration(Duration.ZERO)).hasToString("0s");
    }

    @Test
    void parseOfFormat_WithBoundaryValues_ReturnsOriginal() throws DurationParseException {
        assertRoundTrip(Duration.ZERO);
        assertRoundTrip(Duration.ofNanos(1));
        assertRoundTrip(Duration.ofSeconds(59, 999_999_999));
        assertRoundTrip(Duration.ofSeconds(31_557_599));
        assertRoundTrip(Duration.ofSeconds(31_557_600));
        assertRoundTrip(Duration.ofSeconds(Long.MAX_VALUE, 999_999_999));
    }

    @Test
    void parseOfFormat_WithRandomValues_ReturnsOriginal() throws DurationParseException {
        Random random = new Random(42);
        for (int i = 0; i < 1000; ++i) {
            long seconds = random.nextLong() & Long.MAX_VALUE;
            // mix in small values so lower components get exercised on their own
            if (i % 2 == 0) {
                seconds %= 100_000_000L;
            }
            assertRoundTrip(Duration.ofSeconds(seconds, random.nextInt(1_000_000_000)));
        }
    }
}
