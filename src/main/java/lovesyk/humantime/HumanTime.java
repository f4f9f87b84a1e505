package lovesyk.humantime;

import java.time.Duration;

import lovesyk.humantime.exception.DurationParseException;
import lovesyk.humantime.service.format.DurationFormatter;
import lovesyk.humantime.service.format.FormattedDuration;
import lovesyk.humantime.service.parser.DurationParser;

/**
 * Entry point for converting between human-friendly duration strings and
 * {@link Duration} values.
 * <p>
 * Supported units:
 * <ul>
 * <li><code>nsec</code>, <code>ns</code>, <code>nanos</code> - nanoseconds</li>
 * <li><code>usec</code>, <code>us</code>, <code>µs</code> - microseconds</li>
 * <li><code>msec</code>, <code>ms</code>, <code>millis</code> -
 * milliseconds</li>
 * <li><code>seconds</code>, <code>second</code>, <code>secs</code>,
 * <code>sec</code>, <code>s</code></li>
 * <li><code>minutes</code>, <code>minute</code>, <code>mins</code>,
 * <code>min</code>, <code>m</code></li>
 * <li><code>hours</code>, <code>hour</code>, <code>hrs</code>,
 * <code>hr</code>, <code>h</code></li>
 * <li><code>days</code>, <code>day</code>, <code>d</code></li>
 * <li><code>weeks</code>, <code>week</code>, <code>w</code></li>
 * <li><code>months</code>, <code>month</code>, <code>M</code> - defined as
 * 30.44 days</li>
 * <li><code>years</code>, <code>year</code>, <code>y</code> - defined as
 * 365.25 days</li>
 * </ul>
 * Formatting output is guaranteed to parse back to the same value but its
 * exact composition may differ from the original input.
 */
public final class HumanTime {
    private HumanTime() {
    }

    /**
     * Parses a duration such as <code>2h 37min</code>.
     * 
     * @param input the text to parse
     * @return the parsed duration
     * @throws DurationParseException if the input is not a valid duration
     */
    public static Duration parseDuration(String input) throws DurationParseException {
        return DurationParser.parse(input);
    }

    /**
     * Wraps a duration to be rendered as e.g. <code>2h 37m</code>.
     * 
     * @param duration the non-negative duration
     * @return the formatted duration
     * @throws IllegalArgumentException if the duration is negative
     */
    public static FormattedDuration formatDuration(Duration duration) {
        return DurationFormatter.format(duration);
    }
}
