package lovesyk.humantime.service.api;

import java.time.Duration;

import lovesyk.humantime.exception.DurationParseException;
import lovesyk.humantime.service.format.FormattedDuration;

/**
 * The interface of services converting human durations.
 */
public interface IHumanTimeService {
    /**
     * Parses a human duration.
     * 
     * @param input the text to parse
     * @return the parsed duration
     * @throws DurationParseException if the input is not a valid duration
     */
    Duration parseDuration(String input) throws DurationParseException;

    /**
     * Formats a duration for display.
     * 
     * @param duration the non-negative duration
     * @return the formatted duration
     */
    FormattedDuration formatDuration(Duration duration);
}
