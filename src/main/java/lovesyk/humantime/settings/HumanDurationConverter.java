package lovesyk.humantime.settings;

import java.time.Duration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lovesyk.humantime.HumanTime;
import lovesyk.humantime.exception.DurationParseException;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * The converter to process user-input durations such as <code>2h 37min</code>
 * on the command line.
 * <p>
 * Usage: <code>@Option(names = "--timeout", converter = HumanDurationConverter.class)</code>
 */
public class HumanDurationConverter implements ITypeConverter<Duration> {
    private static final Logger LOGGER = LogManager.getLogger(HumanDurationConverter.class);

    /**
     * {@inheritDoc}
     */
    @Override
    public Duration convert(String value) {
        try {
            return HumanTime.parseDuration(value);
        } catch (DurationParseException e) {
            LOGGER.debug("Could not convert \"{}\" to a duration.", value, e);
            throw new TypeConversionException("Invalid duration '" + value + "': " + e.getMessage());
        }
    }
}
