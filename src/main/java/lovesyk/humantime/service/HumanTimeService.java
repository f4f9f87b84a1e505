package lovesyk.humantime.service;

import java.time.Duration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import lovesyk.humantime.HumanTime;
import lovesyk.humantime.exception.DurationParseException;
import lovesyk.humantime.service.api.IHumanTimeService;
import lovesyk.humantime.service.format.FormattedDuration;

/**
 * The injectable service for converting human durations.
 */
@ApplicationScoped
public class HumanTimeService implements IHumanTimeService {
    private static final Logger LOGGER = LogManager.getLogger(HumanTimeService.class);

    /**
     * {@inheritDoc}
     */
    @Override
    public Duration parseDuration(String input) throws DurationParseException {
        LOGGER.debug("Parsing duration \"{}\"...", input);
        try {
            Duration duration = HumanTime.parseDuration(input);
            LOGGER.trace("Parsed duration \"{}\" as {}.", input, duration);
            return duration;
        } catch (DurationParseException e) {
            LOGGER.debug("Rejected duration \"{}\": {}", input, e.getMessage());
            throw e;
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public FormattedDuration formatDuration(Duration duration) {
        LOGGER.trace("Formatting duration {}...", duration);
        return HumanTime.formatDuration(duration);
    }
}
