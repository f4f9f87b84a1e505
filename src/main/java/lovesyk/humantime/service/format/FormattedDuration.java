package lovesyk.humantime.service.format;

import java.time.Duration;

/**
 * A duration wrapper which renders it in human-readable form on
 * {@link #toString()}.
 * <p>
 * Instances are obtained from {@link DurationFormatter#format(Duration)}.
 */
public class FormattedDuration {
    private final Duration duration;

    /**
     * Instantiates a new wrapper.
     * 
     * @param duration the non-negative duration to wrap
     */
    FormattedDuration(Duration duration) {
        this.duration = duration;
    }

    /**
     * Gets the wrapped duration.
     * 
     * @return the duration
     */
    public Duration getDuration() {
        return duration;
    }

    /**
     * Renders the duration, e.g. <code>2h 37m</code>.
     */
    @Override
    public String toString() {
        return DurationFormatter.render(duration);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FormattedDuration)) {
            return false;
        }
        return duration.equals(((FormattedDuration) obj).duration);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return duration.hashCode();
    }
}
