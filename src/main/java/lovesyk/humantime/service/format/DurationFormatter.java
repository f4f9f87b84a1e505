package lovesyk.humantime.service.format;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import lovesyk.humantime.model.DurationUnit;

/**
 * The formatter turning durations into the same unit vocabulary the parser
 * accepts, largest unit first.
 */
public class DurationFormatter {
    private static final String ZERO = "0s";
    private static final String PLURAL_SUFFIX = "s";

    // largest first, units without a suffix are left out
    static final List<DurationUnit> SECOND_UNITS;
    static final List<DurationUnit> SUBSECOND_UNITS;

    static {
        List<DurationUnit> secondUnits = new ArrayList<>();
        List<DurationUnit> subsecondUnits = new ArrayList<>();
        DurationUnit[] units = DurationUnit.values();
        for (int i = units.length - 1; i >= 0; --i) {
            DurationUnit unit = units[i];
            if (unit.getSuffix() == null) {
                continue;
            }
            (unit.isSubsecond() ? subsecondUnits : secondUnits).add(unit);
        }
        SECOND_UNITS = Collections.unmodifiableList(secondUnits);
        SUBSECOND_UNITS = Collections.unmodifiableList(subsecondUnits);
    }

    private DurationFormatter() {
    }

    /**
     * Wraps a duration for deferred human-readable rendering.
     * 
     * @param duration the duration to format
     * @return the wrapper rendering on {@link Object#toString()}
     * @throws IllegalArgumentException if the duration is negative
     */
    public static FormattedDuration format(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Negative durations cannot be formatted: " + duration);
        }
        return new FormattedDuration(duration);
    }

    /**
     * Renders a non-negative duration, e.g. <code>1year 2months 3h 32ms</code>.
     * 
     * @param duration the duration
     * @return the human-readable form
     */
    static String render(Duration duration) {
        long seconds = duration.getSeconds();
        long nanos = duration.getNano();
        if (seconds == 0 && nanos == 0) {
            return ZERO;
        }

        List<String> components = new ArrayList<>();
        long remainder = seconds;
        for (DurationUnit unit : SECOND_UNITS) {
            addComponent(components, unit, remainder / unit.getMultiplier());
            remainder %= unit.getMultiplier();
        }
        remainder = nanos;
        for (DurationUnit unit : SUBSECOND_UNITS) {
            addComponent(components, unit, remainder / unit.getMultiplier());
            remainder %= unit.getMultiplier();
        }
        return StringUtils.join(components, StringUtils.SPACE);
    }

    private static void addComponent(List<String> components, DurationUnit unit, long value) {
        if (value == 0) {
            return;
        }
        String component = value + unit.getSuffix();
        if (unit.isPluralized() && value > 1) {
            component += PLURAL_SUFFIX;
        }
        components.add(component);
    }
}
