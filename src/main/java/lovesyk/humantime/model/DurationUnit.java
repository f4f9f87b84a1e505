package lovesyk.humantime.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The time units understood in human durations, ordered from smallest to
 * largest.
 * <p>
 * Sub-second units carry a multiplier in nanoseconds, all others one in
 * seconds. Months and years use averaged lengths of 30.44 and 365.25 days.
 * Spellings are case-sensitive, <code>M</code> is a month while
 * <code>m</code> is a minute.
 */
public enum DurationUnit {
    NANOSECOND(true, 1L, "ns", false, "ns", "nsec", "nanos"),
    MICROSECOND(true, 1_000L, "µs", false, "us", "µs", "usec"),
    MILLISECOND(true, 1_000_000L, "ms", false, "ms", "msec", "millis"),
    SECOND(false, 1L, "s", false, "s", "sec", "secs", "second", "seconds"),
    MINUTE(false, 60L, "m", false, "m", "min", "mins", "minute", "minutes"),
    HOUR(false, 3_600L, "h", false, "h", "hr", "hrs", "hour", "hours"),
    DAY(false, 86_400L, "day", true, "d", "day", "days"),
    // not used for formatting, weeks are rendered as days
    WEEK(false, 86_400L * 7, null, false, "w", "week", "weeks"),
    MONTH(false, 2_630_016L, "month", true, "M", "month", "months"),
    YEAR(false, 31_557_600L, "year", true, "y", "year", "years");

    private static final Map<String, DurationUnit> BY_SPELLING;

    static {
        Map<String, DurationUnit> bySpelling = new HashMap<>();
        for (DurationUnit unit : values()) {
            for (String spelling : unit.spellings) {
                bySpelling.put(spelling, unit);
            }
        }
        BY_SPELLING = Collections.unmodifiableMap(bySpelling);
    }

    private final boolean subsecond;
    private final long multiplier;
    private final String suffix;
    private final boolean pluralized;
    private final List<String> spellings;

    DurationUnit(boolean subsecond, long multiplier, String suffix, boolean pluralized, String... spellings) {
        this.subsecond = subsecond;
        this.multiplier = multiplier;
        this.suffix = suffix;
        this.pluralized = pluralized;
        this.spellings = Collections.unmodifiableList(Arrays.asList(spellings));
    }

    /**
     * Looks up the unit for the given spelling.
     * 
     * @param spelling the unit as written by the user
     * @return the matching unit or null if the spelling is unknown
     */
    public static DurationUnit fromSpelling(String spelling) {
        return BY_SPELLING.get(spelling);
    }

    /**
     * Whether the multiplier is expressed in nanoseconds rather than seconds.
     * 
     * @return true for nano-, micro- and milliseconds, false otherwise
     */
    public boolean isSubsecond() {
        return subsecond;
    }

    /**
     * Gets the length of one unit in nanoseconds for sub-second units or in
     * seconds for all others.
     * 
     * @return the multiplier
     */
    public long getMultiplier() {
        return multiplier;
    }

    /**
     * Gets the suffix used when formatting durations.
     * 
     * @return the suffix or null if the unit is never formatted
     */
    public String getSuffix() {
        return suffix;
    }

    /**
     * Whether formatted values greater than one get a trailing <code>s</code>.
     * 
     * @return true if pluralized, false otherwise
     */
    public boolean isPluralized() {
        return pluralized;
    }

    /**
     * Gets all accepted spellings of this unit.
     * 
     * @return the spellings
     */
    public List<String> getSpellings() {
        return spellings;
    }
}
