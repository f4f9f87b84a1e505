package lovesyk.humantime.exception;

/**
 * The kind of failure encountered while parsing a duration.
 */
public enum ParseErrorType {
    /**
     * The input was empty or consisted of white space only.
     */
    EMPTY,

    /**
     * A character which is neither a digit, a unit letter nor white space was
     * encountered.
     */
    INVALID_CHARACTER,

    /**
     * A number had to start but something else was found, usually because a unit
     * was split into words (<code>m sec</code>) or a number was omitted
     * (<code>2hours min</code>).
     */
    NUMBER_EXPECTED,

    /**
     * The unit following a number is not a supported one or missing entirely.
     */
    UNKNOWN_UNIT,

    /**
     * A number or the accumulated duration does not fit into the supported range.
     */
    NUMBER_OVERFLOW
}
