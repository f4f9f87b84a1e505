package lovesyk.humantime.exception;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * The exception used for human duration input that cannot be parsed.
 * <p>
 * All offsets are UTF-8 byte offsets into the parsed input. The exception does
 * not keep a reference to the input itself.
 */
public class DurationParseException extends Exception {
    private static final long serialVersionUID = 3092671846129578420L;
    private static final int NO_OFFSET = -1;

    private final ParseErrorType type;
    private final int offset;
    private final int start;
    private final int end;
    private final String unit;
    private final long value;

    private DurationParseException(ParseErrorType type, int offset, int start, int end, String unit, long value) {
        super(describe(type, offset, unit, value));
        this.type = type;
        this.offset = offset;
        this.start = start;
        this.end = end;
        this.unit = unit;
        this.value = value;
    }

    /**
     * Creates the exception for empty or blank input.
     * 
     * @return the exception
     */
    public static DurationParseException empty() {
        return new DurationParseException(ParseErrorType.EMPTY, NO_OFFSET, NO_OFFSET, NO_OFFSET, null, 0);
    }

    /**
     * Creates the exception for an unexpected character.
     * 
     * @param offset the byte offset of the character
     * @return the exception
     */
    public static DurationParseException invalidCharacter(int offset) {
        return new DurationParseException(ParseErrorType.INVALID_CHARACTER, offset, NO_OFFSET, NO_OFFSET, null, 0);
    }

    /**
     * Creates the exception for a missing number.
     * 
     * @param offset the byte offset of the character found instead
     * @return the exception
     */
    public static DurationParseException numberExpected(int offset) {
        return new DurationParseException(ParseErrorType.NUMBER_EXPECTED, offset, NO_OFFSET, NO_OFFSET, null, 0);
    }

    /**
     * Creates the exception for an unsupported or missing unit.
     * 
     * @param start the byte offset the unit starts at
     * @param end   the byte offset the unit ends at (exclusive)
     * @param unit  the unit verbatim, empty if none was given
     * @param value the number associated with the unit, unsigned
     * @return the exception
     */
    public static DurationParseException unknownUnit(int start, int end, String unit, long value) {
        return new DurationParseException(ParseErrorType.UNKNOWN_UNIT, NO_OFFSET, start, end, Objects.requireNonNull(unit), value);
    }

    /**
     * Creates the exception for a value exceeding the supported range.
     * 
     * @return the exception
     */
    public static DurationParseException numberOverflow() {
        return new DurationParseException(ParseErrorType.NUMBER_OVERFLOW, NO_OFFSET, NO_OFFSET, NO_OFFSET, null, 0);
    }

    private static String describe(ParseErrorType type, int offset, String unit, long value) {
        switch (type) {
        case INVALID_CHARACTER:
            return "invalid character at " + offset;
        case NUMBER_EXPECTED:
            return "expected number at " + offset;
        case UNKNOWN_UNIT:
            if (StringUtils.isEmpty(unit)) {
                String number = Long.toUnsignedString(value);
                return "time unit needed, for example " + number + "sec or " + number + "ms";
            }
            return "unknown time unit \"" + unit + "\", supported units: ns, us, ms, sec, min, hours, days, weeks, months, years (and few variations)";
        case NUMBER_OVERFLOW:
            return "number is too large";
        case EMPTY:
        default:
            return "value was empty";
        }
    }

    /**
     * Gets the kind of failure.
     * 
     * @return the error type
     */
    public ParseErrorType getType() {
        return type;
    }

    /**
     * Gets the byte offset of the offending character.
     * 
     * @return the offset or -1 if the error type does not refer to a single
     *         character
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Gets the byte offset the unknown unit starts at.
     * 
     * @return the start offset or -1 if not an unknown unit error
     */
    public int getStart() {
        return start;
    }

    /**
     * Gets the byte offset the unknown unit ends at (exclusive).
     * 
     * @return the end offset or -1 if not an unknown unit error
     */
    public int getEnd() {
        return end;
    }

    /**
     * Gets the unknown unit verbatim.
     * 
     * @return the unit, empty if the number had no unit at all, null if not an
     *         unknown unit error
     */
    public String getUnit() {
        return unit;
    }

    /**
     * Gets the number the unknown unit was attached to.
     * <p>
     * The value is unsigned, use {@link Long#toUnsignedString(long)} to display
     * it.
     * 
     * @return the number or 0 if not an unknown unit error
     */
    public long getValue() {
        return value;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DurationParseException)) {
            return false;
        }
        DurationParseException other = (DurationParseException) obj;
        return type == other.type && offset == other.offset && start == other.start && end == other.end && value == other.value
                && Objects.equals(unit, other.unit);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return Objects.hash(type, offset, start, end, unit, value);
    }
}
