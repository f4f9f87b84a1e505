package lovesyk.humantime.service.parser;

import java.time.Duration;
import java.util.Objects;

import lovesyk.humantime.exception.DurationParseException;
import lovesyk.humantime.model.DurationUnit;

/**
 * The parser for human durations such as <code>1hour 12min 5s</code>.
 * <p>
 * A duration is a sequence of <code>&lt;number&gt;&lt;unit&gt;</code> spans.
 * White space may separate spans but may not split a number, a unit or a
 * number from its unit. Spans may also follow each other directly, e.g.
 * <code>1h2m</code>. The input is scanned once from left to right and the
 * first problem found is reported.
 * <p>
 * Instances hold the running total of a single parse and are not reused.
 */
public class DurationParser {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final char MICRO_SIGN = 'µ';
    private static final char TAB = '\t';
    private static final char CARRIAGE_RETURN = '\r';
    private static final char NEXT_LINE = '\u0085';

    private final DurationScanner scanner;
    private long seconds = 0;
    private long nanos = 0;

    private DurationParser(String input) {
        this.scanner = new DurationScanner(input);
    }

    /**
     * Parses a human duration.
     * 
     * @param input the text to parse
     * @return the non-negative duration
     * @throws DurationParseException if the input is not a valid duration
     */
    public static Duration parse(String input) throws DurationParseException {
        Objects.requireNonNull(input, "input");
        if (isBlank(input)) {
            throw DurationParseException.empty();
        }
        return new DurationParser(input).parse();
    }

    /**
     * Runs the scan over all spans of the input.
     * 
     * @return the accumulated duration
     * @throws DurationParseException on invalid input
     */
    private Duration parse() throws DurationParseException {
        Long number = parseFirstDigit();
        if (number == null) {
            throw DurationParseException.empty();
        }
        while (number != null) {
            long value = parseNumber(number);
            parseUnit(value);
            number = parseFirstDigit();
        }

        if (seconds < 0) {
            // beyond the signed range of java.time.Duration
            throw DurationParseException.numberOverflow();
        }
        return Duration.ofSeconds(seconds, nanos);
    }

    /**
     * Skips white space and consumes the first digit of the next number.
     * 
     * @return the digit value or null if the input is exhausted
     * @throws DurationParseException if something other than a digit is found
     */
    private Long parseFirstDigit() throws DurationParseException {
        while (scanner.hasNext()) {
            int codePoint = scanner.peek();
            if (isDigit(codePoint)) {
                scanner.next();
                return (long) (codePoint - '0');
            } else if (!isWhitespace(codePoint)) {
                throw DurationParseException.numberExpected(scanner.offset());
            }
            scanner.next();
        }
        return null;
    }

    /**
     * Consumes the remaining digits of a number up to the first letter of its
     * unit.
     * 
     * @param firstDigit the already consumed first digit
     * @return the unsigned number
     * @throws DurationParseException on invalid characters or overflow
     */
    private long parseNumber(long firstDigit) throws DurationParseException {
        long number = firstDigit;
        while (scanner.hasNext()) {
            int codePoint = scanner.peek();
            if (isUnitLetter(codePoint)) {
                break;
            } else if (isDigit(codePoint)) {
                number = UnsignedArithmetic.add(UnsignedArithmetic.multiply(number, 10), codePoint - '0');
            } else {
                throw DurationParseException.invalidCharacter(scanner.offset());
            }
            scanner.next();
        }
        return number;
    }

    /**
     * Consumes a unit and adds its span to the running total.
     * <p>
     * The unit ends before the next white space or digit, which are left for the
     * next number. A number at the end of the input ends up with an empty unit.
     * 
     * @param number the unsigned number the unit belongs to
     * @throws DurationParseException on invalid characters, unknown units or
     *                                overflow
     */
    private void parseUnit(long number) throws DurationParseException {
        int start = scanner.offset();
        int startIndex = scanner.index();
        while (scanner.hasNext()) {
            int codePoint = scanner.peek();
            if (isDigit(codePoint) || isWhitespace(codePoint)) {
                break;
            } else if (!isUnitLetter(codePoint)) {
                throw DurationParseException.invalidCharacter(scanner.offset());
            }
            scanner.next();
        }

        String spelling = scanner.substring(startIndex, scanner.index());
        DurationUnit unit = DurationUnit.fromSpelling(spelling);
        if (unit == null) {
            throw DurationParseException.unknownUnit(start, scanner.offset(), spelling, number);
        }
        add(number, unit);
    }

    /**
     * Adds the given amount of a unit to the running total.
     * 
     * @param number the unsigned amount
     * @param unit   the unit
     * @throws DurationParseException on overflow
     */
    private void add(long number, DurationUnit unit) throws DurationParseException {
        long spanSeconds = 0;
        long spanNanos = 0;
        if (unit.isSubsecond()) {
            spanNanos = UnsignedArithmetic.multiply(number, unit.getMultiplier());
        } else {
            spanSeconds = UnsignedArithmetic.multiply(number, unit.getMultiplier());
        }

        long totalNanos = UnsignedArithmetic.add(nanos, spanNanos);
        if (Long.compareUnsigned(totalNanos, NANOS_PER_SECOND) >= 0) {
            spanSeconds = UnsignedArithmetic.add(spanSeconds, Long.divideUnsigned(totalNanos, NANOS_PER_SECOND));
            totalNanos = Long.remainderUnsigned(totalNanos, NANOS_PER_SECOND);
        }
        seconds = UnsignedArithmetic.add(seconds, spanSeconds);
        nanos = totalNanos;
    }

    private static boolean isBlank(String input) {
        return input.codePoints().allMatch(DurationParser::isWhitespace);
    }

    private static boolean isDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }

    private static boolean isUnitLetter(int codePoint) {
        return (codePoint >= 'a' && codePoint <= 'z') || (codePoint >= 'A' && codePoint <= 'Z') || codePoint == MICRO_SIGN;
    }

    /**
     * Whether the code point has the Unicode White_Space property.
     * <p>
     * Space separators plus the controls U+0009 to U+000D and U+0085.
     * 
     * @param codePoint the code point to check
     * @return true if white space, false otherwise
     */
    private static boolean isWhitespace(int codePoint) {
        return (codePoint >= TAB && codePoint <= CARRIAGE_RETURN) || codePoint == NEXT_LINE || Character.isSpaceChar(codePoint);
    }
}
