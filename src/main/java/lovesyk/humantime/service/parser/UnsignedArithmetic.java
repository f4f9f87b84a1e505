package lovesyk.humantime.service.parser;

import lovesyk.humantime.exception.DurationParseException;

/**
 * Overflow-checked arithmetic on unsigned 64-bit values stored in longs.
 */
final class UnsignedArithmetic {
    private UnsignedArithmetic() {
    }

    /**
     * Multiplies two unsigned values.
     * 
     * @param value      the unsigned value
     * @param multiplier the unsigned multiplier
     * @return the unsigned product
     * @throws DurationParseException if the product exceeds 64 bits
     */
    static long multiply(long value, long multiplier) throws DurationParseException {
        if (value == 0 || multiplier == 0) {
            return 0;
        }
        if (Long.compareUnsigned(value, Long.divideUnsigned(-1L, multiplier)) > 0) {
            throw DurationParseException.numberOverflow();
        }
        return value * multiplier;
    }

    /**
     * Adds two unsigned values.
     * 
     * @param value  the unsigned value
     * @param addend the unsigned addend
     * @return the unsigned sum
     * @throws DurationParseException if the sum exceeds 64 bits
     */
    static long add(long value, long addend) throws DurationParseException {
        long sum = value + addend;
        if (Long.compareUnsigned(sum, value) < 0) {
            throw DurationParseException.numberOverflow();
        }
        return sum;
    }
}
