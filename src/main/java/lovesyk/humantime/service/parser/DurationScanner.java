package lovesyk.humantime.service.parser;

/**
 * A forward-only cursor over the code points of a string which tracks the
 * UTF-8 byte offset alongside the char index.
 */
class DurationScanner {
    private final String input;
    private int index = 0;
    private int offset = 0;

    /**
     * Instantiates a new scanner positioned at the start of the input.
     * 
     * @param input the text to scan
     */
    DurationScanner(String input) {
        this.input = input;
    }

    /**
     * Whether unconsumed code points remain.
     * 
     * @return true if not exhausted, false otherwise
     */
    boolean hasNext() {
        return index < input.length();
    }

    /**
     * Gets the next code point without consuming it.
     * 
     * @return the code point
     */
    int peek() {
        return input.codePointAt(index);
    }

    /**
     * Consumes the next code point.
     * 
     * @return the code point
     */
    int next() {
        int codePoint = input.codePointAt(index);
        index += Character.charCount(codePoint);
        offset += utf8Length(codePoint);
        return codePoint;
    }

    /**
     * Gets the UTF-8 byte offset of the next unconsumed code point.
     * 
     * @return the byte offset
     */
    int offset() {
        return offset;
    }

    /**
     * Gets the char index of the next unconsumed code point.
     * 
     * @return the char index
     */
    int index() {
        return index;
    }

    /**
     * Gets a part of the scanned input.
     * 
     * @param beginIndex the char index to start at
     * @param endIndex   the char index to end at (exclusive)
     * @return the text in between
     */
    String substring(int beginIndex, int endIndex) {
        return input.substring(beginIndex, endIndex);
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
