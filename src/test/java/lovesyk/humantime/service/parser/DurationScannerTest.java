package lovesyk.humantime.service.parser;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DurationScannerTest {

    @Test
    void next_TracksUtf8ByteOffsets() {
        // Given
        DurationScanner scanner = new DurationScanner("1µs€");

        // When & Then
        assertThat(scanner.next()).isEqualTo('1');
        assertThat(scanner.offset()).isEqualTo(1);
        assertThat(scanner.next()).isEqualTo('µ');
        assertThat(scanner.offset()).isEqualTo(3);
        assertThat(scanner.index()).isEqualTo(2);
        assertThat(scanner.next()).isEqualTo('s');
        assertThat(scanner.next()).isEqualTo('€');
        assertThat(scanner.offset()).isEqualTo(7);
        assertThat(scanner.hasNext()).isFalse();
    }

    @Test
    void next_WithSupplementaryCodePoint_ConsumesSurrogatePair() {
        DurationScanner scanner = new DurationScanner("😀x");

        assertThat(scanner.next()).isEqualTo(0x1F600);
        assertThat(scanner.index()).isEqualTo(2);
        assertThat(scanner.offset()).isEqualTo(4);
        assertThat(scanner.peek()).isEqualTo('x');
    }

    @Test
    void peek_DoesNotConsume() {
        DurationScanner scanner = new DurationScanner("ab");

        assertThat(scanner.peek()).isEqualTo('a');
        assertThat(scanner.peek()).isEqualTo('a');
        assertThat(scanner.offset()).isZero();
        assertThat(scanner.substring(0, 2)).isEqualTo("ab");
    }
}
