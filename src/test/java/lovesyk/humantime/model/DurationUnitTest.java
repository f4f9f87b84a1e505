package lovesyk.humantime.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class DurationUnitTest {

    @Test
    void fromSpelling_WithEverySpelling_ReturnsOwningUnit() {
        for (DurationUnit unit : DurationUnit.values()) {
            for (String spelling : unit.getSpellings()) {
                assertThat(DurationUnit.fromSpelling(spelling)).as(spelling).isSameAs(unit);
            }
        }
    }

    @Test
    void fromSpelling_IsCaseSensitive() {
        assertThat(DurationUnit.fromSpelling("M")).isEqualTo(DurationUnit.MONTH);
        assertThat(DurationUnit.fromSpelling("m")).isEqualTo(DurationUnit.MINUTE);
        assertThat(DurationUnit.fromSpelling("H")).isNull();
        assertThat(DurationUnit.fromSpelling("Sec")).isNull();
    }

    @Test
    void fromSpelling_WithUnknownOrEmptySpelling_ReturnsNull() {
        assertThat(DurationUnit.fromSpelling("nights")).isNull();
        assertThat(DurationUnit.fromSpelling("")).isNull();
    }

    @Test
    void spellings_AreUniqueAcrossUnits() {
        Set<String> seen = new HashSet<>();
        for (DurationUnit unit : DurationUnit.values()) {
            for (String spelling : unit.getSpellings()) {
                assertThat(seen.add(spelling)).as(spelling).isTrue();
            }
        }
    }

    @Test
    void multipliers_MatchCalendarAverages() {
        assertThat(DurationUnit.WEEK.getMultiplier()).isEqualTo(604_800L);
        // 30.44 days
        assertThat(DurationUnit.MONTH.getMultiplier()).isEqualTo(2_630_016L);
        // 365.25 days
        assertThat(DurationUnit.YEAR.getMultiplier()).isEqualTo(31_557_600L);
    }

    @Test
    void subsecondUnits_AreExpressedInNanoseconds() {
        assertThat(DurationUnit.NANOSECOND.isSubsecond()).isTrue();
        assertThat(DurationUnit.MICROSECOND.getMultiplier()).isEqualTo(1_000L);
        assertThat(DurationUnit.MILLISECOND.getMultiplier()).isEqualTo(1_000_000L);
        assertThat(DurationUnit.SECOND.isSubsecond()).isFalse();
    }

    @Test
    void values_AreOrderedFromSmallestToLargest() {
        DurationUnit[] units = DurationUnit.values();
        for (int i = 1; i < units.length; ++i) {
            if (units[i - 1].isSubsecond() == units[i].isSubsecond()) {
                assertThat(units[i].getMultiplier()).isGreaterThan(units[i - 1].getMultiplier());
            }
        }
    }
}
