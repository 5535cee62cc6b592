package com.infomedia.abacox.pnrquality.component.importing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DateTimeUtilTest {

    @Test
    void parsesSixDigitDayMonthYear() {
        assertThat(DateTimeUtil.parseCompactDate("010124")).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(DateTimeUtil.parseCompactDate("311299")).isEqualTo(LocalDate.of(2099, 12, 31));
    }

    @Test
    void padsFiveDigitsWithLeadingZero() {
        assertThat(DateTimeUtil.parseCompactDate("10124")).isEqualTo(LocalDate.of(2024, 1, 1));
    }

    @Test
    void ignoresSeparators() {
        assertThat(DateTimeUtil.parseCompactDate("15-03-24")).isEqualTo(LocalDate.of(2024, 3, 15));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"abc", "1234", "1501202", "320124", "011324", "290223"})
    void invalidInputYieldsNoDate(String value) {
        assertThat(DateTimeUtil.parseCompactDate(value)).isNull();
    }
}
