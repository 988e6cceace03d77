package com.example.peak.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class DateUtilsTest {

    @Test
    void parsesSeveralFormats() {
        LocalDate expected = LocalDate.of(2025, 12, 3);

        assertThat(DateUtils.parseFlexibleDate("2025-12-03")).isEqualTo(expected);
        assertThat(DateUtils.parseFlexibleDate("2025/12/3")).isEqualTo(expected);
        assertThat(DateUtils.parseFlexibleDate("20251203")).isEqualTo(expected);
        assertThat(DateUtils.parseFlexibleDate("Dec 3, 2025")).isEqualTo(expected);
    }

    @Test
    void unsupportedFormatThrowsIllegalArgument() {
        assertThatThrownBy(() -> DateUtils.parseFlexibleDate("03.12.25"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unsupported date format");
        assertThatThrownBy(() -> DateUtils.parseFlexibleDate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partsMustFormARealDateInRange() {
        assertThat(DateUtils.yyyymmddFromParts("2025", "12", "3")).isEqualTo("20251203");
        assertThat(DateUtils.yyyymmddFromParts("2025", "02", "30")).isEmpty();
        assertThat(DateUtils.yyyymmddFromParts("1999", "12", "31")).isEmpty();
        assertThat(DateUtils.yyyymmddFromParts("x", "1", "1")).isEmpty();
    }

    @Test
    void labeledDateBeatsFirstDateInText() {
        String text = "Printed 2025-01-05\nInvoice Date: 2025-12-03";

        assertThat(DateUtils.docDateFromText(text)).isEqualTo("20251203");
        assertThat(DateUtils.docDateFromText("Printed 2025-01-05")).isEqualTo("20250105");
        assertThat(DateUtils.docDateFromText("no date here")).isEmpty();
    }

    @Test
    void validatesCompactDates() {
        assertThat(DateUtils.isValidYyyymmdd("20240229")).isTrue();
        assertThat(DateUtils.isValidYyyymmdd("20250229")).isFalse();
        assertThat(DateUtils.isValidYyyymmdd("2025-12-03")).isFalse();
    }

    @Test
    void docDateRejectsImpossibleAndOutOfRangeDates() {
        assertThat(DateUtils.toDocDate("DEC 3, 2025")).isEqualTo("20251203");
        assertThat(DateUtils.toDocDate("2025-02-30")).isEmpty();
        assertThat(DateUtils.toDocDate("1999-12-31")).isEmpty();
        assertThat(DateUtils.toDocDate("")).isEmpty();
    }
}
