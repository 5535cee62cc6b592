package com.infomedia.abacox.pnrquality.component.importing;

import lombok.extern.log4j.Log4j2;

import java.time.DateTimeException;
import java.time.LocalDate;

@Log4j2
public class DateTimeUtil {

    private static final int COMPACT_DATE_LENGTH = 6;
    private static final int CENTURY = 2000;

    /**
     * Parses the compact {@code ddMMyy} booking date ("010124" is 2024-01-01). A five digit
     * value is read with a leading zero ("10124" is 2024-01-01). Non-digit characters are
     * ignored. Anything that does not form a real date yields {@code null}.
     */
    public static LocalDate parseCompactDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String digits = value.replaceAll("\\D", "");
        if (digits.length() == COMPACT_DATE_LENGTH - 1) {
            digits = "0" + digits;
        }
        if (digits.length() != COMPACT_DATE_LENGTH) {
            log.debug("Ignoring creation date '{}': expected {} digits", value, COMPACT_DATE_LENGTH);
            return null;
        }
        int day = Integer.parseInt(digits.substring(0, 2));
        int month = Integer.parseInt(digits.substring(2, 4));
        int year = CENTURY + Integer.parseInt(digits.substring(4, 6));
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            log.debug("Ignoring creation date '{}': {}", value, e.getMessage());
            return null;
        }
    }
}
