package com.infomedia.abacox.pnrquality.component.contactquality;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Contact element codes found in PNRs and the shapes each one may legitimately hold.
 */
@Getter
public enum ContactType {

    AP(true, true),
    APE(true, false),
    CTCE(true, false),
    APM(false, true),
    CTCM(false, true),
    // Legacy combined element, accepted by neither shape
    CTCEM(false, false);

    private final boolean emailAllowed;
    private final boolean phoneAllowed;

    ContactType(boolean emailAllowed, boolean phoneAllowed) {
        this.emailAllowed = emailAllowed;
        this.phoneAllowed = phoneAllowed;
    }

    /**
     * Resolves a declared code, ignoring case and surrounding whitespace.
     *
     * @param code the raw code from the source system
     * @return the matching type, or empty for null, blank or unknown codes
     */
    public static Optional<ContactType> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }
}
