package com.infomedia.abacox.pnrquality.component.contactquality;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ContactClassification {
    private final boolean email;
    private final boolean phone;
    private final boolean validEmail;
    private final boolean validPhone;
    private final boolean wronglyPlaced;
    // Non-blank detail that is neither a valid email nor a valid phone for its declared type
    private final boolean wrongFormat;
    private final String normalizedDetail;

    public boolean isReachable() {
        return validEmail || validPhone;
    }
}
