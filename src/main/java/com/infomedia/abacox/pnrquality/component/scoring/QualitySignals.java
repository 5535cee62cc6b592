package com.infomedia.abacox.pnrquality.component.scoring;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The four all-or-nothing completeness checks of a PNR.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class QualitySignals {
    private final boolean validContact;
    private final boolean frequentFlyer;
    private final boolean meal;
    private final boolean seat;

    public static final QualitySignals NONE = new QualitySignals(false, false, false, false);
}
