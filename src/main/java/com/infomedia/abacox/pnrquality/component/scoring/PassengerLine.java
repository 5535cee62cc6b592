package com.infomedia.abacox.pnrquality.component.scoring;

/**
 * The passenger completeness fields the scorer reads.
 */
public interface PassengerLine {
    Long getPnrId();
    String getFfNumber();
    String getMeal();
    String getSeatRowNumber();
    String getSeatColumn();
}
