package com.infomedia.abacox.pnrquality.component.scoring;

/**
 * The contact fields the scorer reads, whether they come from an entity or a flat query row.
 */
public interface ContactLine {
    Long getPnrId();
    String getContactType();
    String getContactDetail();
}
