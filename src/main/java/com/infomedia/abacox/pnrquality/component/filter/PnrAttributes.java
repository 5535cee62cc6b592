package com.infomedia.abacox.pnrquality.component.filter;

import java.time.LocalDate;

/**
 * Dimension attributes of a PNR that filters can match on.
 */
public interface PnrAttributes {
    String getControlNumber();
    String getOfficeId();
    String getAgent();
    String getDeliverySystemCompany();
    String getDeliverySystemLocation();
    LocalDate getCreationDate();
}
