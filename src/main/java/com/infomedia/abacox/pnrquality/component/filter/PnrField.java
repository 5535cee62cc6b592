package com.infomedia.abacox.pnrquality.component.filter;

import lombok.Getter;

import java.time.LocalDate;
import java.util.function.Function;

/**
 * PNR attributes a filter can target, with the entity attribute name used in storage queries.
 */
@Getter
public enum PnrField {

    CONTROL_NUMBER("controlNumber", PnrAttributes::getControlNumber),
    OFFICE_ID("officeId", PnrAttributes::getOfficeId),
    AGENT("agent", PnrAttributes::getAgent),
    DELIVERY_SYSTEM_COMPANY("deliverySystemCompany", PnrAttributes::getDeliverySystemCompany),
    DELIVERY_SYSTEM_LOCATION("deliverySystemLocation", PnrAttributes::getDeliverySystemLocation),
    CREATION_DATE("creationDate", pnr -> pnr.getCreationDate() == null ? null : pnr.getCreationDate().toString());

    private final String attribute;
    private final Function<PnrAttributes, String> accessor;

    PnrField(String attribute, Function<PnrAttributes, String> accessor) {
        this.attribute = attribute;
        this.accessor = accessor;
    }

    public boolean isDate() {
        return this == CREATION_DATE;
    }

    String read(PnrAttributes pnr) {
        return accessor.apply(pnr);
    }

    LocalDate readDate(PnrAttributes pnr) {
        return pnr.getCreationDate();
    }
}
