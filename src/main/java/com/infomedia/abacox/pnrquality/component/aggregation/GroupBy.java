package com.infomedia.abacox.pnrquality.component.aggregation;

public enum GroupBy {
    NONE,
    OFFICE,
    DELIVERY_SYSTEM,
    /** Both dimension breakdowns. */
    ALL
}
