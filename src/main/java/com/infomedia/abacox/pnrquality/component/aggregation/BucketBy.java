package com.infomedia.abacox.pnrquality.component.aggregation;

public enum BucketBy {
    NONE,
    DAY
}
