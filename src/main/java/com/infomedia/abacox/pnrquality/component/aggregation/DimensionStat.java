package com.infomedia.abacox.pnrquality.component.aggregation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DimensionStat {
    String key;
    long count;
    BigDecimal averageScore;
}
