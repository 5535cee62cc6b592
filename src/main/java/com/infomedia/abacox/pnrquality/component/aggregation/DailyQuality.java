package com.infomedia.abacox.pnrquality.component.aggregation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class DailyQuality {
    LocalDate date;
    long count;
    BigDecimal averageScore;
}
