package com.infomedia.abacox.pnrquality.component.aggregation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read-only result of an aggregation. Its collections are unmodifiable.
 */
@Value
@Builder(toBuilder = true)
public class QualitySummary {
    long totalPnrs;
    long reachablePnrs;
    long unreachablePnrs;
    long pnrsMissingContact;
    long pnrsWithWrongFormat;
    long pnrsWithWronglyPlaced;
    long pnrsWithValidEmail;
    long pnrsWithValidPhone;
    long pnrsWithFrequentFlyer;
    long pnrsWithMeal;
    long pnrsWithSeat;

    BigDecimal averageScore;
    BigDecimal reachablePercentage;
    BigDecimal withContactsPercentage;
    // Contact level: wrong-format email-shaped contacts over all email-shaped contacts
    BigDecimal emailWrongFormatPercentage;
    BigDecimal phoneWrongFormatPercentage;

    Map<ScoreBucket, Long> scoreDistribution;
    List<DimensionStat> officeStats;
    List<DimensionStat> deliverySystemStats;
    List<DailyQuality> dailyTrend;
}
