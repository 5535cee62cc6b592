package com.infomedia.abacox.pnrquality.component.aggregation;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Rolls scored PNR snapshots up into a {@link QualitySummary} in a single pass over the
 * stream. Only counters are kept per dimension value and per day.
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class RecordAggregator {

    private static final Comparator<DimensionStat> BY_COUNT_THEN_KEY =
            Comparator.comparingLong(DimensionStat::getCount).reversed()
                    .thenComparing(DimensionStat::getKey);

    private final Clock clock;

    public QualitySummary aggregate(Stream<PnrSnapshot> snapshots, GroupBy groupBy, BucketBy bucketBy, int days) {
        return aggregate(snapshots, AggregationOptions.builder()
                .groupBy(groupBy)
                .bucketBy(bucketBy)
                .days(days)
                .build());
    }

    public QualitySummary aggregate(Stream<PnrSnapshot> snapshots, AggregationOptions options) {
        boolean trend = options.getBucketBy() == BucketBy.DAY;
        if (trend && options.getDays() < 1) {
            throw new IllegalArgumentException("Trend days must be at least 1, got " + options.getDays());
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate firstDay = today.minusDays(options.getDays() - 1L);

        Accumulator acc = new Accumulator(options.getGroupBy());
        Map<LocalDate, ScoreAccumulator> daily = new HashMap<>();

        snapshots.forEach(snapshot -> {
            if (options.getFilter().test(snapshot)) {
                acc.add(snapshot);
            }
            if (trend && options.getTrendFilter().test(snapshot)) {
                LocalDate date = snapshot.getCreationDate();
                if (date != null && !date.isBefore(firstDay) && !date.isAfter(today)) {
                    daily.computeIfAbsent(date, d -> new ScoreAccumulator()).add(snapshot.getScore());
                }
            }
        });

        QualitySummary summary = acc.toSummary();
        if (trend) {
            summary = summary.toBuilder().dailyTrend(toTrend(daily, firstDay, today)).build();
        }
        log.debug("Aggregated {} PNRs, groupBy={}, bucketBy={}, days={}",
                summary.getTotalPnrs(), options.getGroupBy(), options.getBucketBy(), options.getDays());
        return summary;
    }

    private static List<DailyQuality> toTrend(Map<LocalDate, ScoreAccumulator> daily, LocalDate firstDay, LocalDate today) {
        List<DailyQuality> trend = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(today); day = day.plusDays(1)) {
            ScoreAccumulator dayAcc = daily.getOrDefault(day, new ScoreAccumulator());
            trend.add(new DailyQuality(day, dayAcc.getCount(), dayAcc.getAverage()));
        }
        return List.copyOf(trend);
    }

    private static List<DimensionStat> toStats(Map<String, ScoreAccumulator> groups) {
        return groups.entrySet().stream()
                .map(entry -> new DimensionStat(entry.getKey(), entry.getValue().getCount(), entry.getValue().getAverage()))
                .sorted(BY_COUNT_THEN_KEY)
                .toList();
    }

    private static String keyOf(String value) {
        return value == null ? "" : value;
    }

    private static class Accumulator {
        private final boolean byOffice;
        private final boolean byDeliverySystem;

        private final ScoreAccumulator scores = new ScoreAccumulator();
        private long reachable;
        private long missingContact;
        private long wrongFormat;
        private long wronglyPlaced;
        private long validEmail;
        private long validPhone;
        private long frequentFlyer;
        private long meal;
        private long seat;
        private long emailContacts;
        private long emailWrongFormatContacts;
        private long phoneContacts;
        private long phoneWrongFormatContacts;

        private final Map<ScoreBucket, Long> distribution = new EnumMap<>(ScoreBucket.class);
        private final Map<String, ScoreAccumulator> offices = new HashMap<>();
        private final Map<String, ScoreAccumulator> deliverySystems = new HashMap<>();

        Accumulator(GroupBy groupBy) {
            this.byOffice = groupBy == GroupBy.OFFICE || groupBy == GroupBy.ALL;
            this.byDeliverySystem = groupBy == GroupBy.DELIVERY_SYSTEM || groupBy == GroupBy.ALL;
            for (ScoreBucket bucket : ScoreBucket.values()) {
                distribution.put(bucket, 0L);
            }
        }

        void add(PnrSnapshot snapshot) {
            scores.add(snapshot.getScore());
            if (snapshot.isReachable()) reachable++;
            if (snapshot.getContactCount() == 0) missingContact++;
            if (snapshot.isWrongFormat()) wrongFormat++;
            if (snapshot.isWronglyPlaced()) wronglyPlaced++;
            if (snapshot.isValidEmail()) validEmail++;
            if (snapshot.isValidPhone()) validPhone++;
            if (snapshot.isFrequentFlyer()) frequentFlyer++;
            if (snapshot.isMeal()) meal++;
            if (snapshot.isSeat()) seat++;
            emailContacts += snapshot.getEmailContacts();
            emailWrongFormatContacts += snapshot.getEmailWrongFormatContacts();
            phoneContacts += snapshot.getPhoneContacts();
            phoneWrongFormatContacts += snapshot.getPhoneWrongFormatContacts();

            distribution.merge(ScoreBucket.of(snapshot.getScore()), 1L, Long::sum);
            if (byOffice) {
                offices.computeIfAbsent(keyOf(snapshot.getOfficeId()), k -> new ScoreAccumulator())
                        .add(snapshot.getScore());
            }
            if (byDeliverySystem) {
                deliverySystems.computeIfAbsent(keyOf(snapshot.getDeliverySystemCompany()), k -> new ScoreAccumulator())
                        .add(snapshot.getScore());
            }
        }

        QualitySummary toSummary() {
            long total = scores.getCount();
            return QualitySummary.builder()
                    .totalPnrs(total)
                    .reachablePnrs(reachable)
                    .unreachablePnrs(total - reachable)
                    .pnrsMissingContact(missingContact)
                    .pnrsWithWrongFormat(wrongFormat)
                    .pnrsWithWronglyPlaced(wronglyPlaced)
                    .pnrsWithValidEmail(validEmail)
                    .pnrsWithValidPhone(validPhone)
                    .pnrsWithFrequentFlyer(frequentFlyer)
                    .pnrsWithMeal(meal)
                    .pnrsWithSeat(seat)
                    .averageScore(scores.getAverage())
                    .reachablePercentage(Percentages.of(reachable, total))
                    .withContactsPercentage(Percentages.of(total - missingContact, total))
                    .emailWrongFormatPercentage(Percentages.of(emailWrongFormatContacts, emailContacts))
                    .phoneWrongFormatPercentage(Percentages.of(phoneWrongFormatContacts, phoneContacts))
                    .scoreDistribution(Collections.unmodifiableMap(distribution))
                    .officeStats(byOffice ? toStats(offices) : List.of())
                    .deliverySystemStats(byDeliverySystem ? toStats(deliverySystems) : List.of())
                    .dailyTrend(List.of())
                    .build();
        }
    }
}
