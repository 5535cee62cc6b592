package com.infomedia.abacox.pnrquality.service.report;

import com.infomedia.abacox.pnrquality.component.aggregation.BucketBy;
import com.infomedia.abacox.pnrquality.component.aggregation.DailyQuality;
import com.infomedia.abacox.pnrquality.component.aggregation.GroupBy;
import com.infomedia.abacox.pnrquality.component.aggregation.QualitySummary;
import com.infomedia.abacox.pnrquality.component.aggregation.RecordAggregator;
import com.infomedia.abacox.pnrquality.component.aggregation.ScoreBucket;
import com.infomedia.abacox.pnrquality.component.configmanager.ConfigService;
import com.infomedia.abacox.pnrquality.component.importing.PnrImportRow;
import com.infomedia.abacox.pnrquality.component.modeltools.ModelConverter;
import com.infomedia.abacox.pnrquality.config.CachingConfig;
import com.infomedia.abacox.pnrquality.dto.report.QualityFilterRequest;
import com.infomedia.abacox.pnrquality.service.PnrImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({QualityReportService.class, PnrImportService.class, RecordAggregator.class,
        ConfigService.class, ModelConverter.class, CachingConfig.class, ValidationAutoConfiguration.class})
@DisplayName("QualityReportService summary cache")
class QualitySummaryCachingTest {

    private static final ZoneId NAIROBI = ZoneId.of("Africa/Nairobi");
    private static final LocalDate DAY_ONE = LocalDate.of(2024, 1, 10);

    @TestConfiguration
    static class AdjustableClockConfig {
        @Bean
        AdjustableClock clock() {
            return new AdjustableClock(DAY_ONE.atStartOfDay(NAIROBI).plusHours(12).toInstant(), NAIROBI);
        }
    }

    @Autowired
    private QualityReportService qualityReportService;

    @Autowired
    private PnrImportService pnrImportService;

    @Autowired
    private AdjustableClock clock;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void loadData() {
        clock.setInstant(DAY_ONE.atStartOfDay(NAIROBI).plusHours(12).toInstant());
        PnrImportRow nextDay = PnrImportRow.builder()
                .controlNumber("NEXT01")
                .surname("DOE")
                .firstName("JOHN")
                .contactType("AP")
                .contactDetail("john@example.com")
                .officeId("NBO1")
                .deliverySystemCompany("1A")
                .creationDate("110124")
                .build();
        pnrImportService.importRows(List.of(nextDay));
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    void sameDayRequestIsServedFromCache() {
        QualityFilterRequest request = new QualityFilterRequest();

        QualitySummary first = qualityReportService.summarize(request, GroupBy.NONE, BucketBy.DAY, 3);
        QualitySummary second = qualityReportService.summarize(request, GroupBy.NONE, BucketBy.DAY, 3);

        assertThat(second).isSameAs(first);
    }

    @Test
    void trendFollowsTheDateAfterMidnight() {
        QualityFilterRequest request = new QualityFilterRequest();

        QualitySummary first = qualityReportService.summarize(request, GroupBy.NONE, BucketBy.DAY, 3);
        clock.advance(Duration.ofDays(1));
        QualitySummary second = qualityReportService.summarize(request, GroupBy.NONE, BucketBy.DAY, 3);

        assertThat(first.getDailyTrend()).last().extracting(DailyQuality::getDate).isEqualTo(DAY_ONE);
        assertThat(first.getDailyTrend()).last().extracting(DailyQuality::getCount).isEqualTo(0L);
        assertThat(second.getDailyTrend()).last().extracting(DailyQuality::getDate).isEqualTo(DAY_ONE.plusDays(1));
        assertThat(second.getDailyTrend()).last().extracting(DailyQuality::getCount).isEqualTo(1L);
    }

    @Test
    void cachedSummaryCannotBeAlteredByCallers() {
        QualitySummary summary = qualityReportService.summarize(new QualityFilterRequest(), GroupBy.OFFICE, BucketBy.DAY, 3);

        assertThatThrownBy(() -> summary.getDailyTrend().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> summary.getOfficeStats().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> summary.getScoreDistribution().put(ScoreBucket.UP_TO_20, 99L))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    static class AdjustableClock extends Clock {
        private Instant instant;
        private final ZoneId zone;

        AdjustableClock(Instant instant, ZoneId zone) {
            this.instant = instant;
            this.zone = zone;
        }

        void setInstant(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new AdjustableClock(instant, zone);
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
