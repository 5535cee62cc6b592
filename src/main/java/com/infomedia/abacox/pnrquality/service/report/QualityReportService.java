package com.infomedia.abacox.pnrquality.service.report;

import com.infomedia.abacox.pnrquality.component.aggregation.AggregationOptions;
import com.infomedia.abacox.pnrquality.component.aggregation.BucketBy;
import com.infomedia.abacox.pnrquality.component.aggregation.GroupBy;
import com.infomedia.abacox.pnrquality.component.aggregation.PnrSnapshot;
import com.infomedia.abacox.pnrquality.component.aggregation.QualitySummary;
import com.infomedia.abacox.pnrquality.component.aggregation.RecordAggregator;
import com.infomedia.abacox.pnrquality.component.configmanager.ConfigKey;
import com.infomedia.abacox.pnrquality.component.configmanager.ConfigService;
import com.infomedia.abacox.pnrquality.component.contactquality.ContactClassification;
import com.infomedia.abacox.pnrquality.component.contactquality.ContactClassifier;
import com.infomedia.abacox.pnrquality.component.filter.PnrFilter;
import com.infomedia.abacox.pnrquality.component.filter.PnrSpecifications;
import com.infomedia.abacox.pnrquality.component.modeltools.ModelConverter;
import com.infomedia.abacox.pnrquality.component.scoring.QualityBand;
import com.infomedia.abacox.pnrquality.component.scoring.QualityScorer;
import com.infomedia.abacox.pnrquality.component.scoring.QualitySignals;
import com.infomedia.abacox.pnrquality.component.scoring.SignalIndex;
import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import com.infomedia.abacox.pnrquality.db.projection.ContactSignalRow;
import com.infomedia.abacox.pnrquality.db.projection.PassengerSignalRow;
import com.infomedia.abacox.pnrquality.db.projection.PnrDimensionRow;
import com.infomedia.abacox.pnrquality.db.repository.ContactRepository;
import com.infomedia.abacox.pnrquality.db.repository.PassengerRepository;
import com.infomedia.abacox.pnrquality.db.repository.PnrRepository;
import com.infomedia.abacox.pnrquality.dto.pnr.ContactQualityDto;
import com.infomedia.abacox.pnrquality.dto.pnr.PassengerDto;
import com.infomedia.abacox.pnrquality.dto.pnr.PnrDto;
import com.infomedia.abacox.pnrquality.dto.pnr.PnrQualityDto;
import com.infomedia.abacox.pnrquality.dto.report.PnrScoreDto;
import com.infomedia.abacox.pnrquality.dto.report.QualityFilterRequest;
import com.infomedia.abacox.pnrquality.service.exception.PnrNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static com.infomedia.abacox.pnrquality.config.CachingConfig.QUALITY_SUMMARY;

@Log4j2
@Service
@RequiredArgsConstructor
public class QualityReportService {

    private final PnrRepository pnrRepository;
    private final ContactRepository contactRepository;
    private final PassengerRepository passengerRepository;
    private final RecordAggregator recordAggregator;
    private final ConfigService configService;
    private final ModelConverter modelConverter;
    private final Clock clock;

    /**
     * Summary of the PNRs selected by the request. The daily trend covers the last
     * {@code days} days (configured default when null, capped at the configured maximum)
     * and honours the office and delivery system selection but not the date range.
     * Cached per reporting day.
     */
    @Transactional(readOnly = true)
    @Cacheable(value = QUALITY_SUMMARY, key = "{#request, #groupBy, #bucketBy, #days, #root.target.today()}")
    public QualitySummary summarize(QualityFilterRequest request, GroupBy groupBy, BucketBy bucketBy, Integer days) {
        AggregationOptions options = AggregationOptions.builder()
                .filter(request.toFilter())
                .trendFilter(request.toDimensionFilter())
                .groupBy(groupBy)
                .bucketBy(bucketBy)
                .days(resolveTrendDays(days))
                .build();
        return withSnapshots(snapshots -> recordAggregator.aggregate(snapshots, options));
    }

    @Transactional(readOnly = true)
    public PnrQualityDto getPnrQuality(String controlNumber) {
        Pnr pnr = pnrRepository.findByControlNumber(controlNumber == null ? "" : controlNumber.trim())
                .orElseThrow(() -> new PnrNotFoundException("PNR " + controlNumber + " not found"));
        List<Contact> contacts = contactRepository.findByPnrIdOrderById(pnr.getId());
        List<Passenger> passengers = passengerRepository.findByPnrIdOrderById(pnr.getId());

        QualitySignals signals = QualityScorer.signalsOf(contacts, passengers);
        int score = QualityScorer.score(signals);

        PnrQualityDto dto = modelConverter.map(pnr, PnrQualityDto.class);
        dto.setScore(score);
        dto.setBand(bandOf(score));
        dto.setReachable(signals.isValidContact());
        dto.setFrequentFlyer(signals.isFrequentFlyer());
        dto.setMeal(signals.isMeal());
        dto.setSeat(signals.isSeat());
        dto.setContactDetails(contacts.stream().map(QualityReportService::toContactQuality).toList());
        dto.setPassengerDetails(modelConverter.mapList(passengers, PassengerDto.class));
        return dto;
    }

    /**
     * Selected PNRs without any valid email or phone, lowest score first.
     */
    @Transactional(readOnly = true)
    public Page<PnrScoreDto> findUnreachable(QualityFilterRequest request, Pageable pageable) {
        PnrFilter filter = request.toFilter();
        List<PnrScoreDto> rows = withSnapshots(snapshots -> snapshots
                .filter(filter::test)
                .filter(snapshot -> !snapshot.isReachable())
                .map(QualityReportService::toScore)
                .sorted(Comparator.comparingInt(PnrScoreDto::getScore)
                        .thenComparing(PnrScoreDto::getControlNumber))
                .toList());

        int start = (int) pageable.getOffset();
        int end = Math.min((start + pageable.getPageSize()), rows.size());

        List<PnrScoreDto> pageContent;
        if (start > rows.size()) {
            pageContent = Collections.emptyList();
        } else {
            pageContent = rows.subList(start, end);
        }

        return new PageImpl<>(pageContent, pageable, rows.size());
    }

    @Transactional(readOnly = true)
    public Page<PnrDto> findWithoutContacts(QualityFilterRequest request, Pageable pageable) {
        Page<Pnr> page = pnrRepository.findAll(
                PnrSpecifications.toSpecification(request.toFilter()).and(PnrSpecifications.withoutContacts()),
                pageable);
        return modelConverter.mapPage(page, PnrDto.class);
    }

    /**
     * Current date in the reporting time zone.
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public QualityBand bandOf(int score) {
        return QualityBand.of(score,
                configService.getValue(ConfigKey.EXCELLENT_SCORE_THRESHOLD).asInteger(),
                configService.getValue(ConfigKey.GOOD_SCORE_THRESHOLD).asInteger());
    }

    /**
     * Feeds every contact and passenger row into a signal index, then hands the caller a
     * stream of scored snapshots, one per stored PNR. Streams are closed before returning.
     */
    private <T> T withSnapshots(Function<Stream<PnrSnapshot>, T> consumer) {
        long start = System.currentTimeMillis();
        SignalIndex index = new SignalIndex();
        try (Stream<ContactSignalRow> contacts = contactRepository.streamSignalRows()) {
            contacts.forEach(index::acceptContact);
        }
        try (Stream<PassengerSignalRow> passengers = passengerRepository.streamSignalRows()) {
            passengers.forEach(index::acceptPassenger);
        }
        try (Stream<PnrDimensionRow> pnrs = pnrRepository.streamDimensions()) {
            T result = consumer.apply(pnrs.map(row -> PnrSnapshot.of(row.getId(), row, index.tallyOf(row.getId()))));
            log.debug("Scored stored PNRs in {} ms", System.currentTimeMillis() - start);
            return result;
        }
    }

    private int resolveTrendDays(Integer days) {
        int max = configService.getValue(ConfigKey.MAX_TREND_DAYS).asInteger();
        if (days == null) {
            return Math.min(configService.getValue(ConfigKey.DEFAULT_TREND_DAYS).asInteger(), max);
        }
        if (days < 1) {
            throw new IllegalArgumentException("Trend days must be at least 1, got " + days);
        }
        return Math.min(days, max);
    }

    private static ContactQualityDto toContactQuality(Contact contact) {
        ContactClassification classification =
                ContactClassifier.classify(contact.getContactType(), contact.getContactDetail());
        return ContactQualityDto.builder()
                .contactType(contact.getContactType())
                .contactDetail(contact.getContactDetail())
                .normalizedDetail(classification.getNormalizedDetail())
                .email(classification.isEmail())
                .phone(classification.isPhone())
                .validEmail(classification.isValidEmail())
                .validPhone(classification.isValidPhone())
                .wronglyPlaced(classification.isWronglyPlaced())
                .wrongFormat(classification.isWrongFormat())
                .build();
    }

    private static PnrScoreDto toScore(PnrSnapshot snapshot) {
        return PnrScoreDto.builder()
                .controlNumber(snapshot.getControlNumber())
                .officeId(snapshot.getOfficeId())
                .deliverySystemCompany(snapshot.getDeliverySystemCompany())
                .creationDate(snapshot.getCreationDate())
                .contactCount(snapshot.getContactCount())
                .score(snapshot.getScore())
                .build();
    }
}
