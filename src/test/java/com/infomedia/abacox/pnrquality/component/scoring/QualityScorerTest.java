package com.infomedia.abacox.pnrquality.component.scoring;

import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QualityScorer")
class QualityScorerTest {

    @Nested
    @DisplayName("weighted score")
    class Weighted {

        @Test
        void allSignalsScoreHundred() {
            assertThat(QualityScorer.score(true, true, true, true)).isEqualTo(100);
        }

        @Test
        void noSignalScoresZero() {
            assertThat(QualityScorer.score(false, false, false, false)).isZero();
        }

        @Test
        void everyCombinationSumsItsWeights() {
            for (int mask = 0; mask < 16; mask++) {
                boolean contact = (mask & 1) != 0;
                boolean ff = (mask & 2) != 0;
                boolean meal = (mask & 4) != 0;
                boolean seat = (mask & 8) != 0;
                int expected = (contact ? 40 : 0) + (ff ? 20 : 0) + (meal ? 20 : 0) + (seat ? 20 : 0);

                int score = QualityScorer.score(contact, ff, meal, seat);

                assertThat(score).as("mask %d", mask).isEqualTo(expected).isBetween(0, 100);
            }
        }

        @Test
        void rowWithoutColumnIsNoSeat() {
            assertThat(QualityScorer.hasSeat("12", "")).isFalse();
            assertThat(QualityScorer.hasSeat("", "C")).isFalse();
            assertThat(QualityScorer.hasSeat("12", "C")).isTrue();
        }
    }

    @Nested
    @DisplayName("legacy flat score")
    class Flat {

        @ParameterizedTest(name = "[{0}|{1}|{2}|{3}|{4}] -> {5}")
        @CsvSource({
                "+254700000000, john@example.com, KQ123, VGML, 12C, 100",
                "+254700000000, '',               '',    '',   '',  20",
                "'',            '',               '',    '',   '',  0",
                "not-a-phone,   not-an-email,     '',    '',   '',  40",
                "'  ',          '',               KQ1,   '',   12C, 40"
        })
        void countsPresenceOfEachField(String phone, String email, String ff, String meal, String seat, int expected) {
            assertThat(QualityScorer.scoreBookingFlat(phone, email, ff, meal, seat)).isEqualTo(expected);
        }

        @Test
        void nullFieldsAreAbsent() {
            assertThat(QualityScorer.scoreBookingFlat(null, null, null, null, null)).isZero();
        }

        @Test
        void flatAndWeightedModesDiffer() {
            // Phone present but not valid: counts in flat mode only
            int flat = QualityScorer.scoreBookingFlat("abc", "", "", "", "");
            int weighted = QualityScorer.score(
                    List.of(contact(1L, "APM", "abc")), List.of());

            assertThat(flat).isEqualTo(20);
            assertThat(weighted).isZero();
        }
    }

    @Nested
    @DisplayName("per-row and set-based paths")
    class Paths {

        @Test
        void perRowScoresOnePnr() {
            List<Contact> contacts = List.of(
                    contact(1L, "CTCM", "john@example.com"),
                    contact(1L, "APE", "john//example.com"));
            List<Passenger> passengers = List.of(
                    passenger(1L, "", "VGML", "12", ""),
                    passenger(1L, "KQ123", "", "", "C"));

            QualitySignals signals = QualityScorer.signalsOf(contacts, passengers);

            assertThat(signals).isEqualTo(new QualitySignals(true, true, true, false));
            assertThat(QualityScorer.score(contacts, passengers)).isEqualTo(80);
        }

        @Test
        void pnrWithoutRowsScoresZeroInTheIndex() {
            SignalIndex index = new SignalIndex();

            assertThat(index.scoreOf(42L)).isZero();
            assertThat(index.tallyOf(42L).getContactCount()).isZero();
        }

        @Test
        void bothPathsAgreeOnShuffledRows() {
            Random random = new Random(7);
            String[][] contactPool = {
                    {"AP", "john@example.com"}, {"APM", "KQ/M+254700000000/EN"}, {"CTCM", "john@example.com"},
                    {"CTCEM", "+254700000000"}, {"XYZ", "0722 123 456"}, {"APE", "broken@"}, {"CTCE", "a//b.co"}
            };
            String[][] passengerPool = {
                    {"KQ1", "", "", ""}, {"", "VGML", "", ""}, {"", "", "12", "C"}, {"", "", "12", ""}, {"", "", "", ""}
            };

            List<Contact> contacts = new ArrayList<>();
            List<Passenger> passengers = new ArrayList<>();
            for (long pnrId = 1; pnrId <= 40; pnrId++) {
                int contactRows = random.nextInt(4);
                for (int i = 0; i < contactRows; i++) {
                    String[] c = contactPool[random.nextInt(contactPool.length)];
                    contacts.add(contact(pnrId, c[0], c[1]));
                }
                int passengerRows = random.nextInt(3);
                for (int i = 0; i < passengerRows; i++) {
                    String[] p = passengerPool[random.nextInt(passengerPool.length)];
                    passengers.add(passenger(pnrId, p[0], p[1], p[2], p[3]));
                }
            }
            Collections.shuffle(contacts, random);
            Collections.shuffle(passengers, random);

            SignalIndex index = new SignalIndex();
            contacts.forEach(index::acceptContact);
            passengers.forEach(index::acceptPassenger);

            Map<Long, List<Contact>> contactsByPnr = contacts.stream().collect(Collectors.groupingBy(Contact::getPnrId));
            Map<Long, List<Passenger>> passengersByPnr = passengers.stream().collect(Collectors.groupingBy(Passenger::getPnrId));
            for (long pnrId = 1; pnrId <= 40; pnrId++) {
                int perRow = QualityScorer.score(
                        contactsByPnr.getOrDefault(pnrId, List.of()),
                        passengersByPnr.getOrDefault(pnrId, List.of()));

                assertThat(index.scoreOf(pnrId)).as("PNR %d", pnrId).isEqualTo(perRow);
            }
        }
    }

    @Nested
    @DisplayName("bands")
    class Bands {

        @ParameterizedTest
        @CsvSource({"100, EXCELLENT", "80, EXCELLENT", "79, GOOD", "60, GOOD", "59, POOR", "0, POOR"})
        void thresholdsAreInclusive(int score, QualityBand expected) {
            assertThat(QualityBand.of(score, 80, 60)).isEqualTo(expected);
        }
    }

    static Contact contact(Long pnrId, String type, String detail) {
        return Contact.builder().pnrId(pnrId).contactType(type).contactDetail(detail).build();
    }

    static Passenger passenger(Long pnrId, String ff, String meal, String row, String column) {
        return Passenger.builder()
                .pnrId(pnrId)
                .ffNumber(ff)
                .meal(meal)
                .seatRowNumber(row)
                .seatColumn(column)
                .build();
    }
}
