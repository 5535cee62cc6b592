package com.infomedia.abacox.pnrquality.component.importing;

import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PnrRowImporter")
class PnrRowImporterTest {

    @Test
    @DisplayName("duplicate passenger rows collapse into one")
    void deduplicatesPassengers() {
        ImportBatch batch = PnrRowImporter.deduplicate(List.of(
                row("PNR1", "DOE", "JOHN"),
                row("PNR1", "DOE", "JOHN"),
                row("PNR1", "SMITH", "JANE")));

        assertThat(batch.getPnrs()).hasSize(1);
        assertThat(batch.getPassengers()).hasSize(2);
        assertThat(batch.getDuplicatePassengers()).isEqualTo(1);
        assertThat(batch.getProcessedRows()).isEqualTo(3);
    }

    @Test
    void firstRowWinsForPnrAttributes() {
        PnrImportRow first = row("PNR1", "DOE", "JOHN");
        first.setOfficeId("NBOKQ08AA");
        first.setCreationDate("010124");
        PnrImportRow second = row(" PNR1 ", "SMITH", "JANE");
        second.setOfficeId("MBAKQ01");

        ImportBatch batch = PnrRowImporter.deduplicate(List.of(first, second));

        Pnr pnr = batch.getPnrs().get("PNR1");
        assertThat(pnr.getOfficeId()).isEqualTo("NBOKQ08AA");
        assertThat(pnr.getCreationDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(pnr.getAgent()).isEmpty();
    }

    @Test
    void blankControlNumberRowsAreSkippedAndCounted() {
        ImportBatch batch = PnrRowImporter.deduplicate(List.of(
                row("", "DOE", "JOHN"),
                row(null, "DOE", "JOHN"),
                row("PNR2", "DOE", "JOHN")));

        assertThat(batch.getSkippedRows()).isEqualTo(2);
        assertThat(batch.getProcessedRows()).isEqualTo(1);
        assertThat(batch.getPnrs()).containsOnlyKeys("PNR2");
    }

    @Test
    void rowsLongerThanTheirColumnsAreSkippedWhole() {
        PnrImportRow longDeliverySystem = row("PNR1", "DOE", "JOHN");
        longDeliverySystem.setDeliverySystemCompany("TRAVELPORT-GALILEO");
        PnrImportRow longContact = row("PNR1", "SMITH", "JANE");
        longContact.setContactType("AP");
        longContact.setContactDetail("x".repeat(250));
        PnrImportRow paddedSeat = row("PNR1", "OKOTH", "ANN");
        paddedSeat.setSeatColumn("   C   ");

        ImportBatch batch = PnrRowImporter.deduplicate(List.of(longDeliverySystem, longContact, paddedSeat));

        assertThat(batch.getSkippedRows()).isEqualTo(2);
        assertThat(batch.getProcessedRows()).isEqualTo(1);
        assertThat(batch.getPnrs().get("PNR1").getDeliverySystemCompany()).isEmpty();
        assertThat(batch.getPassengers()).containsOnlyKeys(new PassengerKey("PNR1", "OKOTH", "ANN"));
        assertThat(batch.getContacts()).isEmpty();
        assertThat(PnrRowImporter.firstOverLengthField(longContact)).isEqualTo(PnrImportRow.CONTACT_DETAIL);
    }

    @Test
    void contactsAreDistinctByTypeAndDetail() {
        PnrImportRow a = row("PNR1", "DOE", "JOHN");
        a.setContactType("APE");
        a.setContactDetail("john@example.com");
        PnrImportRow b = row("PNR1", "SMITH", "JANE");
        b.setContactType("APE");
        b.setContactDetail(" john@example.com ");
        PnrImportRow c = row("PNR1", "SMITH", "JANE");
        c.setContactType("CTCM");
        c.setContactDetail("john@example.com");
        PnrImportRow blank = row("PNR1", "SMITH", "JANE");
        blank.setContactType("APM");
        blank.setContactDetail("  ");

        ImportBatch batch = PnrRowImporter.deduplicate(List.of(a, b, c, blank));

        assertThat(batch.getContacts()).containsOnlyKeys(
                new ContactKey("PNR1", "APE", "john@example.com"),
                new ContactKey("PNR1", "CTCM", "john@example.com"));
        assertThat(batch.getDuplicateContacts()).isEqualTo(1);
    }

    @Test
    void rowsWithoutNamesCreateNoPassenger() {
        ImportBatch batch = PnrRowImporter.deduplicate(List.of(row("PNR1", " ", null)));

        assertThat(batch.getPnrs()).hasSize(1);
        assertThat(batch.getPassengers()).isEmpty();
    }

    @Test
    void readsHeaderKeyedRecords() {
        PnrImportRow row = PnrImportRow.fromMap(Map.of(
                "ControlNumber", "PNR9",
                "Surname", "DOE",
                "FirstName", "JOHN",
                "FFNumber", "KQ123",
                "SeatRowNumber", "12",
                "SeatColumn", "C"));

        ImportBatch batch = PnrRowImporter.deduplicate(List.of(row));

        assertThat(batch.getPassengers().get(new PassengerKey("PNR9", "DOE", "JOHN")))
                .satisfies(passenger -> {
                    assertThat(passenger.getFfNumber()).isEqualTo("KQ123");
                    assertThat(passenger.getMeal()).isEmpty();
                    assertThat(passenger.getSeat()).isEqualTo("12C");
                });
    }

    static PnrImportRow row(String controlNumber, String surname, String firstName) {
        return PnrImportRow.builder()
                .controlNumber(controlNumber)
                .surname(surname)
                .firstName(firstName)
                .build();
    }
}
