package com.infomedia.abacox.pnrquality.component.importing;

import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;

/**
 * Turns raw import rows into one PNR per control number with its distinct passengers and
 * contacts. Duplicates are dropped by key and never fail the import; the first row seen for
 * a key wins.
 * Rows with a blank control number or a value longer than its column are skipped whole.
 */
@Log4j2
public class PnrRowImporter {

    private PnrRowImporter() {
    }

    public static ImportBatch deduplicate(Collection<PnrImportRow> rows) {
        ImportBatch batch = new ImportBatch();
        int line = 0;
        for (PnrImportRow row : rows) {
            line++;
            String controlNumber = clean(row.getControlNumber());
            if (controlNumber.isEmpty()) {
                log.warn("Skipping import row {}: blank control number", line);
                batch.rowSkipped();
                continue;
            }
            String overLength = firstOverLengthField(row);
            if (overLength != null) {
                log.warn("Skipping import row {} of PNR {}: {} exceeds its column length", line, controlNumber, overLength);
                batch.rowSkipped();
                continue;
            }
            batch.rowProcessed();

            batch.getPnrs().computeIfAbsent(controlNumber, cn -> toPnr(cn, row));
            addPassenger(batch, controlNumber, row);
            addContact(batch, controlNumber, row);
        }
        log.debug("Read {} rows into {} PNRs, {} passengers, {} contacts ({} skipped, {} duplicate passengers, {} duplicate contacts)",
                line, batch.getPnrs().size(), batch.getPassengers().size(), batch.getContacts().size(),
                batch.getSkippedRows(), batch.getDuplicatePassengers(), batch.getDuplicateContacts());
        return batch;
    }

    private static void addPassenger(ImportBatch batch, String controlNumber, PnrImportRow row) {
        String surname = clean(row.getSurname());
        String firstName = clean(row.getFirstName());
        if (surname.isEmpty() && firstName.isEmpty()) {
            return;
        }
        PassengerKey key = new PassengerKey(controlNumber, surname, firstName);
        if (batch.getPassengers().containsKey(key)) {
            log.debug("Duplicate passenger {} dropped", key);
            batch.duplicatePassenger();
            return;
        }
        batch.getPassengers().put(key, Passenger.builder()
                .surname(surname)
                .firstName(firstName)
                .ffNumber(clean(row.getFfNumber()))
                .meal(clean(row.getMeal()))
                .seatRowNumber(clean(row.getSeatRowNumber()))
                .seatColumn(clean(row.getSeatColumn()))
                .build());
    }

    private static void addContact(ImportBatch batch, String controlNumber, PnrImportRow row) {
        String detail = clean(row.getContactDetail());
        if (detail.isEmpty()) {
            return;
        }
        String type = clean(row.getContactType());
        ContactKey key = new ContactKey(controlNumber, type, detail);
        if (batch.getContacts().containsKey(key)) {
            log.debug("Duplicate contact {} dropped", key);
            batch.duplicateContact();
            return;
        }
        batch.getContacts().put(key, Contact.builder()
                .contactType(type)
                .contactDetail(detail)
                .build());
    }

    private static Pnr toPnr(String controlNumber, PnrImportRow row) {
        return Pnr.builder()
                .controlNumber(controlNumber)
                .officeId(clean(row.getOfficeId()))
                .agent(clean(row.getAgent()))
                .deliverySystemCompany(clean(row.getDeliverySystemCompany()))
                .deliverySystemLocation(clean(row.getDeliverySystemLocation()))
                .creationDate(DateTimeUtil.parseCompactDate(row.getCreationDate()))
                .build();
    }

    /**
     * Header of the first field longer than the column it is stored in, or null if the row fits.
     */
    static String firstOverLengthField(PnrImportRow row) {
        if (tooLong(row.getControlNumber(), Pnr.CONTROL_NUMBER_LENGTH)) return PnrImportRow.CONTROL_NUMBER;
        if (tooLong(row.getOfficeId(), Pnr.OFFICE_ID_LENGTH)) return PnrImportRow.OFFICE_ID;
        if (tooLong(row.getAgent(), Pnr.AGENT_LENGTH)) return PnrImportRow.AGENT;
        if (tooLong(row.getDeliverySystemCompany(), Pnr.DELIVERY_SYSTEM_COMPANY_LENGTH)) return PnrImportRow.DELIVERY_SYSTEM_COMPANY;
        if (tooLong(row.getDeliverySystemLocation(), Pnr.DELIVERY_SYSTEM_LOCATION_LENGTH)) return PnrImportRow.DELIVERY_SYSTEM_LOCATION;
        if (tooLong(row.getSurname(), Passenger.SURNAME_LENGTH)) return PnrImportRow.SURNAME;
        if (tooLong(row.getFirstName(), Passenger.FIRST_NAME_LENGTH)) return PnrImportRow.FIRST_NAME;
        if (tooLong(row.getFfNumber(), Passenger.FF_NUMBER_LENGTH)) return PnrImportRow.FF_NUMBER;
        if (tooLong(row.getMeal(), Passenger.MEAL_LENGTH)) return PnrImportRow.MEAL;
        if (tooLong(row.getSeatRowNumber(), Passenger.SEAT_ROW_NUMBER_LENGTH)) return PnrImportRow.SEAT_ROW_NUMBER;
        if (tooLong(row.getSeatColumn(), Passenger.SEAT_COLUMN_LENGTH)) return PnrImportRow.SEAT_COLUMN;
        if (tooLong(row.getContactType(), Contact.CONTACT_TYPE_LENGTH)) return PnrImportRow.CONTACT_TYPE;
        if (tooLong(row.getContactDetail(), Contact.CONTACT_DETAIL_LENGTH)) return PnrImportRow.CONTACT_DETAIL;
        return null;
    }

    private static boolean tooLong(String value, int length) {
        return clean(value).length() > length;
    }

    static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
