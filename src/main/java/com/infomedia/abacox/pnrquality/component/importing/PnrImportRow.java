package com.infomedia.abacox.pnrquality.component.importing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One raw line of a PNR extract: the PNR fields repeated on every line, plus at most one
 * passenger and one contact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PnrImportRow {

    public static final String CONTROL_NUMBER = "ControlNumber";
    public static final String SURNAME = "Surname";
    public static final String FIRST_NAME = "FirstName";
    public static final String CONTACT_TYPE = "ContactType";
    public static final String CONTACT_DETAIL = "ContactDetail";
    public static final String OFFICE_ID = "OfficeID";
    public static final String AGENT = "Agent";
    public static final String CREATION_DATE = "creationDate";
    public static final String DELIVERY_SYSTEM_COMPANY = "DeliverySystemCompany";
    public static final String DELIVERY_SYSTEM_LOCATION = "DeliverySystemLocation";
    public static final String FF_NUMBER = "FFNumber";
    public static final String MEAL = "Meal";
    public static final String SEAT_ROW_NUMBER = "SeatRowNumber";
    public static final String SEAT_COLUMN = "SeatColumn";

    private String controlNumber;
    private String surname;
    private String firstName;
    private String contactType;
    private String contactDetail;
    private String officeId;
    private String agent;
    private String creationDate;
    private String deliverySystemCompany;
    private String deliverySystemLocation;
    private String ffNumber;
    private String meal;
    private String seatRowNumber;
    private String seatColumn;

    /**
     * Builds a row from a header-keyed record. Missing headers read as empty.
     */
    public static PnrImportRow fromMap(Map<String, String> record) {
        return PnrImportRow.builder()
                .controlNumber(record.get(CONTROL_NUMBER))
                .surname(record.get(SURNAME))
                .firstName(record.get(FIRST_NAME))
                .contactType(record.get(CONTACT_TYPE))
                .contactDetail(record.get(CONTACT_DETAIL))
                .officeId(record.get(OFFICE_ID))
                .agent(record.get(AGENT))
                .creationDate(record.get(CREATION_DATE))
                .deliverySystemCompany(record.get(DELIVERY_SYSTEM_COMPANY))
                .deliverySystemLocation(record.get(DELIVERY_SYSTEM_LOCATION))
                .ffNumber(record.get(FF_NUMBER))
                .meal(record.get(MEAL))
                .seatRowNumber(record.get(SEAT_ROW_NUMBER))
                .seatColumn(record.get(SEAT_COLUMN))
                .build();
    }
}
