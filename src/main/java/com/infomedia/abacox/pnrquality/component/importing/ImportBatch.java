package com.infomedia.abacox.pnrquality.component.importing;

import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deduplicated, not yet persisted result of reading import rows. Passengers and contacts
 * are keyed by identity and carry no PNR id until their PNR is stored.
 */
@Getter
public class ImportBatch {

    private final Map<String, Pnr> pnrs = new LinkedHashMap<>();
    private final Map<PassengerKey, Passenger> passengers = new LinkedHashMap<>();
    private final Map<ContactKey, Contact> contacts = new LinkedHashMap<>();

    private int processedRows;
    private int skippedRows;
    private int duplicatePassengers;
    private int duplicateContacts;

    void rowProcessed() {
        processedRows++;
    }

    void rowSkipped() {
        skippedRows++;
    }

    void duplicatePassenger() {
        duplicatePassengers++;
    }

    void duplicateContact() {
        duplicateContacts++;
    }
}
