package com.infomedia.abacox.pnrquality.dto.importing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {
    /** PNRs written (created, or updated on the update-or-create path). */
    private int pnrCount;
    private int passengerCount;
    private int contactCount;
    private int processedRows;
    private int skippedRows;
    private int duplicatePassengers;
    private int duplicateContacts;
}
