package com.infomedia.abacox.pnrquality.dto.pnr;

import com.infomedia.abacox.pnrquality.component.scoring.QualityBand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Quality detail of a single PNR, scored from its own contacts and passengers.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PnrQualityDto {
    private String controlNumber;
    private String officeId;
    private String agent;
    private String deliverySystemCompany;
    private String deliverySystemLocation;
    private LocalDate creationDate;

    private int score;
    private QualityBand band;
    private boolean reachable;
    private boolean frequentFlyer;
    private boolean meal;
    private boolean seat;
    private List<ContactQualityDto> contactDetails;
    private List<PassengerDto> passengerDetails;
}
