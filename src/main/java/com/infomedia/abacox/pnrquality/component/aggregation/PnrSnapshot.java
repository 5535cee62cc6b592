package com.infomedia.abacox.pnrquality.component.aggregation;

import com.infomedia.abacox.pnrquality.component.filter.PnrAttributes;
import com.infomedia.abacox.pnrquality.component.scoring.PnrTally;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * A scored PNR reduced to its dimensions and quality flags; what the aggregator consumes.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class PnrSnapshot implements PnrAttributes {
    private final Long id;
    private final String controlNumber;
    private final String officeId;
    private final String agent;
    private final String deliverySystemCompany;
    private final String deliverySystemLocation;
    private final LocalDate creationDate;

    private final int contactCount;
    private final boolean validEmail;
    private final boolean validPhone;
    private final boolean wrongFormat;
    private final boolean wronglyPlaced;
    private final boolean frequentFlyer;
    private final boolean meal;
    private final boolean seat;
    private final int emailContacts;
    private final int emailWrongFormatContacts;
    private final int phoneContacts;
    private final int phoneWrongFormatContacts;
    private final int score;

    public static PnrSnapshot of(Long id, PnrAttributes pnr, PnrTally tally) {
        return PnrSnapshot.builder()
                .id(id)
                .controlNumber(pnr.getControlNumber())
                .officeId(pnr.getOfficeId())
                .agent(pnr.getAgent())
                .deliverySystemCompany(pnr.getDeliverySystemCompany())
                .deliverySystemLocation(pnr.getDeliverySystemLocation())
                .creationDate(pnr.getCreationDate())
                .contactCount(tally.getContactCount())
                .validEmail(tally.isValidEmail())
                .validPhone(tally.isValidPhone())
                .wrongFormat(tally.isWrongFormat())
                .wronglyPlaced(tally.isWronglyPlaced())
                .frequentFlyer(tally.isFrequentFlyer())
                .meal(tally.isMeal())
                .seat(tally.isSeat())
                .emailContacts(tally.getEmailContacts())
                .emailWrongFormatContacts(tally.getEmailWrongFormatContacts())
                .phoneContacts(tally.getPhoneContacts())
                .phoneWrongFormatContacts(tally.getPhoneWrongFormatContacts())
                .score(tally.getScore())
                .build();
    }

    public boolean isReachable() {
        return validEmail || validPhone;
    }
}
