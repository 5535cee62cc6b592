package com.infomedia.abacox.pnrquality.component.scoring;

import com.infomedia.abacox.pnrquality.component.contactquality.ContactClassification;
import lombok.Getter;

/**
 * Running counters for one PNR, filled row by row from flat contact and passenger rows.
 */
@Getter
public class PnrTally {
    private int contactCount;
    private boolean validEmail;
    private boolean validPhone;
    private boolean wrongFormat;
    private boolean wronglyPlaced;
    private int emailContacts;
    private int emailWrongFormatContacts;
    private int phoneContacts;
    private int phoneWrongFormatContacts;

    private boolean frequentFlyer;
    private boolean meal;
    private boolean seat;

    void addContact(ContactClassification classification) {
        contactCount++;
        validEmail |= classification.isValidEmail();
        validPhone |= classification.isValidPhone();
        wrongFormat |= classification.isWrongFormat();
        wronglyPlaced |= classification.isWronglyPlaced();
        if (classification.isEmail()) {
            emailContacts++;
            if (!classification.isValidEmail()) {
                emailWrongFormatContacts++;
            }
        }
        if (classification.isPhone()) {
            phoneContacts++;
            if (!classification.isValidPhone()) {
                phoneWrongFormatContacts++;
            }
        }
    }

    void addPassenger(PassengerLine passenger) {
        frequentFlyer |= QualityScorer.hasFrequentFlyer(passenger);
        meal |= QualityScorer.hasMeal(passenger);
        seat |= QualityScorer.hasSeat(passenger);
    }

    public boolean isReachable() {
        return validEmail || validPhone;
    }

    public QualitySignals toSignals() {
        return new QualitySignals(isReachable(), frequentFlyer, meal, seat);
    }

    public int getScore() {
        return QualityScorer.score(toSignals());
    }
}
