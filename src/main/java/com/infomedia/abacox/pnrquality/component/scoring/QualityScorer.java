package com.infomedia.abacox.pnrquality.component.scoring;

import com.infomedia.abacox.pnrquality.component.contactquality.ContactClassifier;

import java.util.Collection;

/**
 * Quality score rules.
 * <p>
 * Contact-weighted mode (PNR model): valid contact 40, frequent flyer 20, meal 20, seat 20.
 * Flat presence mode (legacy booking model): phone, email, frequent flyer, meal and seat
 * present, 20 each, with no validity requirement.
 * Both totals are clamped to [{@value #MIN_SCORE}, {@value #MAX_SCORE}].
 */
public final class QualityScorer {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public static final int VALID_CONTACT_WEIGHT = 40;
    public static final int FREQUENT_FLYER_WEIGHT = 20;
    public static final int MEAL_WEIGHT = 20;
    public static final int SEAT_WEIGHT = 20;

    public static final int FLAT_FIELD_WEIGHT = 20;

    private QualityScorer() {
    }

    public static int score(boolean hasValidContact, boolean hasFrequentFlyer, boolean hasMeal, boolean hasSeat) {
        int total = (hasValidContact ? VALID_CONTACT_WEIGHT : 0)
                + (hasFrequentFlyer ? FREQUENT_FLYER_WEIGHT : 0)
                + (hasMeal ? MEAL_WEIGHT : 0)
                + (hasSeat ? SEAT_WEIGHT : 0);
        return clamp(total);
    }

    public static int score(QualitySignals signals) {
        return score(signals.isValidContact(), signals.isFrequentFlyer(), signals.isMeal(), signals.isSeat());
    }

    /**
     * Legacy booking score: presence of each of the five flat fields.
     */
    public static int scoreBookingFlat(String phone, String email, String ffNumber, String meal, String seat) {
        int total = 0;
        for (String field : new String[]{phone, email, ffNumber, meal, seat}) {
            if (isPresent(field)) {
                total += FLAT_FIELD_WEIGHT;
            }
        }
        return clamp(total);
    }

    /**
     * Evaluates one PNR from its own contacts and passengers.
     */
    public static QualitySignals signalsOf(Collection<? extends ContactLine> contacts,
                                           Collection<? extends PassengerLine> passengers) {
        boolean validContact = contacts.stream()
                .anyMatch(contact -> ContactClassifier.isReachable(contact.getContactType(), contact.getContactDetail()));
        boolean frequentFlyer = passengers.stream().anyMatch(QualityScorer::hasFrequentFlyer);
        boolean meal = passengers.stream().anyMatch(QualityScorer::hasMeal);
        boolean seat = passengers.stream().anyMatch(QualityScorer::hasSeat);
        return new QualitySignals(validContact, frequentFlyer, meal, seat);
    }

    public static int score(Collection<? extends ContactLine> contacts, Collection<? extends PassengerLine> passengers) {
        return score(signalsOf(contacts, passengers));
    }

    public static boolean hasFrequentFlyer(PassengerLine passenger) {
        return isPresent(passenger.getFfNumber());
    }

    public static boolean hasMeal(PassengerLine passenger) {
        return isPresent(passenger.getMeal());
    }

    public static boolean hasSeat(PassengerLine passenger) {
        return hasSeat(passenger.getSeatRowNumber(), passenger.getSeatColumn());
    }

    // A row without a column (or the reverse) is not a seat
    public static boolean hasSeat(String seatRowNumber, String seatColumn) {
        return isPresent(seatRowNumber) && isPresent(seatColumn);
    }

    static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
