package com.infomedia.abacox.pnrquality.component.scoring;

import com.infomedia.abacox.pnrquality.component.contactquality.ContactClassifier;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set-based scoring: accumulates contact and passenger rows of many PNRs, in any order,
 * into one {@link PnrTally} per PNR id. Only the counters are retained, never the rows.
 * <p>
 * Not thread-safe; build one index per query.
 */
@Log4j2
public class SignalIndex {

    private static final PnrTally EMPTY = new PnrTally();

    private final Map<Long, PnrTally> tallies = new HashMap<>();
    private long contactRows;
    private long passengerRows;

    public void acceptContact(ContactLine contact) {
        contactRows++;
        tallies.computeIfAbsent(contact.getPnrId(), id -> new PnrTally())
                .addContact(ContactClassifier.classify(contact.getContactType(), contact.getContactDetail()));
    }

    public void acceptPassenger(PassengerLine passenger) {
        passengerRows++;
        tallies.computeIfAbsent(passenger.getPnrId(), id -> new PnrTally())
                .addPassenger(passenger);
    }

    /**
     * @return the counters for a PNR; a PNR with no rows gets an empty tally (score 0)
     */
    public PnrTally tallyOf(Long pnrId) {
        return tallies.getOrDefault(pnrId, EMPTY);
    }

    public int scoreOf(Long pnrId) {
        return tallyOf(pnrId).getScore();
    }

    public Map<Long, Integer> scoreAll(Collection<Long> pnrIds) {
        Map<Long, Integer> scores = new LinkedHashMap<>();
        for (Long pnrId : pnrIds) {
            scores.put(pnrId, scoreOf(pnrId));
        }
        log.debug("Scored {} PNRs from {} contact rows and {} passenger rows", scores.size(), contactRows, passengerRows);
        return scores;
    }
}
