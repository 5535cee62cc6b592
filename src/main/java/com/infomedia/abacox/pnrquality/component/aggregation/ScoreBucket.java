package com.infomedia.abacox.pnrquality.component.aggregation;

import lombok.Getter;

/**
 * Score distribution bins, upper bound inclusive. A score of 0 falls in the first bin.
 */
@Getter
public enum ScoreBucket {
    UP_TO_20("0-20", 20),
    UP_TO_40("21-40", 40),
    UP_TO_60("41-60", 60),
    UP_TO_80("61-80", 80),
    UP_TO_100("81-100", 100);

    private final String label;
    private final int upperBound;

    ScoreBucket(String label, int upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public static ScoreBucket of(int score) {
        for (ScoreBucket bucket : values()) {
            if (score <= bucket.upperBound) {
                return bucket;
            }
        }
        return UP_TO_100;
    }
}
