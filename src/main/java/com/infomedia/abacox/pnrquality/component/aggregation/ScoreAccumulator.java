package com.infomedia.abacox.pnrquality.component.aggregation;

import java.math.BigDecimal;

class ScoreAccumulator {
    private long count;
    private long scoreSum;

    void add(int score) {
        count++;
        scoreSum += score;
    }

    long getCount() {
        return count;
    }

    BigDecimal getAverage() {
        return Percentages.average(scoreSum, count);
    }
}
