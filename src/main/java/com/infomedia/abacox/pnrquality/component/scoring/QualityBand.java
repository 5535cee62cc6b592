package com.infomedia.abacox.pnrquality.component.scoring;

public enum QualityBand {
    EXCELLENT,
    GOOD,
    POOR;

    public static QualityBand of(int score, int excellentThreshold, int goodThreshold) {
        if (score >= excellentThreshold) {
            return EXCELLENT;
        }
        if (score >= goodThreshold) {
            return GOOD;
        }
        return POOR;
    }
}
