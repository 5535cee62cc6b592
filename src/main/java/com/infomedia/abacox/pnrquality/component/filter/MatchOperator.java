package com.infomedia.abacox.pnrquality.component.filter;

public enum MatchOperator {
    /** Value equals any of the given values. */
    IN,
    /** Date on or after the single given ISO date. */
    ON_OR_AFTER,
    /** Date on or before the single given ISO date. */
    ON_OR_BEFORE
}
