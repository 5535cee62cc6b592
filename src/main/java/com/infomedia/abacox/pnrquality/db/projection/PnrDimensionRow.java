package com.infomedia.abacox.pnrquality.db.projection;

import com.infomedia.abacox.pnrquality.component.filter.PnrAttributes;

/**
 * Projection of the PNR columns used by the quality summary; no collections are loaded.
 * The getter names MUST match the aliases of the JPQL query.
 */
public interface PnrDimensionRow extends PnrAttributes {
    Long getId();
}
