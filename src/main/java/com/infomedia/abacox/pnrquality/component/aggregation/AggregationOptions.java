package com.infomedia.abacox.pnrquality.component.aggregation;

import com.infomedia.abacox.pnrquality.component.filter.PnrFilter;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class AggregationOptions {

    /** Selects the PNRs counted in the summary. */
    @Builder.Default
    private final PnrFilter filter = PnrFilter.all();

    /**
     * Selects the PNRs counted in the daily trend. The trend always covers the last
     * {@link #days} days, so this is normally the summary filter without its date range.
     */
    @Builder.Default
    private final PnrFilter trendFilter = PnrFilter.all();

    @Builder.Default
    private final GroupBy groupBy = GroupBy.NONE;

    @Builder.Default
    private final BucketBy bucketBy = BucketBy.NONE;

    @Builder.Default
    private final int days = 30;
}
