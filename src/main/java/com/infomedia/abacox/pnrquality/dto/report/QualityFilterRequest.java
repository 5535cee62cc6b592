package com.infomedia.abacox.pnrquality.dto.report;

import com.infomedia.abacox.pnrquality.component.filter.PnrField;
import com.infomedia.abacox.pnrquality.component.filter.PnrFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Dashboard selection: an optional creation date range and optional office and delivery
 * system lists. A null or empty list does not restrict.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityFilterRequest {
    private LocalDate startDate;
    private LocalDate endDate;
    private List<String> offices;
    private List<String> deliverySystems;

    public PnrFilter toFilter() {
        List<PnrFilter> filters = dimensionFilters();
        if (startDate != null) {
            filters.add(PnrFilter.onOrAfter(startDate));
        }
        if (endDate != null) {
            filters.add(PnrFilter.onOrBefore(endDate));
        }
        return new PnrFilter.And(filters);
    }

    /**
     * Same selection without the date range.
     */
    public PnrFilter toDimensionFilter() {
        return new PnrFilter.And(dimensionFilters());
    }

    private List<PnrFilter> dimensionFilters() {
        List<PnrFilter> filters = new ArrayList<>();
        if (offices != null && !offices.isEmpty()) {
            filters.add(PnrFilter.in(PnrField.OFFICE_ID, offices));
        }
        if (deliverySystems != null && !deliverySystems.isEmpty()) {
            filters.add(PnrFilter.in(PnrField.DELIVERY_SYSTEM_COMPANY, deliverySystems));
        }
        return filters;
    }
}
