package com.infomedia.abacox.pnrquality.component.filter;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Boolean filter over PNR attributes, described as data so the same filter can be
 * evaluated in memory ({@link #test}) or translated to a storage query ({@link PnrSpecifications}).
 */
public interface PnrFilter {

    boolean test(PnrAttributes pnr);

    record And(List<PnrFilter> filters) implements PnrFilter {
        public And {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(PnrAttributes pnr) {
            return filters.stream().allMatch(filter -> filter.test(pnr));
        }
    }

    record Or(List<PnrFilter> filters) implements PnrFilter {
        public Or {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(PnrAttributes pnr) {
            return filters.stream().anyMatch(filter -> filter.test(pnr));
        }
    }

    record Not(PnrFilter filter) implements PnrFilter {
        public Not {
            Objects.requireNonNull(filter, "filter");
        }

        @Override
        public boolean test(PnrAttributes pnr) {
            return !filter.test(pnr);
        }
    }

    record FieldMatches(PnrField field, MatchOperator operator, List<String> values) implements PnrFilter {
        public FieldMatches {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
            values = List.copyOf(values);
            if (operator != MatchOperator.IN) {
                if (!field.isDate() || values.size() != 1) {
                    throw new IllegalArgumentException(operator + " needs a date field and exactly one value");
                }
                LocalDate.parse(values.get(0));
            }
        }

        @Override
        public boolean test(PnrAttributes pnr) {
            switch (operator) {
                case IN:
                    String actual = field.read(pnr);
                    return values.contains(actual == null ? "" : actual);
                case ON_OR_AFTER: {
                    LocalDate date = field.readDate(pnr);
                    return date != null && !date.isBefore(LocalDate.parse(values.get(0)));
                }
                case ON_OR_BEFORE: {
                    LocalDate date = field.readDate(pnr);
                    return date != null && !date.isAfter(LocalDate.parse(values.get(0)));
                }
                default:
                    throw new IllegalStateException("Unsupported operator: " + operator);
            }
        }
    }

    static PnrFilter all() {
        return new And(List.of());
    }

    static PnrFilter and(PnrFilter... filters) {
        return new And(Arrays.asList(filters));
    }

    static PnrFilter or(PnrFilter... filters) {
        return new Or(Arrays.asList(filters));
    }

    static PnrFilter not(PnrFilter filter) {
        return new Not(filter);
    }

    static PnrFilter in(PnrField field, List<String> values) {
        return new FieldMatches(field, MatchOperator.IN, values);
    }

    static PnrFilter onOrAfter(LocalDate date) {
        return new FieldMatches(PnrField.CREATION_DATE, MatchOperator.ON_OR_AFTER, List.of(date.toString()));
    }

    static PnrFilter onOrBefore(LocalDate date) {
        return new FieldMatches(PnrField.CREATION_DATE, MatchOperator.ON_OR_BEFORE, List.of(date.toString()));
    }
}
