package com.infomedia.abacox.pnrquality.component.filter;

import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.List;

/**
 * Translates a {@link PnrFilter} into a JPA {@link Specification}. The translation keeps the
 * in-memory semantics: a date comparison on a PNR without creation date is false, so its
 * negation is true.
 */
public final class PnrSpecifications {

    private PnrSpecifications() {
    }

    public static Specification<Pnr> toSpecification(PnrFilter filter) {
        return (root, query, cb) -> toPredicate(filter, root, cb);
    }

    public static Specification<Pnr> withoutContacts() {
        return (root, query, cb) -> {
            Subquery<Long> contacts = query.subquery(Long.class);
            Root<Contact> contact = contacts.from(Contact.class);
            contacts.select(contact.get("id")).where(cb.equal(contact.get("pnrId"), root.get("id")));
            return cb.not(cb.exists(contacts));
        };
    }

    private static Predicate toPredicate(PnrFilter filter, Root<Pnr> root, CriteriaBuilder cb) {
        if (filter instanceof PnrFilter.And and) {
            return cb.and(toPredicates(and.filters(), root, cb));
        }
        if (filter instanceof PnrFilter.Or or) {
            return cb.or(toPredicates(or.filters(), root, cb));
        }
        if (filter instanceof PnrFilter.Not not) {
            return cb.not(toPredicate(not.filter(), root, cb));
        }
        if (filter instanceof PnrFilter.FieldMatches matches) {
            return toPredicate(matches, root, cb);
        }
        throw new IllegalArgumentException("Unsupported filter type: " + filter.getClass().getName());
    }

    private static Predicate[] toPredicates(List<PnrFilter> filters, Root<Pnr> root, CriteriaBuilder cb) {
        return filters.stream()
                .map(filter -> toPredicate(filter, root, cb))
                .toArray(Predicate[]::new);
    }

    private static Predicate toPredicate(PnrFilter.FieldMatches matches, Root<Pnr> root, CriteriaBuilder cb) {
        switch (matches.operator()) {
            case IN:
                if (matches.values().isEmpty()) {
                    return cb.disjunction();
                }
                if (matches.field().isDate()) {
                    Path<LocalDate> datePath = root.get(matches.field().getAttribute());
                    return cb.and(cb.isNotNull(datePath),
                            datePath.in(matches.values().stream().map(LocalDate::parse).toList()));
                }
                Path<String> path = root.get(matches.field().getAttribute());
                return path.in(matches.values());
            case ON_OR_AFTER: {
                Path<LocalDate> datePath = root.get(matches.field().getAttribute());
                return cb.and(cb.isNotNull(datePath),
                        cb.greaterThanOrEqualTo(datePath, LocalDate.parse(matches.values().get(0))));
            }
            case ON_OR_BEFORE: {
                Path<LocalDate> datePath = root.get(matches.field().getAttribute());
                return cb.and(cb.isNotNull(datePath),
                        cb.lessThanOrEqualTo(datePath, LocalDate.parse(matches.values().get(0))));
            }
            default:
                throw new IllegalStateException("Unsupported operator: " + matches.operator());
        }
    }
}
