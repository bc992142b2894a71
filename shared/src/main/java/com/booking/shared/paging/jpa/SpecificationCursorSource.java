package com.booking.shared.paging.jpa;

import com.booking.shared.error.MalformedPageTokenException;
import com.booking.shared.paging.Cursor;
import com.booking.shared.paging.CursorSource;
import com.booking.shared.paging.Filter;
import com.booking.shared.paging.FilterOperator;
import com.booking.shared.paging.Seek;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link CursorSource} over a Spring Data repository that implements {@link JpaSpecificationExecutor}.
 *
 * Logical field names used in filters and sorting are mapped to entity attributes. The sort attribute
 * must be an {@link Instant}; the entity must expose a String {@code id} (tie-breaker) and a boolean
 * {@code deleted} attribute.
 *
 * Boundary predicate for an ascending read: {@code sort > v OR (sort = v AND id > boundaryId)};
 * descending reads flip both comparisons.
 */
public class SpecificationCursorSource<E> implements CursorSource<E> {

    private static final String ID = "id";
    private static final String DELETED = "deleted";

    private final JpaSpecificationExecutor<E> executor;
    private final Map<String, String> attributes;
    private final Function<E, Cursor> cursorExtractor;

    public SpecificationCursorSource(JpaSpecificationExecutor<E> executor,
                                     Map<String, String> attributes,
                                     Function<E, Cursor> cursorExtractor) {
        this.executor = executor;
        this.attributes = Map.copyOf(attributes);
        this.cursorExtractor = cursorExtractor;
    }

    @Override
    public List<E> fetch(Seek seek) {
        Sort.Direction direction = seek.ascending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(direction, attribute(seek.getSorting().getField())).and(Sort.by(direction, ID));
        return executor.findAll(toSpecification(seek), PageRequest.of(0, seek.getLimit(), sort)).getContent();
    }

    @Override
    public boolean exists(Seek seek) {
        return executor.exists(toSpecification(seek));
    }

    @Override
    public Cursor cursorOf(E row) {
        return cursorExtractor.apply(row);
    }

    private Specification<E> toSpecification(Seek seek) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            for (Filter filter : seek.getFilters()) {
                Path<String> path = root.get(attribute(filter.getField()));
                predicates.add(filter.getOperator() == FilterOperator.EQUAL
                        ? cb.equal(path, filter.value())
                        : path.in(filter.getValues()));
            }
            if (!seek.isIncludeDeleted()) {
                predicates.add(cb.isFalse(root.get(DELETED)));
            }
            if (seek.getBoundary() != null) {
                Path<Instant> sortPath = root.get(attribute(seek.getSorting().getField()));
                Path<String> idPath = root.get(ID);
                Instant value = parse(seek.getBoundary());
                String id = seek.getBoundary().getId();
                predicates.add(seek.ascending()
                        ? cb.or(cb.greaterThan(sortPath, value),
                                cb.and(cb.equal(sortPath, value), cb.greaterThan(idPath, id)))
                        : cb.or(cb.lessThan(sortPath, value),
                                cb.and(cb.equal(sortPath, value), cb.lessThan(idPath, id))));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private String attribute(String field) {
        String attribute = attributes.get(field);
        if (attribute == null) {
            throw new IllegalArgumentException("field is not listable: " + field);
        }
        return attribute;
    }

    private static Instant parse(Cursor cursor) {
        try {
            return Instant.parse(cursor.getValue());
        } catch (DateTimeParseException e) {
            throw new MalformedPageTokenException("page token cursor is not a timestamp", e);
        }
    }
}
