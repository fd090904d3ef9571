package com.opsdashboard.infrastructure.persistence.store;

import com.opsdashboard.domain.exception.QueryExecutionException;
import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.RecordSchema;
import com.opsdashboard.domain.query.FieldPredicate;
import com.opsdashboard.domain.query.MembershipPredicate;
import com.opsdashboard.domain.query.RangePredicate;
import com.opsdashboard.domain.store.RecordStore;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JPA-backed store for one domain.
 *
 * Field predicates become a single conjunctive {@link Specification}; field
 * names are mapped to entity attributes through the schema. Spring's data
 * access exceptions are translated here so the engine only ever sees
 * {@link QueryExecutionException}.
 */
@Slf4j
public abstract class AbstractJpaRecordStore<E> implements RecordStore {

    private final JpaSpecificationExecutor<E> executor;
    private final RecordSchema schema;

    protected AbstractJpaRecordStore(JpaSpecificationExecutor<E> executor, RecordSchema schema) {
        this.executor = executor;
        this.schema = schema;
    }

    @Override
    public Domain domain() {
        return schema.getDomain();
    }

    @Override
    public List<AnalyticsRecord> findMatching(List<FieldPredicate> predicates) {
        Specification<E> specification = toSpecification(predicates);
        List<E> entities = withStore("fetch", () ->
                executor.findAll(specification, Sort.by(Sort.Direction.ASC, schema.attributeOf(schema.getIdField()))));
        return entities.stream().map(this::toRecord).collect(Collectors.toList());
    }

    @Override
    public List<String> findDistinctValues(String field) {
        if (!schema.isFilterable(field)) {
            throw new IllegalArgumentException("Field " + field + " is not filterable for " + domain());
        }
        return withStore("distinct " + field, () -> queryDistinct(field));
    }

    protected abstract List<String> queryDistinct(String field);

    protected abstract AnalyticsRecord toRecord(E entity);

    Specification<E> toSpecification(List<FieldPredicate> predicates) {
        return (root, query, cb) -> {
            List<Predicate> clauses = new ArrayList<>();
            for (FieldPredicate predicate : predicates) {
                clauses.add(toClause(predicate, root, cb));
            }
            return cb.and(clauses.toArray(new Predicate[0]));
        };
    }

    private Predicate toClause(FieldPredicate predicate, Root<E> root, CriteriaBuilder cb) {
        String attribute = schema.attributeOf(predicate.getField());

        if (predicate instanceof MembershipPredicate) {
            return root.get(attribute).in(((MembershipPredicate) predicate).getValues());
        }
        if (predicate instanceof RangePredicate) {
            return toRangeClause((RangePredicate<?>) predicate, attribute, root, cb);
        }
        throw new IllegalArgumentException("Unsupported predicate type: " + predicate.getClass().getSimpleName());
    }

    private <Y extends Comparable<? super Y>> Predicate toRangeClause(RangePredicate<Y> range, String attribute,
                                                                       Root<E> root, CriteriaBuilder cb) {
        Path<Y> path = root.get(attribute);
        List<Predicate> bounds = new ArrayList<>();
        if (range.getLower() != null) {
            bounds.add(cb.greaterThanOrEqualTo(path, range.getLower()));
        }
        if (range.getUpper() != null) {
            bounds.add(cb.lessThanOrEqualTo(path, range.getUpper()));
        }
        return cb.and(bounds.toArray(new Predicate[0]));
    }

    private <T> T withStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException | QueryTimeoutException e) {
            log.error("{} store unavailable during {}: {}", domain(), operation, e.getMessage());
            throw new QueryExecutionException(QueryExecutionException.Kind.STORE_UNAVAILABLE,
                    "Store for " + domain() + " is unavailable", e);
        } catch (DataAccessException e) {
            log.error("{} query failed during {}: {}", domain(), operation, e.getMessage());
            throw new QueryExecutionException(QueryExecutionException.Kind.QUERY_FAILED,
                    "Query against " + domain() + " failed", e);
        }
    }
}
