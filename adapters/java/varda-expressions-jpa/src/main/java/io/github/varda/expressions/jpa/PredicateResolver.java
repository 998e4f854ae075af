package io.github.varda.expressions.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred JPA Criteria predicate.
 * <p>
 * A resolver holds the logic to create a {@link Predicate} once a query context (root,
 * query, criteria builder) is available. Compiling a query expression yields a tree of
 * resolvers; nothing touches the Criteria API until {@link #resolve} is called, so one
 * resolver may be applied to any number of queries.
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Sample> resolver = context.toResolver(Expressions.parse("sample:3 or group:2"));
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<Sample> query = cb.createQuery(Sample.class);
 * Root<Sample> root = query.from(Sample.class);
 *
 * query.where(resolver.resolve(root, query, cb));
 * List<Sample> samples = entityManager.createQuery(query).getResultList();
 * }</pre>
 *
 * <p>Implementations should be stateless and thread-safe.</p>
 *
 * @param <E> the entity type this predicate resolver applies to
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Creates the predicate for the given query context.
     *
     * @param root  the root entity in the criteria query
     * @param query the criteria query being constructed, used for subqueries
     * @param cb    the criteria builder
     * @return the predicate, ready for use in {@code where}
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
