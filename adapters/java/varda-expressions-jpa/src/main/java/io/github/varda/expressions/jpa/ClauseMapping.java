package io.github.varda.expressions.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Custom translation of the clauses of one field into JPA predicates.
 * <p>
 * Use it for fields that are neither a plain attribute nor a collection membership,
 * e.g. matching a sample by one of several identifiers:
 * </p>
 * <pre>{@code
 * ClauseMapping<Sample> byIdOrName = (root, query, cb, value) -> value.chars().allMatch(Character::isDigit)
 *     ? cb.equal(root.get("id"), Long.valueOf(value))
 *     : cb.equal(root.get("name"), value);
 *
 * JpaClauseContext.builder(Sample.class)
 *     .mapping("sample", byIdOrName)
 *     .build();
 * }</pre>
 *
 * @param <E> the entity type queried
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClauseMapping<E> {

    /**
     * @param root  the root entity in the criteria query
     * @param query the criteria query being constructed
     * @param cb    the criteria builder
     * @param value the raw clause value
     * @return the predicate for {@code field:value}
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb, String value);
}
