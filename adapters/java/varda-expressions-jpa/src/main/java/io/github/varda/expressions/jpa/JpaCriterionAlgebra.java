package io.github.varda.expressions.jpa;

import io.github.varda.expressions.core.api.CriterionAlgebra;

/**
 * Boolean connectives over {@link PredicateResolver}s.
 * <p>
 * Composition is lazy: each operation returns a resolver that resolves its operands
 * against the same root, query and criteria builder when it is itself resolved.
 * </p>
 *
 * <ul>
 *   <li><strong>TRUE:</strong> {@code cb.conjunction()}</li>
 *   <li><strong>AND:</strong> {@code cb.and(left, right)}</li>
 *   <li><strong>OR:</strong> {@code cb.or(left, right)}</li>
 *   <li><strong>NOT:</strong> {@code cb.not(operand)}</li>
 * </ul>
 *
 * @param <E> the entity type queried
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class JpaCriterionAlgebra<E> implements CriterionAlgebra<PredicateResolver<E>> {

    @Override
    public PredicateResolver<E> tautology() {
        return (root, query, cb) -> cb.conjunction();
    }

    @Override
    public PredicateResolver<E> and(PredicateResolver<E> left, PredicateResolver<E> right) {
        return (root, query, cb) -> cb.and(
                left.resolve(root, query, cb),
                right.resolve(root, query, cb)
        );
    }

    @Override
    public PredicateResolver<E> or(PredicateResolver<E> left, PredicateResolver<E> right) {
        return (root, query, cb) -> cb.or(
                left.resolve(root, query, cb),
                right.resolve(root, query, cb)
        );
    }

    @Override
    public PredicateResolver<E> not(PredicateResolver<E> operand) {
        return (root, query, cb) -> cb.not(operand.resolve(root, query, cb));
    }
}
