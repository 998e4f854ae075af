package io.github.varda.expressions.core.api;

/**
 * Boolean algebra a query expression is compiled into.
 * <p>
 * The compiler makes no assumption about {@code P}: it can be a storage-engine filter
 * criterion, a deferred predicate factory, or a plain description used in tests. The
 * algebra only needs the universal predicate and the three connectives.
 * </p>
 *
 * <pre>{@code
 * CriterionAlgebra<PredicateResolver<Sample>> algebra = new JpaCriterionAlgebra<>();
 * PredicateResolver<Sample> resolver =
 *     Expressions.buildQueryCriterion(expression, algebra, clauseContext);
 * }</pre>
 *
 * @param <P> predicate type of the backend
 * @author Varda Contributors
 * @since 1.0.0
 */
public interface CriterionAlgebra<P> {

    /**
     * @return the predicate matching everything
     */
    P tautology();

    /**
     * @return a predicate satisfied when both operands are
     */
    P and(P left, P right);

    /**
     * @return a predicate satisfied when at least one operand is
     */
    P or(P left, P right);

    /**
     * @return a predicate satisfied when {@code operand} is not
     */
    P not(P operand);
}
