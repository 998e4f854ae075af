package io.github.varda.expressions.core.api;

/**
 * Syntactic shape of a query expression, as used to decide which permissions a
 * query requires.
 *
 * @see io.github.varda.expressions.core.Expressions#classify(io.github.varda.expressions.core.ast.Expression)
 * @author Varda Contributors
 * @since 1.0.0
 */
public enum QueryScope {

    /**
     * Exactly {@code *}: all samples.
     */
    TAUTOLOGY,

    /**
     * Exactly one {@code sample:<value>} clause.
     */
    SINGLETON,

    /**
     * Any combination of {@code group:<value>} clauses (and tautologies).
     */
    GROUP_CLAUSES,

    /**
     * Anything else.
     */
    GENERAL
}
