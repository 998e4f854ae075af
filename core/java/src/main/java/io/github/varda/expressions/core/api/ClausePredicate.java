package io.github.varda.expressions.core.api;

/**
 * Condition checked on individual clauses.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClausePredicate {

    /**
     * @param field clause field name
     * @param value clause value
     * @return {@code true} if the clause satisfies the condition
     */
    boolean test(String field, String value);
}
