package io.github.varda.expressions.core.api;

/**
 * Translates one {@code field:value} clause into a backend predicate.
 * <p>
 * Supplied by the persistence layer. Failures, for instance an unknown field, are
 * thrown as-is and reach the caller of the compilation unchanged.
 * </p>
 *
 * @param <P> predicate type of the backend
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClauseBuilder<P> {

    /**
     * @param field clause field name
     * @param value clause value, exactly as written
     * @return predicate for the clause
     */
    P build(String field, String value);
}
