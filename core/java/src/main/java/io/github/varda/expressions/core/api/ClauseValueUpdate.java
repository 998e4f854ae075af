package io.github.varda.expressions.core.api;

/**
 * Computes a replacement value for a clause, used when rewriting expressions.
 * <p>
 * A typical use is resolving URIs to identifiers:
 * {@code sample:https://host/samples/3} becomes {@code sample:3}.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClauseValueUpdate {

    /**
     * @param field clause field name
     * @param value current clause value
     * @return the new clause value
     */
    String update(String field, String value);
}
