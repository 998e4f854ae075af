package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * An explicit parenthesization taken from the source text, written {@code (expression)}.
 * <p>
 * Groupings are never inferred from precedence and never collapsed; they survive every
 * transformation exactly where they were written.
 * </p>
 *
 * @param expression the parenthesized expression
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Grouping(Expression expression) implements ExpressionNode, TermContent {

    public Grouping {
        Objects.requireNonNull(expression, "expression cannot be null");
    }
}
