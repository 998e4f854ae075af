package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * Logical NOT of a single term, written {@code not term}.
 *
 * @param expression the negated term
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Negation(Term expression) implements ExpressionNode, TermContent {

    public Negation {
        Objects.requireNonNull(expression, "expression cannot be null");
    }
}
