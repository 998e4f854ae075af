package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * Logical AND, written {@code left and right}.
 *
 * @param left  the first term
 * @param right everything after the {@code and} keyword
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Conjunction(Term left, Expression right) implements BinaryNode, ExpressionContent {

    public Conjunction {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
    }
}
