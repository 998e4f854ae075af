package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * Logical OR, written {@code left or right}.
 *
 * @param left  the first term
 * @param right everything after the {@code or} keyword
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Disjunction(Term left, Expression right) implements BinaryNode, ExpressionContent {

    public Disjunction {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
    }
}
