package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * Root grammar symbol, also used for the remainder on the right of {@code and}/{@code or}.
 *
 * @param expression a conjunction, a disjunction or a single term
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Expression(ExpressionContent expression) implements ExpressionNode {

    public Expression {
        Objects.requireNonNull(expression, "expression cannot be null");
    }
}
