package io.github.varda.expressions.core.ast;

import java.util.Objects;

/**
 * Grammar slot holding a grouping, a negation, a clause or a tautology.
 *
 * @param expression the term content
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Term(TermContent expression) implements ExpressionNode, ExpressionContent {

    public Term {
        Objects.requireNonNull(expression, "expression cannot be null");
    }
}
