package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.dispatch.Visitor;
import io.github.varda.expressions.core.parsing.Grammar;

/**
 * Tests whether a query expression is syntactically exactly one {@code sample:<value>} clause.
 * <p>
 * Only {@link Expression} and {@link Term} wrappers may surround the clause.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class SingletonTester {

    public static final Visitor<Boolean> VISITOR = Visitor.<Boolean>builder()
            .onAny(Node.class, (node, children) -> false)
            .onUnary(Term.class, (node, expression) -> expression)
            .onUnary(Expression.class, (node, expression) -> expression)
            .onLeaf(Clause.class, node -> Grammar.SAMPLE_FIELD.equals(node.field()))
            .build();

    private SingletonTester() {
    }

    public static boolean test(Expression expression) {
        return VISITOR.visit(expression);
    }
}
