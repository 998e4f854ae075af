package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.dispatch.Visitor;

/**
 * Tests whether a query expression is syntactically exactly {@code *}.
 * <p>
 * Only {@link Expression} and {@link Term} wrappers may surround the tautology. Any
 * grouping, negation, clause or connective makes the test fail, so {@code (*)} and
 * {@code * or *} are not tautologies here even though they match everything.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class TautologyTester {

    public static final Visitor<Boolean> VISITOR = Visitor.<Boolean>builder()
            .onAny(Node.class, (node, children) -> false)
            .onUnary(Term.class, (node, expression) -> expression)
            .onUnary(Expression.class, (node, expression) -> expression)
            .onLeaf(Tautology.class, node -> true)
            .build();

    private TautologyTester() {
    }

    public static boolean test(Expression expression) {
        return VISITOR.visit(expression);
    }
}
