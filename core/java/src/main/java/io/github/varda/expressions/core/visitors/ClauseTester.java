package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.api.ClausePredicate;
import io.github.varda.expressions.core.ast.BinaryNode;
import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.ExpressionNode;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.dispatch.Visitor;

import java.util.Objects;

/**
 * Tests whether a predicate holds for every clause of a query expression.
 * <p>
 * Child results are always combined with AND, under disjunctions as well as
 * conjunctions: the question is whether each clause on its own satisfies the predicate,
 * not whether the expression as a whole would. Negations pass their child through, and a
 * tautology contains no clause that could fail.
 * </p>
 *
 * <pre>{@code
 * new ClauseTester((field, value) -> value.chars().allMatch(Character::isDigit))
 *     .test(Expressions.parse("not (x:5 and y:zero) or z:77"));  // false
 * }</pre>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class ClauseTester {

    private final Visitor<Boolean> visitor;

    /**
     * @param predicate condition every clause must satisfy
     */
    public ClauseTester(ClausePredicate predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");

        this.visitor = Visitor.<Boolean>builder()
                .onLeaf(Tautology.class, node -> true)
                .onLeaf(Clause.class, node -> predicate.test(node.field(), node.value()))
                .onUnary(ExpressionNode.class, (node, expression) -> expression)
                .onBinary(BinaryNode.class, (node, left, right) -> left && right)
                .build();
    }

    public boolean test(Expression expression) {
        return visitor.visit(expression);
    }
}
