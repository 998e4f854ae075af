package io.github.varda.expressions.core.visitors;

import io.github.varda.expressions.core.ast.Clause;
import io.github.varda.expressions.core.ast.Conjunction;
import io.github.varda.expressions.core.ast.Disjunction;
import io.github.varda.expressions.core.ast.Expression;
import io.github.varda.expressions.core.ast.ExpressionContent;
import io.github.varda.expressions.core.ast.Grouping;
import io.github.varda.expressions.core.ast.Negation;
import io.github.varda.expressions.core.ast.Node;
import io.github.varda.expressions.core.ast.Tautology;
import io.github.varda.expressions.core.ast.Term;
import io.github.varda.expressions.core.ast.TermContent;
import io.github.varda.expressions.core.dispatch.Visitor;

/**
 * Deep copy of query expression trees.
 * <p>
 * Rebuilds every node from the rebuilt children, yielding a structurally identical tree
 * that shares no node with its input. Visitors that change only some node kinds extend
 * {@link #VISITOR} and inherit the copying of all the others, see
 * {@link ClauseValueUpdater}.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class Identity {

    public static final Visitor<Node> VISITOR = Visitor.<Node>builder()
            .onLeaf(Tautology.class, node -> new Tautology())
            .onLeaf(Clause.class, node -> new Clause(node.field(), node.value()))
            .onUnary(Expression.class, (node, expression) -> new Expression((ExpressionContent) expression))
            .onUnary(Term.class, (node, expression) -> new Term((TermContent) expression))
            .onUnary(Negation.class, (node, expression) -> new Negation((Term) expression))
            .onUnary(Grouping.class, (node, expression) -> new Grouping((Expression) expression))
            .onBinary(Conjunction.class, (node, left, right) -> new Conjunction((Term) left, (Expression) right))
            .onBinary(Disjunction.class, (node, left, right) -> new Disjunction((Term) left, (Expression) right))
            .build();

    private Identity() {
    }

    /**
     * @param expression tree to copy
     * @return an identical tree made of new nodes
     */
    public static Expression copy(Expression expression) {
        return (Expression) VISITOR.visit(expression);
    }
}
