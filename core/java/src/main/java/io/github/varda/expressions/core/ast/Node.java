package io.github.varda.expressions.core.ast;

import io.github.varda.expressions.core.dispatch.Visitor;

/**
 * Root of the closed set of query expression AST node kinds.
 * <p>
 * Every node belongs to exactly one structural category, which decides how a
 * {@link Visitor} walks it:
 * </p>
 * <ul>
 *   <li>{@link Leaf}: no children ({@link Tautology}, {@link Clause})</li>
 *   <li>{@link ExpressionNode}: one child ({@link Expression}, {@link Term}, {@link Negation}, {@link Grouping})</li>
 *   <li>{@link BinaryNode}: a left and a right child ({@link Conjunction}, {@link Disjunction})</li>
 * </ul>
 * <p>
 * The two slot interfaces {@link TermContent} and {@link ExpressionContent} describe
 * which kinds may be placed inside a {@link Term} and an {@link Expression}. They carry
 * no behaviour.
 * </p>
 * <p>
 * Nodes are immutable records. A "changed" tree is always a new tree.
 * </p>
 *
 * @see Visitor
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface Node permits Leaf, ExpressionNode, BinaryNode, TermContent, ExpressionContent {

    /**
     * Walks this node post-order with the given visitor and returns the result
     * computed for this node.
     *
     * @param visitor the dispatch table to apply
     * @param <R>     result type of the visitor
     * @return the visitor result for this node
     */
    default <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }
}
