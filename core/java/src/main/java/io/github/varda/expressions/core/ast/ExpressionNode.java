package io.github.varda.expressions.core.ast;

/**
 * Structural category of wrapper nodes holding exactly one child.
 * <p>
 * Wrappers carry no value of their own. Visitors receive the result computed for
 * {@link #expression()} together with the wrapper itself.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface ExpressionNode extends Node permits Expression, Term, Negation, Grouping {

    /**
     * @return the wrapped child node
     */
    Node expression();
}
