package io.github.varda.expressions.core.ast;

/**
 * Structural category of connective nodes.
 * <p>
 * The left operand is always a single {@link Term}; the right operand is the whole
 * remaining {@link Expression}. This right-leaning shape is what the parser's
 * grouping rule produces.
 * </p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface BinaryNode extends Node permits Conjunction, Disjunction {

    /**
     * @return the left operand
     */
    Term left();

    /**
     * @return the right operand
     */
    Expression right();
}
