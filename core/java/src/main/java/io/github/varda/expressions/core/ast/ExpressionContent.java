package io.github.varda.expressions.core.ast;

/**
 * Node kinds allowed inside an {@link Expression}.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface ExpressionContent extends Node permits Conjunction, Disjunction, Term {
}
