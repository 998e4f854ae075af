package io.github.varda.expressions.core.ast;

/**
 * Node kinds allowed inside a {@link Term}.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface TermContent extends Node permits Grouping, Negation, Clause, Tautology {
}
