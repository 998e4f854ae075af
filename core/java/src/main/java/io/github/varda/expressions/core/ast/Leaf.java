package io.github.varda.expressions.core.ast;

/**
 * Structural category of nodes without children.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public sealed interface Leaf extends Node permits Tautology, Clause {
}
