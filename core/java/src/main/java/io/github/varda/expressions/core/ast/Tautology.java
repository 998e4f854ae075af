package io.github.varda.expressions.core.ast;

/**
 * The universal match, written {@code *}.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Tautology() implements Leaf, TermContent {
}
