package io.github.varda.expressions.core.ast;

import io.github.varda.expressions.core.parsing.Grammar;

import java.util.Objects;

/**
 * Atomic predicate stating that {@code field} has {@code value}, written {@code field:value}.
 *
 * @param field a symbol that is not a reserved keyword
 * @param value one or more characters, none of them whitespace or a parenthesis
 * @author Varda Contributors
 * @since 1.0.0
 */
public record Clause(String field, String value) implements Leaf, TermContent {

    /**
     * @throws NullPointerException     if {@code field} or {@code value} is {@code null}
     * @throws IllegalArgumentException if {@code field} is not a valid symbol or is a keyword,
     *                                  or if {@code value} is not a valid clause value
     */
    public Clause {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(value, "value cannot be null");

        if (!Grammar.isSymbol(field) || Grammar.isKeyword(field)) {
            throw new IllegalArgumentException("Invalid clause field '" + field + "'");
        }
        if (!Grammar.isValue(value)) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for clause field '" + field + "'");
        }
    }
}
