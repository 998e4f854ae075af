package io.github.varda.expressions.jpa.entities;

public enum Visibility {
    PUBLIC,
    PRIVATE
}
