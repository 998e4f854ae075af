package io.github.varda.expressions.core.exception;

import io.github.varda.expressions.core.ast.Clause;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionSyntaxExceptionTest {

    @Test
    @DisplayName("Should create ExpressionSyntaxException without location")
    void shouldCreateWithoutLocation() {
        // When
        ExpressionSyntaxException exception = new ExpressionSyntaxException("Invalid query expression");

        // Then
        assertEquals("Invalid query expression", exception.getMessage());
        assertNull(exception.getExpression());
        assertEquals(-1, exception.getPosition());
    }

    @Test
    @DisplayName("Should create ExpressionSyntaxException with location")
    void shouldCreateWithLocation() {
        ExpressionSyntaxException exception = new ExpressionSyntaxException("Unexpected ':'", "* : *", 2);

        assertEquals("* : *", exception.getExpression());
        assertEquals(2, exception.getPosition());
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should name the node kind without visit method")
    void shouldNameMissingKind() {
        MissingVisitMethodException exception = new MissingVisitMethodException(Clause.class);

        assertEquals(Clause.class, exception.getNodeKind());
        assertTrue(exception.getMessage().contains("Clause"));
        assertInstanceOf(IllegalStateException.class, exception);
    }
}
