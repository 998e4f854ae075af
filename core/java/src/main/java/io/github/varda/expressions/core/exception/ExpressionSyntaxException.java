package io.github.varda.expressions.core.exception;

import io.github.varda.expressions.core.api.ExpressionParser;

/**
 * Exception thrown when a query expression does not match the grammar in its entirety.
 * <p>
 * Raised for malformed input of any kind: trailing tokens, empty groupings, keywords
 * used as a field, empty clause values, empty or blank input, and input exceeding the
 * length or nesting limits of the active
 * {@link io.github.varda.expressions.core.config.ExpressionPolicy}. No partial tree is
 * ever returned alongside it.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Expression expression = parser.parse(text);
 * } catch (ExpressionSyntaxException e) {
 *     // reject the request; e.getPosition() points at the offending character
 *     return ResponseEntity.badRequest().body("Invalid query expression: " + e.getMessage());
 * }
 * }</pre>
 *
 * @see ExpressionParser
 * @author Varda Contributors
 * @since 1.0.0
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final String expression;
    private final int position;

    /**
     * Constructor for failures not tied to a location in the input.
     *
     * @param message description of the failure
     */
    public ExpressionSyntaxException(String message) {
        this(message, null, -1);
    }

    /**
     * Constructor for failures located in the input.
     *
     * @param message    description of the failure, including the position
     * @param expression the rejected input
     * @param position   zero-based offset of the failure, or {@code -1}
     */
    public ExpressionSyntaxException(String message, String expression, int position) {
        super(message);
        this.expression = expression;
        this.position = position;
    }

    /**
     * @return the rejected input, or {@code null} if unknown
     */
    public String getExpression() {
        return expression;
    }

    /**
     * @return zero-based offset of the failure, or {@code -1} if not applicable
     */
    public int getPosition() {
        return position;
    }
}
