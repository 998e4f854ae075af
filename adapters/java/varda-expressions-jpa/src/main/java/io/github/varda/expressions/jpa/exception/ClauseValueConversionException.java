package io.github.varda.expressions.jpa.exception;

/**
 * Thrown when a clause value cannot be converted to the type of the attribute it is
 * compared with, e.g. {@code sample:abc} against a numeric identifier.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public class ClauseValueConversionException extends RuntimeException {

    private final String field;
    private final String value;
    private final Class<?> targetType;

    /**
     * @param field      the clause field
     * @param value      the raw clause value
     * @param targetType the attribute type
     * @param cause      the conversion failure
     */
    public ClauseValueConversionException(String field, String value, Class<?> targetType, Throwable cause) {
        super(String.format("Cannot convert value '%s' of clause field '%s' to %s",
                value, field, targetType.getSimpleName()), cause);
        this.field = field;
        this.value = value;
        this.targetType = targetType;
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }

    public Class<?> getTargetType() {
        return targetType;
    }
}
