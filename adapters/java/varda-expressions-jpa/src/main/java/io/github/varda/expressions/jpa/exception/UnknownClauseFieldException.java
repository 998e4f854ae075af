package io.github.varda.expressions.jpa.exception;

import java.util.Set;

/**
 * Thrown when a query expression contains a clause whose field has no mapping.
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public class UnknownClauseFieldException extends RuntimeException {

    private final String field;

    /**
     * @param field       the unmapped field
     * @param knownFields the fields that are mapped
     */
    public UnknownClauseFieldException(String field, Set<String> knownFields) {
        super(String.format("Unknown clause field '%s' (known fields: %s)", field, knownFields));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
