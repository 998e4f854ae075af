package io.github.varda.expressions.jpa.utils;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Converts clause values, which are always text, to the Java type of the attribute they
 * are compared with.
 *
 * <h2>Supported Types</h2>
 * <ul>
 *   <li>{@code String} (unchanged)</li>
 *   <li>{@code Long}, {@code Integer}, {@code Short} and their primitives, {@code BigDecimal}</li>
 *   <li>{@code Boolean}: {@code true/false}, {@code 1/0}, {@code yes/no}, {@code y/n}, any case</li>
 *   <li>{@code UUID}, {@code LocalDate} (ISO-8601)</li>
 *   <li>enums: exact constant name first, then case-insensitive</li>
 * </ul>
 *
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @author Varda Contributors
 * @since 1.0.0
 */
public final class ClauseValueConverter {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "y");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "n");

    private ClauseValueConverter() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param targetType the attribute type
     * @param value      the clause value
     * @return {@code value} as an instance of the boxed {@code targetType}
     * @throws IllegalArgumentException if the value is not a valid representation or the type
     *                                  is not supported
     */
    public static Object convert(Class<?> targetType, String value) {
        if (targetType == null) {
            throw new IllegalArgumentException("Target type cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }

        if (targetType == String.class) return value;
        if (targetType == Long.class || targetType == long.class) return Long.valueOf(value);
        if (targetType == Integer.class || targetType == int.class) return Integer.valueOf(value);
        if (targetType == Short.class || targetType == short.class) return Short.valueOf(value);
        if (targetType == BigDecimal.class) return new BigDecimal(value);
        if (targetType == Boolean.class || targetType == boolean.class) return convertToBoolean(value);
        if (targetType == UUID.class) return UUID.fromString(value);
        if (targetType == LocalDate.class) return convertToLocalDate(value);
        if (targetType.isEnum()) return convertToEnum(targetType, value);

        throw new IllegalArgumentException("Unsupported clause value type: " + targetType.getName());
    }

    private static LocalDate convertToLocalDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 date: " + value, e);
        }
    }

    private static Boolean convertToBoolean(String value) {
        String normalized = value.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Invalid boolean value: " + value);
    }

    private static Object convertToEnum(Class<?> enumType, String value) {
        Object[] constants = enumType.getEnumConstants();
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equals(value)) {
                return constant;
            }
        }
        for (Object constant : constants) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(String.format("Invalid enum value '%s' for %s. Valid values: %s",
                value, enumType.getSimpleName(), Arrays.toString(constants)));
    }
}
