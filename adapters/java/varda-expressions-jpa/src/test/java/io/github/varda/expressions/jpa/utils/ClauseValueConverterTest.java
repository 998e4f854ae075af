package io.github.varda.expressions.jpa.utils;

import io.github.varda.expressions.jpa.entities.Visibility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ClauseValueConverterTest {

    @Test
    @DisplayName("Should convert to supported types")
    void shouldConvertSupportedTypes() {
        assertEquals("abc", ClauseValueConverter.convert(String.class, "abc"));
        assertEquals(42L, ClauseValueConverter.convert(Long.class, "42"));
        assertEquals(42L, ClauseValueConverter.convert(long.class, "42"));
        assertEquals(7, ClauseValueConverter.convert(Integer.class, "7"));
        assertEquals((short) 3, ClauseValueConverter.convert(Short.class, "3"));
        assertEquals(new BigDecimal("1.50"), ClauseValueConverter.convert(BigDecimal.class, "1.50"));
        assertEquals(LocalDate.of(2024, 1, 15), ClauseValueConverter.convert(LocalDate.class, "2024-01-15"));
        UUID uuid = UUID.randomUUID();
        assertEquals(uuid, ClauseValueConverter.convert(UUID.class, uuid.toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "1", "yes", "Y"})
    void shouldConvertTrueValues(String value) {
        assertEquals(Boolean.TRUE, ClauseValueConverter.convert(Boolean.class, value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"false", "0", "No", "n"})
    void shouldConvertFalseValues(String value) {
        assertEquals(Boolean.FALSE, ClauseValueConverter.convert(boolean.class, value));
    }

    @Test
    @DisplayName("Should match enum constants exactly, then ignoring case")
    void shouldConvertEnums() {
        assertEquals(Visibility.PUBLIC, ClauseValueConverter.convert(Visibility.class, "PUBLIC"));
        assertEquals(Visibility.PRIVATE, ClauseValueConverter.convert(Visibility.class, "private"));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> ClauseValueConverter.convert(Visibility.class, "hidden"));
        assertTrue(exception.getMessage().contains("[PUBLIC, PRIVATE]"));
    }

    @Test
    @DisplayName("Should report invalid values and types as IllegalArgumentException")
    void shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(Long.class, "x"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(Boolean.class, "maybe"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(UUID.class, "not-a-uuid"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(LocalDate.class, "2024-13-45"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(Double.class, "1.0"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(null, "1"));
        assertThrows(IllegalArgumentException.class, () -> ClauseValueConverter.convert(String.class, null));
    }
}
