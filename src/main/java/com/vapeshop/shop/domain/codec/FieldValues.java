package com.vapeshop.shop.domain.codec;

import com.vapeshop.shop.exception.StoreException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Coercion helpers shared by the record codecs.
 *
 * @author Vape Shop Team
 */
final class FieldValues {

    private FieldValues() {
    }

    static void put(Map<String, String> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value.toString());
        }
    }

    static String readString(Map<String, String> fields, String name) {
        return fields.get(name);
    }

    static Long readLong(Map<String, String> fields, String name) {
        BigDecimal number = readNumber(fields, name);
        if (number == null) {
            return null;
        }
        try {
            return number.longValueExact();
        } catch (ArithmeticException e) {
            throw new StoreException(name, "Field " + name + " is not a whole 64-bit number: " + number, e);
        }
    }

    static Integer readInt(Map<String, String> fields, String name) {
        BigDecimal number = readNumber(fields, name);
        if (number == null) {
            return null;
        }
        try {
            return number.intValueExact();
        } catch (ArithmeticException e) {
            throw new StoreException(name, "Field " + name + " is not a whole 32-bit number: " + number, e);
        }
    }

    static int readInt(Map<String, String> fields, String name, int defaultValue) {
        Integer value = readInt(fields, name);
        return value == null ? defaultValue : value;
    }

    static long readLong(Map<String, String> fields, String name, long defaultValue) {
        Long value = readLong(fields, name);
        return value == null ? defaultValue : value;
    }

    static Instant readInstant(Map<String, String> fields, String name) {
        String raw = fields.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new StoreException(name, "Malformed timestamp in field " + name + ": " + raw, e);
        }
    }

    // Accepts "450" as well as "450.0", which older JSON-sourced records contain.
    private static BigDecimal readNumber(Map<String, String> fields, String name) {
        String raw = fields.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new StoreException(name, "Malformed number in field " + name + ": " + raw, e);
        }
    }
}
