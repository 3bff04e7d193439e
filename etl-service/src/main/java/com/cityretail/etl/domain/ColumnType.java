package com.cityretail.etl.domain;

import com.cityretail.etl.exception.DataCoercionException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Warehouse column types and the conversion of cleaned values into JDBC bind values.
 * Blank strings and {@code null} always convert to SQL NULL.
 */
public enum ColumnType {

    INTEGER {
        @Override
        Object convert(Object value) {
            if (value instanceof Long l) {
                return l;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            BigDecimal decimal = value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString().trim());
            try {
                // "20240101.0" is a whole number written by a float-typed extract
                return decimal.stripTrailingZeros().longValueExact();
            } catch (ArithmeticException e) {
                throw new DataCoercionException("Not a whole number: " + value, e);
            }
        }
    },

    DECIMAL {
        @Override
        Object convert(Object value) {
            if (value instanceof BigDecimal bd) {
                return bd;
            }
            return new BigDecimal(value.toString().trim());
        }
    },

    TEXT {
        @Override
        Object convert(Object value) {
            return value.toString();
        }
    },

    DATE {
        @Override
        Object convert(Object value) {
            if (value instanceof LocalDate date) {
                return java.sql.Date.valueOf(date);
            }
            if (value instanceof java.sql.Date date) {
                return date;
            }
            String text = value.toString().trim();
            try {
                // snapshot files may carry a midnight time component
                return java.sql.Date.valueOf(LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text));
            } catch (DateTimeParseException e) {
                throw new DataCoercionException("Not an ISO date: " + value, e);
            }
        }
    },

    BOOLEAN {
        @Override
        Object convert(Object value) {
            if (value instanceof Boolean b) {
                return b;
            }
            String text = value.toString().trim().toLowerCase();
            return switch (text) {
                case "true", "t", "1" -> Boolean.TRUE;
                case "false", "f", "0" -> Boolean.FALSE;
                default -> throw new DataCoercionException("Not a boolean: " + value);
            };
        }
    };

    abstract Object convert(Object value);

    public Object toSqlValue(Object value) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            return null;
        }
        try {
            return convert(value);
        } catch (NumberFormatException e) {
            throw new DataCoercionException("Cannot convert '" + value + "' to " + name(), e);
        }
    }
}
