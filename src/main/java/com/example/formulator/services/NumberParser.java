package com.example.formulator.services;

import java.math.BigDecimal;

/**
 * Parses user-typed or imported numbers written with either decimal convention.
 * When a comma is present the last comma is the decimal mark and periods group thousands,
 * so "1.234,5" is 1234.5 and "0,25" is 0.25. Without a comma the period is the decimal mark.
 */
public final class NumberParser {
    private NumberParser() {}

    /** Returns null for null, blank or unparsable input. */
    public static BigDecimal parse(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal) return (BigDecimal) value;
        return parse(value.toString());
    }

    public static BigDecimal parse(String text) {
        if (text == null) return null;
        String cleaned = text.trim().replace(" ", "");
        if (cleaned.isEmpty()) return null;
        if (cleaned.contains(",")) {
            // last comma is the decimal mark, periods group thousands
            cleaned = cleaned.replace(".", "");
            int mark = cleaned.lastIndexOf(',');
            cleaned = cleaned.substring(0, mark).replace(",", "") + "." + cleaned.substring(mark + 1);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
