package com.example.formulator.model;

/** Billing model of a production process. */
public enum ScaleType {
    /** Flat cost per batch. */
    FIXED,
    /** Time scales with batch mass. */
    VARIABLE_PER_KG,
    /** Setup time plus time per kg. */
    MIXED;

    /** Lenient parse; null for blank or unknown values. */
    public static ScaleType parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return ScaleType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
