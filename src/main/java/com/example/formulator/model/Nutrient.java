package com.example.formulator.model;

import java.math.BigDecimal;

/** A nutrient amount per 100 g of a food. Immutable. */
public class Nutrient {
    public final String name;
    public final String unit;
    public final BigDecimal amount;
    public final Integer id;        // nullable
    public final String number;     // nullable

    public Nutrient(String name, String unit, BigDecimal amount) {
        this(name, unit, amount, null, null);
    }

    public Nutrient(String name, String unit, BigDecimal amount, Integer id, String number) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Nutrient name cannot be empty");
        if (unit == null || unit.isBlank()) throw new IllegalArgumentException("Nutrient unit cannot be empty");
        if (amount == null) throw new IllegalArgumentException("Nutrient amount cannot be null: " + name);
        if (amount.signum() < 0) throw new IllegalArgumentException("Nutrient amount cannot be negative: " + amount);
        this.name = name; this.unit = unit; this.amount = amount; this.id = id; this.number = number;
    }

    /** Returns a copy with the amount multiplied by the factor. */
    public Nutrient scale(BigDecimal factor) {
        return new Nutrient(name, unit, amount.multiply(factor), id, number);
    }

    @Override public String toString() { return name + "," + amount + "," + unit; }
}
