package com.example.formulator.model;

import java.math.BigDecimal;

/**
 * A nutrient row as delivered by a food source, before normalization.
 * Unlike {@link Nutrient} the unit and amount may be missing.
 */
public class NutrientRecord {
    public final String name;
    public final String unit;       // nullable
    public final BigDecimal amount; // nullable
    public final Integer id;        // nullable
    public final String number;     // nullable
    public final Integer rank;      // nullable

    public NutrientRecord(String name, String unit, BigDecimal amount) {
        this(name, unit, amount, null, null, null);
    }

    public NutrientRecord(String name, String unit, BigDecimal amount, Integer id, String number, Integer rank) {
        this.name = name == null ? "" : name;
        this.unit = unit; this.amount = amount; this.id = id; this.number = number; this.rank = rank;
    }

    /** Trimmed, lower-cased name used for all name comparisons. */
    public String normalizedName() { return name.trim().toLowerCase(); }

    public boolean hasAmount() { return amount != null; }

    public NutrientRecord withName(String newName) { return new NutrientRecord(newName, unit, amount, id, number, rank); }
    public NutrientRecord withUnit(String newUnit) { return new NutrientRecord(name, newUnit, amount, id, number, rank); }
    public NutrientRecord withAmount(BigDecimal newAmount) { return new NutrientRecord(name, unit, newAmount, id, number, rank); }
    public NutrientRecord withoutSourceIds() { return new NutrientRecord(name, unit, amount, null, null, rank); }

    @Override public String toString() { return name + "," + amount + "," + unit; }
}
