package com.example.formulator.services;

import java.math.BigDecimal;

/** A formulation-level nutrient amount together with its unit. */
public class NutrientTotal {
    public final String name;
    public final String unit;
    public final BigDecimal amount;

    public NutrientTotal(String name, String unit, BigDecimal amount) {
        this.name = name; this.unit = unit == null ? "" : unit; this.amount = amount;
    }

    @Override public String toString() { return name + "," + amount + "," + unit; }
}
