package com.example.formulator.model;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * A food at a given quantity inside one formulation. Mutable: amounts change while the
 * formulation is edited and redistributed.
 */
public class Ingredient {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Food food;
    private BigDecimal amountG;
    private boolean locked;

    // cost inputs; any of them may be missing while the user fills them in
    public BigDecimal costPackAmount;
    public String costPackUnit;
    public BigDecimal costValue;
    public String costCurrencySymbol;
    /** Derived cost per gram in base currency, refreshed by the cost service. */
    public BigDecimal costPerG;

    public Ingredient(Food food, BigDecimal amountG) {
        this(food, amountG, false);
    }

    public Ingredient(Food food, BigDecimal amountG, boolean locked) {
        if (food == null) throw new IllegalArgumentException("Ingredient food cannot be null");
        this.food = food;
        setAmountG(amountG);
        this.locked = locked;
    }

    public Food getFood() { return food; }
    public int getFdcId() { return food.fdcId; }
    public String getDescription() { return food.description; }

    public BigDecimal getAmountG() { return amountG; }

    public void setAmountG(BigDecimal amountG) {
        if (amountG == null) throw new IllegalArgumentException("Ingredient amount cannot be null");
        if (amountG.signum() < 0) throw new IllegalArgumentException("Ingredient amount cannot be negative: " + amountG);
        this.amountG = amountG;
    }

    public boolean isLocked() { return locked; }
    public void setLocked(boolean locked) { this.locked = locked; }

    /** Share of the given total weight in percent; 0 when the total is 0. */
    public BigDecimal calculatePercentage(BigDecimal totalWeight) {
        if (totalWeight == null || totalWeight.signum() == 0) return BigDecimal.ZERO;
        return amountG.multiply(HUNDRED).divide(totalWeight, MathContext.DECIMAL128);
    }

    /** Nutrient amount contributed by this ingredient's quantity (source values are per 100 g). */
    public BigDecimal getNutrientAmount(String nutrientName) {
        Nutrient n = food.getNutrient(nutrientName);
        if (n == null) return BigDecimal.ZERO;
        return n.amount.multiply(amountG).divide(HUNDRED, MathContext.DECIMAL128);
    }

    @Override public String toString() { return food.description + "," + amountG + "g" + (locked ? ",locked" : ""); }
}
