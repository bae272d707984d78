package com.example.formulator.services;

import com.example.formulator.model.*;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;

/** Aggregates ingredient nutrients (per 100 g of each food) into formulation totals. */
public class NutrientCalculator {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static class Energy {
        public final BigDecimal kcal;
        public final BigDecimal kj;
        public Energy(BigDecimal kcal, BigDecimal kj) { this.kcal = kcal; this.kj = kj; }
        @Override public String toString() { return kcal + " kcal / " + kj + " kJ"; }
    }

    /**
     * Nutrient totals per 100 g of the finished formulation, keyed by nutrient name in
     * first-seen order. Empty when the formulation is empty or weighs nothing.
     */
    public Map<String, BigDecimal> calculateTotalsPer100g(Formulation formulation) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        for (var e : calculateTotalsWithUnits(formulation).entrySet()) out.put(e.getKey(), e.getValue().amount);
        return out;
    }

    /**
     * Same sums as {@link #calculateTotalsPer100g}, carrying the unit of each row. A name seen
     * again with a different unit gets its own entry keyed {@code name (unit)}.
     */
    public Map<String, NutrientTotal> calculateTotalsWithUnits(Formulation formulation) {
        Map<String, NutrientTotal> out = new LinkedHashMap<>();
        if (formulation == null || formulation.isEmpty()) return out;
        BigDecimal totalWeight = formulation.getTotalWeight();
        if (totalWeight.signum() == 0) return out;

        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        Map<String, String> unitsByName = new HashMap<>();
        Map<String, NutrientTotal> shapes = new HashMap<>();
        for (Ingredient ing : formulation.getIngredients()) {
            for (Nutrient n : ing.getFood().nutrients) {
                BigDecimal scaled = n.amount.multiply(ing.getAmountG()).divide(HUNDRED, MathContext.DECIMAL128);
                String firstUnit = unitsByName.putIfAbsent(n.name, n.unit);
                // kcal and kJ rows share a name but must not be added together
                String key = firstUnit == null || firstUnit.equalsIgnoreCase(n.unit) ? n.name : n.name + " (" + n.unit + ")";
                sums.merge(key, scaled, BigDecimal::add);
                shapes.putIfAbsent(key, new NutrientTotal(n.name, n.unit, BigDecimal.ZERO));
            }
        }

        BigDecimal factor = HUNDRED.divide(totalWeight, MathContext.DECIMAL128);
        for (var e : sums.entrySet()) {
            BigDecimal per100g = e.getValue().multiply(factor, MathContext.DECIMAL128);
            NutrientTotal shape = shapes.get(e.getKey());
            out.put(e.getKey(), new NutrientTotal(shape.name, shape.unit, per100g));
        }
        return out;
    }

    /** Absolute nutrient amounts contributed by each ingredient, by ingredient index. */
    public Map<Integer, Map<String, BigDecimal>> calculatePerIngredient(Formulation formulation) {
        Map<Integer, Map<String, BigDecimal>> result = new LinkedHashMap<>();
        List<Ingredient> ingredients = formulation.getIngredients();
        for (int i = 0; i < ingredients.size(); i++) {
            Ingredient ing = ingredients.get(i);
            Map<String, BigDecimal> amounts = new LinkedHashMap<>();
            for (Nutrient n : ing.getFood().nutrients) {
                amounts.put(n.name, n.amount.multiply(ing.getAmountG()).divide(HUNDRED, MathContext.DECIMAL128));
            }
            result.put(i, amounts);
        }
        return result;
    }

    /** Atwater energy (4/4/9 kcal per gram of protein/carbohydrate/fat). */
    public Energy calculateEnergy(BigDecimal proteinG, BigDecimal carbohydrateG, BigDecimal fatG) {
        BigDecimal kcal = proteinG.multiply(NutrientNormalizer.ATWATER_PROTEIN)
                .add(carbohydrateG.multiply(NutrientNormalizer.ATWATER_CARBOHYDRATE))
                .add(fatG.multiply(NutrientNormalizer.ATWATER_FAT));
        return new Energy(kcal, kcal.multiply(Units.KCAL_TO_KJ));
    }

    /** Case-insensitive lookup in a totals map; zero when absent. */
    public BigDecimal nutrientValue(Map<String, BigDecimal> totals, String nutrientName) {
        for (var e : totals.entrySet()) if (e.getKey().equalsIgnoreCase(nutrientName)) return e.getValue();
        return BigDecimal.ZERO;
    }
}
