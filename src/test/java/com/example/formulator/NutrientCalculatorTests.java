package com.example.formulator;

import com.example.formulator.model.*;
import com.example.formulator.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.*;

public class NutrientCalculatorTests {
    private final NutrientCalculator calculator = new NutrientCalculator();

    private static Food food(int fdcId, String description, Nutrient... nutrients) {
        return new Food(fdcId, description, "SR Legacy", "", List.of(nutrients));
    }

    private static Nutrient n(String name, String unit, String amount) {
        return new Nutrient(name, unit, new BigDecimal(amount));
    }

    @Test
    void totals_per_100g_average_by_weight() {
        Formulation f = new Formulation("Blend");
        f.addIngredient(new Ingredient(food(1, "Chicken", n("Protein", "g", "31.0")), new BigDecimal("100")));
        f.addIngredient(new Ingredient(food(2, "Rice", n("Protein", "g", "7.1")), new BigDecimal("100")));

        Map<String, BigDecimal> totals = calculator.calculateTotalsPer100g(f);
        assertEquals(0, new BigDecimal("19.05").compareTo(totals.get("Protein")));
    }

    @Test
    void totals_keep_first_seen_order_and_unit() {
        Formulation f = new Formulation("Blend");
        f.addIngredient(new Ingredient(food(1, "A", n("Water", "g", "80"), n("Sodium, Na", "mg", "40")), new BigDecimal("25")));
        f.addIngredient(new Ingredient(food(2, "B", n("Protein", "g", "10"), n("Water", "g", "20")), new BigDecimal("75")));

        Map<String, NutrientTotal> totals = calculator.calculateTotalsWithUnits(f);
        assertEquals(List.of("Water", "Sodium, Na", "Protein"), new ArrayList<>(totals.keySet()));
        assertEquals("mg", totals.get("Sodium, Na").unit);
        // 80*0.25 + 20*0.75 = 35 g per 100 g
        assertEquals(35.0, totals.get("Water").amount.doubleValue(), 1e-9);
        assertEquals(10.0, totals.get("Sodium, Na").amount.doubleValue(), 1e-9);
        assertEquals(7.5, totals.get("Protein").amount.doubleValue(), 1e-9);
    }

    @Test
    void energy_units_are_summed_separately() {
        Formulation f = new Formulation("Blend");
        f.addIngredient(new Ingredient(food(1, "A", n("Energy", "kcal", "100"), n("Energy", "kJ", "418.4")), new BigDecimal("50")));
        f.addIngredient(new Ingredient(food(2, "B", n("Energy", "kcal", "300"), n("Energy", "kJ", "1255.2")), new BigDecimal("50")));

        Map<String, NutrientTotal> totals = calculator.calculateTotalsWithUnits(f);
        assertEquals(List.of("Energy", "Energy (kJ)"), new ArrayList<>(totals.keySet()));
        assertEquals(200.0, totals.get("Energy").amount.doubleValue(), 1e-9);
        assertEquals("Energy", totals.get("Energy (kJ)").name);
        assertEquals("kJ", totals.get("Energy (kJ)").unit);
        assertEquals(836.8, totals.get("Energy (kJ)").amount.doubleValue(), 1e-9);
    }

    @Test
    void empty_or_weightless_formulations_have_no_totals() {
        Formulation f = new Formulation("Empty");
        assertTrue(calculator.calculateTotalsPer100g(f).isEmpty());
        f.addIngredient(new Ingredient(food(1, "A", n("Protein", "g", "10")), BigDecimal.ZERO));
        assertTrue(calculator.calculateTotalsPer100g(f).isEmpty());
    }

    @Test
    void per_ingredient_amounts_are_absolute() {
        Formulation f = new Formulation("Blend");
        f.addIngredient(new Ingredient(food(1, "A", n("Protein", "g", "20")), new BigDecimal("50")));
        f.addIngredient(new Ingredient(food(2, "B", n("Protein", "g", "5")), new BigDecimal("200")));

        Map<Integer, Map<String, BigDecimal>> per = calculator.calculatePerIngredient(f);
        assertEquals(0, BigDecimal.TEN.compareTo(per.get(0).get("Protein")));
        assertEquals(0, BigDecimal.TEN.compareTo(per.get(1).get("Protein")));
    }

    @Test
    void energy_from_macros() {
        NutrientCalculator.Energy e = calculator.calculateEnergy(new BigDecimal("10"), new BigDecimal("20"), new BigDecimal("5"));
        assertEquals(0, new BigDecimal("165").compareTo(e.kcal));
        assertEquals(0, new BigDecimal("690.36").compareTo(e.kj));
    }

    @Test
    void nutrient_value_lookup_is_case_insensitive() {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        totals.put("Protein", new BigDecimal("12"));
        assertEquals(0, new BigDecimal("12").compareTo(calculator.nutrientValue(totals, "PROTEIN")));
        assertEquals(0, BigDecimal.ZERO.compareTo(calculator.nutrientValue(totals, "Water")));
    }

    @Test
    void scaling_round_trip_restores_amounts() {
        Formulation f = new Formulation("Blend");
        f.addIngredient(new Ingredient(food(1, "A"), new BigDecimal("33.3")));
        f.addIngredient(new Ingredient(food(2, "B"), new BigDecimal("66.7")));
        FormulationService service = new FormulationService();

        service.normalizeToTargetWeight(f, new BigDecimal("700"));
        service.normalizeToTargetWeight(f, new BigDecimal("100"));
        assertEquals(33.3, f.getIngredient(0).getAmountG().doubleValue(), 1e-9);
        assertEquals(66.7, f.getIngredient(1).getAmountG().doubleValue(), 1e-9);
    }
}
