package com.example.formulator;

import com.example.formulator.engine.FormulatorEngine;
import com.example.formulator.model.*;
import com.example.formulator.services.*;
import com.example.formulator.storage.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.*;

public class FormulatorEngineTests {

    private static Food granola(FormulatorEngine engine) throws IOException {
        try (InputStream in = FormulatorEngineTests.class.getResourceAsStream("/sample-data/branded-granola.json")) {
            return engine.importFood(new JsonStorage().loadFoodDetails(in));
        }
    }

    private static Settings settings() {
        Settings s = new Settings();
        s.defaultQuantityMode = Formulation.MODE_PERCENT;
        s.defaultYieldPercent = new BigDecimal("95");
        s.costTargetMassValue = new BigDecimal("50");
        s.costTargetMassUnit = "g";
        s.currencyRates.add(new Settings.Rate("Euro", "€", new BigDecimal("1.1")));
        return s;
    }

    @Test
    void new_formulation_takes_settings_defaults() {
        FormulatorEngine engine = new FormulatorEngine(settings());
        Formulation f = engine.newFormulation("Bar");
        assertEquals(Formulation.MODE_PERCENT, f.getQuantityMode());
        assertEquals(0, new BigDecimal("95").compareTo(f.getYieldPercent()));
        assertEquals(0, new BigDecimal("50").compareTo(f.getCostTargetMassValue()));
        assertEquals(2, f.getCurrencyRates().size());
        assertEquals(CurrencyRate.BASE_SYMBOL, f.getCurrencyRates().get(0).symbol);
        assertEquals("€", f.getCurrencyRates().get(1).symbol);
    }

    @Test
    void null_settings_fall_back_to_defaults() {
        FormulatorEngine engine = new FormulatorEngine(null);
        Formulation f = engine.newFormulation("Plain");
        assertEquals(Formulation.MODE_GRAMS, f.getQuantityMode());
        assertEquals(0, new BigDecimal("100").compareTo(f.getYieldPercent()));
        assertNull(f.getCostTargetMassValue());
        assertEquals(1, f.getCurrencyRates().size());
    }

    @Test
    void imported_food_flows_through_totals_and_costs() throws Exception {
        FormulatorEngine engine = new FormulatorEngine(settings());
        Formulation f = engine.newFormulation("Bar");
        Ingredient g = engine.addFood(f, granola(engine), new BigDecimal("100"));
        g.costPackAmount = BigDecimal.ONE; g.costPackUnit = "kg"; g.costValue = new BigDecimal("6.50"); g.costCurrencySymbol = "$";

        engine.adjustToTargetWeight(f, new BigDecimal("200"));
        assertEquals(0, new BigDecimal("200").compareTo(f.getTotalWeight()));

        // a single food: totals equal the food's own per-100 g values
        assertEquals(10.0, engine.calculateTotalsPer100g(f).get("Protein").doubleValue(), 1e-9);
        Map<String, NutrientTotal> byHeader = engine.totalsByHeaderKey(f);
        assertEquals(10.0, byHeader.get("protein|g").amount.doubleValue(), 1e-9);
        assertEquals(431.0, byHeader.get("energy|kcal").amount.doubleValue(), 1e-9);
        assertEquals(1803.304, byHeader.get("energy|kj").amount.doubleValue(), 1e-9);
        assertEquals("mg", byHeader.get("sodium, na|mg").unit);

        CostService.CostTotal ingredients = engine.totalIngredientsCostBatch(f);
        assertEquals(0, new BigDecimal("1.3").compareTo(ingredients.total));
        assertEquals(0, ingredients.missingCount);
        assertEquals(0, engine.totalProcessCostBatch(f).total.signum());

        // 200 g at 95% yield, 50 g units
        CostService.UnitCostBreakdown unit = engine.unitCostsForTargetMass(f, new BigDecimal("50"), "g");
        assertEquals(0, new BigDecimal("3.8").compareTo(unit.unitsCount));
        assertEquals(1.3 / 3.8, unit.totalCostPerUnit.doubleValue(), 1e-9);
        assertEquals(0, unit.packagingCostPerPack.signum());
    }

    @Test
    void edits_delegate_to_formulation_service() {
        FormulatorEngine engine = new FormulatorEngine();
        Formulation f = engine.newFormulation("Mix");
        engine.addFood(f, new Food(0, "Flour", Food.MANUAL_DATA_TYPE), new BigDecimal("75"));
        engine.addFood(f, new Food(0, "Sugar", Food.MANUAL_DATA_TYPE), new BigDecimal("25"));

        engine.applyPercentEdit(f, 1, new BigDecimal("40"));
        assertEquals(0, new BigDecimal("60").compareTo(f.getIngredient(0).getAmountG()));
        assertEquals(0, new BigDecimal("40").compareTo(f.getIngredient(1).getAmountG()));

        engine.setIngredientAmount(f, 0, new BigDecimal("80"), false);
        assertEquals(0, new BigDecimal("120").compareTo(f.getTotalWeight()));

        assertTrue(engine.formulations().toggleLock(f, 0));
        assertThrows(InvalidFormulationException.class, () -> engine.adjustToTargetWeight(f, new BigDecimal("50")));
    }
}
