package com.example.formulator.engine;

import com.example.formulator.model.*;
import com.example.formulator.services.*;
import com.example.formulator.storage.FoodImporter;
import com.example.formulator.storage.FoodLookupResult;
import com.example.formulator.storage.Settings;
import java.math.BigDecimal;
import java.util.*;

/**
 * Single entry point for callers (a GUI, an exporter, the CLI demo). Wires the services
 * together and applies user settings to new formulations. Performs no I/O.
 */
public class FormulatorEngine {
    private final Units units;
    private final NutrientNormalizer normalizer;
    private final NutrientOrdering ordering;
    private final NutrientCalculator calculator;
    private final FormulationService formulationService;
    private final CostService costService;
    private final FoodImporter importer;
    private final Settings settings;

    public FormulatorEngine() {
        this(new Settings());
    }

    public FormulatorEngine(Settings settings) {
        this.settings = settings == null ? new Settings() : settings;
        this.units = new Units();
        AliasResolver aliases = AliasResolver.nutrientDefaults();
        this.normalizer = new NutrientNormalizer(units, aliases);
        this.ordering = new NutrientOrdering(units, aliases);
        this.calculator = new NutrientCalculator();
        this.formulationService = new FormulationService();
        this.costService = new CostService(units);
        this.importer = new FoodImporter(normalizer, ordering);
    }

    public Units units() { return units; }
    public NutrientOrdering ordering() { return ordering; }
    public FormulationService formulations() { return formulationService; }
    public CostService costs() { return costService; }
    public Settings settings() { return settings; }

    // ---- nutrients ----

    public List<NutrientRecord> normalizeNutrients(List<NutrientRecord> raw, String dataType) {
        return normalizer.normalize(raw, dataType);
    }

    public Map<String, BigDecimal> calculateTotalsPer100g(Formulation formulation) {
        return calculator.calculateTotalsPer100g(formulation);
    }

    /** Totals re-keyed by header key ({@code name|unit}), ready for column layout. */
    public Map<String, NutrientTotal> totalsByHeaderKey(Formulation formulation) {
        return ordering.normalizeTotalsByHeaderKey(calculator.calculateTotalsWithUnits(formulation).values());
    }

    public Food importFood(FoodLookupResult payload) {
        return importer.importFood(payload);
    }

    // ---- formulation ----

    /** New formulation carrying the configured defaults (mode, yield, cost target, currencies). */
    public Formulation newFormulation(String name) {
        Formulation f = new Formulation(name, settings.defaultQuantityMode, settings.defaultYieldPercent);
        f.setCostTarget(settings.costTargetMassValue, settings.costTargetMassUnit);
        if (settings.currencyRates != null) {
            for (Settings.Rate r : settings.currencyRates) f.addCurrencyRate(new CurrencyRate(r.name, r.symbol, r.rateToBase));
        }
        return f;
    }

    public Ingredient addFood(Formulation formulation, Food food, BigDecimal amountG) {
        Ingredient ingredient = new Ingredient(food, amountG);
        formulation.addIngredient(ingredient);
        return ingredient;
    }

    public void adjustToTargetWeight(Formulation formulation, BigDecimal targetG) {
        formulationService.adjustToTargetWeight(formulation, targetG);
    }

    public void setIngredientAmount(Formulation formulation, int index, BigDecimal amountG, boolean maintainTotal) {
        formulationService.setIngredientAmount(formulation, index, amountG, maintainTotal);
    }

    public void applyPercentEdit(Formulation formulation, int index, BigDecimal targetPercent) {
        formulationService.applyPercentEdit(formulation, index, targetPercent);
    }

    // ---- costs ----

    public CostService.CostTotal totalIngredientsCostBatch(Formulation formulation) {
        return costService.totalIngredientsCostBatch(formulation);
    }

    public CostService.CostTotal totalProcessCostBatch(Formulation formulation) {
        return costService.totalProcessCostBatch(formulation);
    }

    public CostService.UnitCostBreakdown unitCostsForTargetMass(Formulation formulation, BigDecimal targetValue, String targetUnit) {
        return costService.unitCostsForTargetMass(formulation, targetValue, targetUnit);
    }
}
