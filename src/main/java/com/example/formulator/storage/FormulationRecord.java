package com.example.formulator.storage;

import com.example.formulator.model.*;
import com.example.formulator.services.NumberParser;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.*;

/**
 * On-disk shape of a formulation. Decimals are written as plain strings and read back
 * through {@link NumberParser}, so hand-edited files may use a decimal comma.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FormulationRecord {
    private static final Set<String> TARGET_UNITS = Set.of("g", "kg", "lb", "oz", "ton");

    public String name;
    public String quantityMode;
    public String yieldPercent;
    public String costTargetMassValue;
    public String costTargetMassUnit;
    public List<RateEntry> currencyRates = new ArrayList<>();
    public List<ProcessEntry> processCosts = new ArrayList<>();
    public List<PackagingEntry> packagingItems = new ArrayList<>();
    public List<IngredientEntry> ingredients = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RateEntry {
        public String name;
        public String symbol;
        @JsonAlias("rate_to_mn")
        public String rateToBase;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ProcessEntry {
        public String name;
        public String scaleType;
        public String timeValue;
        public String timeUnit;
        @JsonAlias("cost_per_hour_mn")
        public String costPerHour;
        @JsonAlias("total_cost_mn")
        public String totalCost;
        public String setupTimeValue;
        public String setupTimeUnit;
        public String timePerKgValue;
        public String notes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PackagingEntry {
        public String name;
        public String quantityPerPack;
        @JsonAlias("unit_cost_mn")
        public String unitCost;
        public String unitCostValue;
        public String unitCostCurrencySymbol;
        public String notes;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class IngredientEntry {
        public Integer fdcId;
        public String description;
        public String dataType;
        public String brandOwner;
        public String amountG;
        public boolean locked;
        public String costPackAmount;
        public String costPackUnit;
        public String costValue;
        public String costCurrencySymbol;
        @JsonAlias("cost_per_g_mn")
        public String costPerG;
        public List<NutrientEntry> nutrients = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class NutrientEntry {
        public String name;
        public String unit;
        public String amount;
        public Integer nutrientId;
        public String nutrientNumber;
    }

    // ---- domain -> record ----

    public static FormulationRecord from(Formulation f) {
        FormulationRecord r = new FormulationRecord();
        r.name = f.getName();
        r.quantityMode = f.getQuantityMode();
        r.yieldPercent = text(f.getYieldPercent());
        r.costTargetMassValue = text(f.getCostTargetMassValue());
        r.costTargetMassUnit = f.getCostTargetMassUnit();

        for (CurrencyRate rate : f.getCurrencyRates()) {
            RateEntry e = new RateEntry();
            e.name = rate.name; e.symbol = rate.symbol; e.rateToBase = text(rate.rateToBase);
            r.currencyRates.add(e);
        }
        for (ProcessCost p : f.getProcessCosts()) {
            ProcessEntry e = new ProcessEntry();
            e.name = p.name;
            e.scaleType = p.scaleType == null ? null : p.scaleType.name();
            e.timeValue = text(p.timeValue);
            e.timeUnit = p.timeUnit;
            e.costPerHour = text(p.costPerHour);
            e.totalCost = text(p.totalCost);
            e.setupTimeValue = text(p.setupTimeValue);
            e.setupTimeUnit = p.setupTimeUnit;
            e.timePerKgValue = text(p.timePerKgValue);
            e.notes = p.notes;
            r.processCosts.add(e);
        }
        for (PackagingItem p : f.getPackagingItems()) {
            PackagingEntry e = new PackagingEntry();
            e.name = p.name;
            e.quantityPerPack = text(p.quantityPerPack);
            e.unitCost = text(p.unitCost);
            e.unitCostValue = text(p.unitCostValue);
            e.unitCostCurrencySymbol = p.unitCostCurrencySymbol;
            e.notes = p.notes;
            r.packagingItems.add(e);
        }
        for (Ingredient ing : f.getIngredients()) {
            IngredientEntry e = new IngredientEntry();
            Food food = ing.getFood();
            e.fdcId = food.fdcId;
            e.description = food.description;
            e.dataType = food.dataType;
            e.brandOwner = food.brandOwner;
            e.amountG = text(ing.getAmountG());
            e.locked = ing.isLocked();
            e.costPackAmount = text(ing.costPackAmount);
            e.costPackUnit = ing.costPackUnit;
            e.costValue = text(ing.costValue);
            e.costCurrencySymbol = ing.costCurrencySymbol;
            e.costPerG = text(ing.costPerG);
            for (Nutrient n : food.nutrients) {
                NutrientEntry ne = new NutrientEntry();
                ne.name = n.name; ne.unit = n.unit; ne.amount = text(n.amount);
                ne.nutrientId = n.id; ne.nutrientNumber = n.number;
                e.nutrients.add(ne);
            }
            r.ingredients.add(e);
        }
        return r;
    }

    // ---- record -> domain ----

    /** Throws IllegalArgumentException when a value breaks an entity invariant. */
    public Formulation toFormulation() {
        Formulation f = new Formulation(name,
                quantityMode == null || quantityMode.isBlank() ? Formulation.MODE_GRAMS : quantityMode,
                NumberParser.parse(yieldPercent));

        BigDecimal targetValue = NumberParser.parse(costTargetMassValue);
        String targetUnit = costTargetMassUnit == null ? "" : costTargetMassUnit.trim();
        f.setCostTarget(targetValue != null && targetValue.signum() > 0 ? targetValue : null,
                TARGET_UNITS.contains(targetUnit) ? targetUnit : null);

        List<CurrencyRate> rates = new ArrayList<>();
        for (RateEntry e : currencyRates) {
            String symbol = e.symbol == null ? "" : e.symbol.trim();
            BigDecimal rate = NumberParser.parse(e.rateToBase);
            if (symbol.isEmpty() || rate == null) continue;
            String rateName = e.name == null || e.name.isBlank() ? symbol : e.name.trim();
            rates.add(new CurrencyRate(rateName, symbol, rate));
        }
        if (!rates.isEmpty()) f.setCurrencyRates(rates);

        for (ProcessEntry e : processCosts) {
            ProcessCost p = new ProcessCost(e.name == null ? "" : e.name, ScaleType.parse(e.scaleType));
            p.timeValue = NumberParser.parse(e.timeValue);
            p.timeUnit = e.timeUnit;
            p.costPerHour = NumberParser.parse(e.costPerHour);
            p.totalCost = NumberParser.parse(e.totalCost);
            p.setupTimeValue = NumberParser.parse(e.setupTimeValue);
            p.setupTimeUnit = e.setupTimeUnit;
            p.timePerKgValue = NumberParser.parse(e.timePerKgValue);
            p.notes = e.notes;
            f.addProcessCost(p);
        }

        for (PackagingEntry e : packagingItems) {
            BigDecimal qty = NumberParser.parse(e.quantityPerPack);
            PackagingItem item = new PackagingItem(e.name == null ? "" : e.name,
                    qty == null ? BigDecimal.ZERO : qty, NumberParser.parse(e.unitCost));
            item.unitCostValue = NumberParser.parse(e.unitCostValue);
            item.unitCostCurrencySymbol = e.unitCostCurrencySymbol;
            item.notes = e.notes;
            f.addPackagingItem(item);
        }

        for (IngredientEntry e : ingredients) {
            List<Nutrient> nutrients = new ArrayList<>();
            for (NutrientEntry n : e.nutrients) {
                nutrients.add(new Nutrient(n.name, n.unit, NumberParser.parse(n.amount), n.nutrientId, n.nutrientNumber));
            }
            int fdcId = e.fdcId == null ? 0 : e.fdcId;
            String dataType = e.dataType;
            if ((dataType == null || dataType.isBlank()) && fdcId <= 0) dataType = Food.MANUAL_DATA_TYPE;
            Food food = new Food(fdcId, e.description, dataType, e.brandOwner, nutrients);

            Ingredient ing = new Ingredient(food, NumberParser.parse(e.amountG), e.locked);
            ing.costPackAmount = NumberParser.parse(e.costPackAmount);
            ing.costPackUnit = e.costPackUnit;
            ing.costValue = NumberParser.parse(e.costValue);
            ing.costCurrencySymbol = e.costCurrencySymbol;
            ing.costPerG = NumberParser.parse(e.costPerG);
            f.addIngredient(ing);
        }
        return f;
    }

    private static String text(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }
}
