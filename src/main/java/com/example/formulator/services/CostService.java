package com.example.formulator.services;

import com.example.formulator.model.*;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prices a formulation batch in base currency. Missing or invalid cost inputs never fail a
 * computation: the affected item has no value and is counted as missing instead.
 */
public class CostService {
    private static final Logger log = LoggerFactory.getLogger(CostService.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

    public static class CostTotal {
        public final BigDecimal total;
        public final int missingCount;
        public CostTotal(BigDecimal total, int missingCount) { this.total = total; this.missingCount = missingCount; }
        @Override public String toString() { return total + " (missing " + missingCount + ")"; }
    }

    public static class CostCompleteness {
        public final int defined;
        public final int missing;
        public final BigDecimal percent;
        public CostCompleteness(int defined, int missing, BigDecimal percent) {
            this.defined = defined; this.missing = missing; this.percent = percent;
        }
        @Override public String toString() { return defined + "/" + (defined + missing) + " (" + percent + "%)"; }
    }

    /** Per-unit economics for a sold unit of a given mass. Money values are in base currency. */
    public static class UnitCostBreakdown {
        public BigDecimal batchMassG;
        public BigDecimal sellableMassG;
        public BigDecimal targetMassG;
        public BigDecimal unitsCount;
        public BigDecimal ingredientsCostPerUnit;
        public BigDecimal processCostPerUnit;
        public BigDecimal totalCostPerUnit;
        public BigDecimal packagingCostPerPack;
        public BigDecimal totalPackCost;

        @Override public String toString() {
            return "units=" + unitsCount + " ingredients/unit=" + ingredientsCostPerUnit + " process/unit=" + processCostPerUnit
                    + " packaging=" + packagingCostPerPack + " total/pack=" + totalPackCost;
        }
    }

    private final Units units;

    public CostService() {
        this(new Units());
    }

    public CostService(Units units) {
        this.units = units;
    }

    // ---- currency ----

    /** Symbol to rate; always holds {@code $ = 1}. Blank symbols and non-positive rates are skipped. */
    public Map<String, BigDecimal> buildRateMap(List<CurrencyRate> rates) {
        Map<String, BigDecimal> map = new LinkedHashMap<>();
        map.put(CurrencyRate.BASE_SYMBOL, BigDecimal.ONE);
        if (rates == null) return map;
        for (CurrencyRate rate : rates) {
            String symbol = rate.symbol == null ? "" : rate.symbol.trim();
            if (symbol.isEmpty() || symbol.equals(CurrencyRate.BASE_SYMBOL)) continue;
            if (rate.rateToBase == null || rate.rateToBase.signum() <= 0) continue;
            map.put(symbol, rate.rateToBase);
        }
        return map;
    }

    /** {@code value} in base currency; a blank symbol means base. Null when the symbol has no rate. */
    public BigDecimal convertCurrencyToBase(BigDecimal value, String symbol, List<CurrencyRate> rates) {
        if (value == null) return null;
        String currency = symbol == null || symbol.isBlank() ? CurrencyRate.BASE_SYMBOL : symbol.trim();
        BigDecimal rate = buildRateMap(rates).get(currency);
        return rate == null ? null : value.multiply(rate);
    }

    public BigDecimal packagingUnitCost(PackagingItem item, List<CurrencyRate> rates) {
        if (item.unitCostValue != null) return convertCurrencyToBase(item.unitCostValue, item.unitCostCurrencySymbol, rates);
        return item.unitCost;
    }

    /** Quantity per pack times the base-currency unit cost; 0 when either is missing. */
    public BigDecimal packagingItemCost(PackagingItem item, List<CurrencyRate> rates) {
        BigDecimal unitCost = packagingUnitCost(item, rates);
        if (unitCost == null || item.quantityPerPack == null) return BigDecimal.ZERO;
        return item.quantityPerPack.multiply(unitCost);
    }

    // ---- ingredients ----

    /** Cost per gram in base currency, or null when any input is missing or not positive. */
    public BigDecimal normalizeIngredientCostPerG(BigDecimal packAmount, String packUnit, BigDecimal costValue,
                                                  String currencySymbol, List<CurrencyRate> rates) {
        if (packAmount == null || costValue == null) return null;
        if (packAmount.signum() <= 0 || costValue.signum() <= 0) return null;
        String unit = units.normalizeMassUnit(packUnit);
        if (unit.isEmpty()) return null;
        BigDecimal packG = units.massToGrams(packAmount, unit);
        if (packG == null || packG.signum() <= 0) return null;

        String symbol = currencySymbol == null ? "" : currencySymbol.trim();
        if (symbol.isEmpty()) return null;
        BigDecimal rate = buildRateMap(rates).get(symbol);
        if (rate == null) return null;
        return costValue.multiply(rate).divide(packG, MathContext.DECIMAL128);
    }

    /** Canonicalizes the pack unit and currency symbol and stores the derived cost per gram. */
    public void updateIngredientCostFields(Ingredient ingredient, List<CurrencyRate> rates) {
        String unit = units.normalizeMassUnit(ingredient.costPackUnit);
        ingredient.costPackUnit = unit.isEmpty() ? null : unit;
        String symbol = ingredient.costCurrencySymbol == null ? "" : ingredient.costCurrencySymbol.trim();
        ingredient.costCurrencySymbol = symbol.isEmpty() ? null : symbol;
        ingredient.costPerG = normalizeIngredientCostPerG(ingredient.costPackAmount, ingredient.costPackUnit,
                ingredient.costValue, ingredient.costCurrencySymbol, rates);
    }

    public CostTotal totalIngredientsCostBatch(Formulation formulation) {
        BigDecimal total = BigDecimal.ZERO;
        int missing = 0;
        for (Ingredient ing : formulation.getIngredients()) {
            updateIngredientCostFields(ing, formulation.getCurrencyRates());
            if (ing.costPerG == null) {
                missing++;
                continue;
            }
            total = total.add(ing.costPerG.multiply(ing.getAmountG()));
        }
        if (missing > 0) log.debug("'{}': {} ingredient(s) without cost", formulation.getName(), missing);
        return new CostTotal(total, missing);
    }

    public CostCompleteness ingredientCostCompleteness(Formulation formulation) {
        int defined = 0, missing = 0;
        for (Ingredient ing : formulation.getIngredients()) {
            updateIngredientCostFields(ing, formulation.getCurrencyRates());
            if (ing.costPerG == null) missing++;
            else defined++;
        }
        return completeness(defined, missing);
    }

    // ---- processes ----

    /** Process cost for a batch of {@code batchMassKg}; null when the billing inputs are incomplete. */
    public BigDecimal processTotalCost(ProcessCost process, BigDecimal batchMassKg) {
        if (process.scaleType == null) return null;
        switch (process.scaleType) {
            case FIXED:
                return resolveFixedTotal(process);
            case VARIABLE_PER_KG: {
                BigDecimal perKgH = timeToHours(process.timePerKgValue, process.timeUnit);
                if (perKgH == null || process.costPerHour == null) return null;
                return perKgH.multiply(batchMassKg).multiply(process.costPerHour);
            }
            case MIXED: {
                BigDecimal setupH = timeToHours(process.setupTimeValue, process.setupTimeUnit);
                BigDecimal perKgH = timeToHours(process.timePerKgValue, process.timeUnit);
                if (setupH == null || perKgH == null || process.costPerHour == null) return null;
                return setupH.add(perKgH.multiply(batchMassKg)).multiply(process.costPerHour);
            }
            default:
                return null;
        }
    }

    /**
     * Fixed processes may be entered as any two of time, hourly rate and total; the total is
     * derived from time and rate when it is missing.
     */
    private BigDecimal resolveFixedTotal(ProcessCost process) {
        BigDecimal hours = timeToHours(process.timeValue, process.timeUnit);
        if (process.totalCost != null) return process.totalCost;
        if (hours != null && process.costPerHour != null) return hours.multiply(process.costPerHour);
        return null;
    }

    /**
     * Fills in the one missing value of a fixed process (time in its own unit, hourly rate or
     * total) from the other two. Returns true when something was derived.
     */
    public boolean resolveFixedProcess(ProcessCost process) {
        if (process.scaleType != ScaleType.FIXED) return false;
        BigDecimal hours = timeToHours(process.timeValue, process.timeUnit);
        BigDecimal rate = process.costPerHour;
        BigDecimal total = process.totalCost;
        int present = (hours != null ? 1 : 0) + (rate != null ? 1 : 0) + (total != null ? 1 : 0);
        if (present != 2) return false;

        if (total == null) {
            process.totalCost = hours.multiply(rate);
        } else if (rate == null) {
            process.costPerHour = total.divide(hours, MathContext.DECIMAL128);
        } else if (rate.signum() > 0) {
            BigDecimal derivedHours = total.divide(rate, MathContext.DECIMAL128);
            String unit = process.timeUnit == null ? "" : process.timeUnit.trim().toLowerCase();
            if (unit.equals("min")) {
                process.timeValue = derivedHours.multiply(SIXTY);
            } else {
                process.timeValue = derivedHours;
                process.timeUnit = "h";
            }
        } else {
            return false;
        }
        return true;
    }

    public CostTotal totalProcessCostBatch(Formulation formulation) {
        BigDecimal batchKg = batchMassKg(formulation);
        BigDecimal total = BigDecimal.ZERO;
        int incomplete = 0;
        for (ProcessCost process : formulation.getProcessCosts()) {
            BigDecimal cost = processTotalCost(process, batchKg);
            if (cost == null) {
                incomplete++;
                continue;
            }
            total = total.add(cost);
        }
        return new CostTotal(total, incomplete);
    }

    public CostCompleteness processCostCompleteness(Formulation formulation) {
        BigDecimal batchKg = batchMassKg(formulation);
        int defined = 0, missing = 0;
        for (ProcessCost process : formulation.getProcessCosts()) {
            if (processTotalCost(process, batchKg) == null) missing++;
            else defined++;
        }
        return completeness(defined, missing);
    }

    // ---- batch ----

    public BigDecimal totalBatchCost(Formulation formulation) {
        return totalIngredientsCostBatch(formulation).total.add(totalProcessCostBatch(formulation).total);
    }

    /** Packaging cost of one pack; items without a resolvable unit cost count as 0. */
    public BigDecimal packagingCostPerPack(Formulation formulation) {
        BigDecimal total = BigDecimal.ZERO;
        for (PackagingItem item : formulation.getPackagingItems()) {
            total = total.add(packagingItemCost(item, formulation.getCurrencyRates()));
        }
        return total;
    }

    /**
     * Splits the batch cost over units of {@code targetValue targetUnit} of sellable mass
     * (batch weight times yield). A missing or non-positive target yields zero units and
     * zero per-unit costs.
     */
    public UnitCostBreakdown unitCostsForTargetMass(Formulation formulation, BigDecimal targetValue, String targetUnit) {
        UnitCostBreakdown out = new UnitCostBreakdown();
        out.batchMassG = formulation.getTotalWeight();

        BigDecimal targetG = targetValue == null ? null : units.massToGrams(targetValue, targetUnit);
        out.targetMassG = targetG == null || targetG.signum() <= 0 ? BigDecimal.ZERO : targetG;

        BigDecimal yield = formulation.getYieldPercent().max(BigDecimal.ZERO).min(HUNDRED);
        out.sellableMassG = out.batchMassG.multiply(yield).divide(HUNDRED, MathContext.DECIMAL128);

        out.unitsCount = BigDecimal.ZERO;
        if (out.targetMassG.signum() > 0 && out.sellableMassG.signum() > 0) {
            out.unitsCount = out.sellableMassG.divide(out.targetMassG, MathContext.DECIMAL128);
        }

        BigDecimal ingredientsTotal = totalIngredientsCostBatch(formulation).total;
        BigDecimal processTotal = totalProcessCostBatch(formulation).total;
        boolean hasUnits = out.unitsCount.signum() > 0;
        out.ingredientsCostPerUnit = hasUnits ? ingredientsTotal.divide(out.unitsCount, MathContext.DECIMAL128) : BigDecimal.ZERO;
        out.processCostPerUnit = hasUnits ? processTotal.divide(out.unitsCount, MathContext.DECIMAL128) : BigDecimal.ZERO;
        out.totalCostPerUnit = out.ingredientsCostPerUnit.add(out.processCostPerUnit);
        out.packagingCostPerPack = packagingCostPerPack(formulation);
        out.totalPackCost = out.totalCostPerUnit.add(out.packagingCostPerPack);

        log.debug("unit costs for '{}' at {} {}: {}", formulation.getName(), targetValue, targetUnit, out);
        return out;
    }

    /** Uses the formulation's stored cost target mass. */
    public UnitCostBreakdown unitCostsForTargetMass(Formulation formulation) {
        return unitCostsForTargetMass(formulation, formulation.getCostTargetMassValue(), formulation.getCostTargetMassUnit());
    }

    /** Hours for a positive time in "h" or "min"; null otherwise. */
    static BigDecimal timeToHours(BigDecimal value, String unit) {
        if (value == null || value.signum() <= 0) return null;
        String u = unit == null ? "" : unit.trim().toLowerCase();
        if (u.equals("h")) return value;
        if (u.equals("min")) return value.divide(SIXTY, MathContext.DECIMAL128);
        return null;
    }

    private BigDecimal batchMassKg(Formulation formulation) {
        BigDecimal kg = units.massToKilograms(formulation.getTotalWeight(), "g");
        return kg == null ? BigDecimal.ZERO : kg;
    }

    private static CostCompleteness completeness(int defined, int missing) {
        int total = defined + missing;
        if (total == 0) return new CostCompleteness(0, 0, BigDecimal.ZERO);
        BigDecimal percent = BigDecimal.valueOf(defined).multiply(HUNDRED).divide(BigDecimal.valueOf(total), MathContext.DECIMAL128);
        return new CostCompleteness(defined, missing, percent);
    }
}
