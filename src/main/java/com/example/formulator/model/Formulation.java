package com.example.formulator.model;

import java.math.BigDecimal;
import java.util.*;

/**
 * A recipe: an ordered list of ingredients plus the cost data needed to price a batch.
 * The formulation owns its ingredients, costs and currency rates.
 */
public class Formulation {
    public static final String MODE_GRAMS = "g";
    public static final String MODE_PERCENT = "%";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private String name;
    private final List<Ingredient> ingredients = new ArrayList<>();
    private String quantityMode = MODE_GRAMS;
    private BigDecimal yieldPercent = HUNDRED;
    private final List<ProcessCost> processCosts = new ArrayList<>();
    private final List<PackagingItem> packagingItems = new ArrayList<>();
    private final List<CurrencyRate> currencyRates = new ArrayList<>();
    private BigDecimal costTargetMassValue; // nullable
    private String costTargetMassUnit;      // nullable

    public Formulation(String name) {
        this(name, MODE_GRAMS, HUNDRED);
    }

    public Formulation(String name, String quantityMode, BigDecimal yieldPercent) {
        setName(name);
        setQuantityMode(quantityMode);
        setYieldPercent(yieldPercent);
        ensureCurrencyRates();
    }

    public String getName() { return name; }

    public void setName(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Formulation name cannot be empty");
        this.name = name;
    }

    public String getQuantityMode() { return quantityMode; }

    public void setQuantityMode(String quantityMode) {
        if (!MODE_GRAMS.equals(quantityMode) && !MODE_PERCENT.equals(quantityMode)) {
            throw new IllegalArgumentException("Invalid quantity mode: " + quantityMode);
        }
        this.quantityMode = quantityMode;
    }

    public BigDecimal getYieldPercent() { return yieldPercent; }

    /** Values outside (0, 100] are reset to 100 instead of failing. */
    public void setYieldPercent(BigDecimal yieldPercent) {
        if (yieldPercent == null || yieldPercent.signum() <= 0 || yieldPercent.compareTo(HUNDRED) > 0) {
            this.yieldPercent = HUNDRED;
        } else {
            this.yieldPercent = yieldPercent;
        }
    }

    public BigDecimal getCostTargetMassValue() { return costTargetMassValue; }
    public String getCostTargetMassUnit() { return costTargetMassUnit; }

    public void setCostTarget(BigDecimal value, String unit) {
        this.costTargetMassValue = value;
        this.costTargetMassUnit = unit;
    }

    // ---- ingredients ----

    public List<Ingredient> getIngredients() { return Collections.unmodifiableList(ingredients); }
    public int getIngredientCount() { return ingredients.size(); }
    public boolean isEmpty() { return ingredients.isEmpty(); }

    public void addIngredient(Ingredient ingredient) {
        if (ingredient == null) throw new IllegalArgumentException("Ingredient cannot be null");
        ingredients.add(ingredient);
    }

    public Ingredient getIngredient(int index) {
        checkIndex(index);
        return ingredients.get(index);
    }

    public void removeIngredient(int index) {
        checkIndex(index);
        ingredients.remove(index);
    }

    public void clear() { ingredients.clear(); }

    private void checkIndex(int index) {
        if (index < 0 || index >= ingredients.size()) throw new IndexOutOfBoundsException("Invalid ingredient index: " + index);
    }

    public BigDecimal getTotalWeight() {
        BigDecimal total = BigDecimal.ZERO;
        for (Ingredient i : ingredients) total = total.add(i.getAmountG());
        return total;
    }

    public BigDecimal getLockedWeight() {
        BigDecimal total = BigDecimal.ZERO;
        for (Ingredient i : ingredients) if (i.isLocked()) total = total.add(i.getAmountG());
        return total;
    }

    public List<Ingredient> getLockedIngredients() {
        List<Ingredient> out = new ArrayList<>();
        for (Ingredient i : ingredients) if (i.isLocked()) out.add(i);
        return out;
    }

    public List<Ingredient> getUnlockedIngredients() {
        List<Ingredient> out = new ArrayList<>();
        for (Ingredient i : ingredients) if (!i.isLocked()) out.add(i);
        return out;
    }

    // ---- costs ----

    public List<ProcessCost> getProcessCosts() { return Collections.unmodifiableList(processCosts); }
    public void addProcessCost(ProcessCost process) { processCosts.add(Objects.requireNonNull(process)); }
    public void removeProcessCost(int index) { processCosts.remove(index); }

    public List<PackagingItem> getPackagingItems() { return Collections.unmodifiableList(packagingItems); }
    public void addPackagingItem(PackagingItem item) { packagingItems.add(Objects.requireNonNull(item)); }
    public void removePackagingItem(int index) { packagingItems.remove(index); }

    // ---- currency rates ----

    public List<CurrencyRate> getCurrencyRates() { return Collections.unmodifiableList(currencyRates); }

    public void setCurrencyRates(List<CurrencyRate> rates) {
        currencyRates.clear();
        if (rates != null) currencyRates.addAll(rates);
        ensureCurrencyRates();
    }

    public void addCurrencyRate(CurrencyRate rate) {
        if (rate != null) currencyRates.add(rate);
        ensureCurrencyRates();
    }

    public void removeCurrencyRate(String symbol) {
        currencyRates.removeIf(r -> r.symbol != null && r.symbol.trim().equals(symbol));
        ensureCurrencyRates();
    }

    /**
     * Keeps exactly one base entry ($ = 1) and unique, non-blank symbols.
     * The first occurrence of a symbol wins.
     */
    private void ensureCurrencyRates() {
        Set<String> seen = new HashSet<>();
        List<CurrencyRate> cleaned = new ArrayList<>();
        for (CurrencyRate rate : currencyRates) {
            String symbol = rate.symbol == null ? "" : rate.symbol.trim();
            if (symbol.isEmpty() || seen.contains(symbol)) continue;
            cleaned.add(CurrencyRate.BASE_SYMBOL.equals(symbol) ? CurrencyRate.base() : rate);
            seen.add(symbol);
        }
        if (!seen.contains(CurrencyRate.BASE_SYMBOL)) cleaned.add(0, CurrencyRate.base());
        currencyRates.clear();
        currencyRates.addAll(cleaned);
    }

    @Override public String toString() { return name + " (" + ingredients.size() + " ingredients, " + getTotalWeight() + " g)"; }
}
