package com.example.formulator.services;

import com.example.formulator.model.*;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edits ingredient quantities while respecting locks. Locked ingredients keep their
 * absolute weight; unlocked ones absorb every change proportionally.
 * <p>
 * Every operation either completes or throws {@link InvalidFormulationException} before
 * touching the formulation.
 */
public class FormulationService {
    private static final Logger log = LoggerFactory.getLogger(FormulationService.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Scales the unlocked ingredients so the formulation weighs exactly {@code targetG}.
     * The division residue goes to the heaviest unlocked ingredient.
     */
    public void adjustToTargetWeight(Formulation formulation, BigDecimal targetG) {
        if (targetG == null || targetG.signum() <= 0) {
            throw new InvalidFormulationException("Target weight must be positive: " + targetG);
        }
        BigDecimal lockedWeight = formulation.getLockedWeight();
        if (lockedWeight.compareTo(targetG) > 0) {
            throw new InvalidFormulationException("Locked weight (" + lockedWeight + "g) exceeds target (" + targetG + "g)");
        }

        List<Ingredient> unlocked = formulation.getUnlockedIngredients();
        if (unlocked.isEmpty()) {
            if (formulation.getTotalWeight().compareTo(targetG) != 0) {
                throw new InvalidFormulationException("All ingredients locked, cannot reach target weight");
            }
            return;
        }

        BigDecimal unlockedWeight = BigDecimal.ZERO;
        for (Ingredient i : unlocked) unlockedWeight = unlockedWeight.add(i.getAmountG());
        if (unlockedWeight.signum() == 0) {
            throw new InvalidFormulationException("Unlocked ingredients have zero weight");
        }

        BigDecimal available = targetG.subtract(lockedWeight);
        BigDecimal scale = available.divide(unlockedWeight, MathContext.DECIMAL128);
        Ingredient heaviest = unlocked.get(0);
        for (Ingredient i : unlocked) {
            i.setAmountG(i.getAmountG().multiply(scale, MathContext.DECIMAL128));
            if (i.getAmountG().compareTo(heaviest.getAmountG()) > 0) heaviest = i;
        }
        BigDecimal residue = targetG.subtract(formulation.getTotalWeight());
        if (residue.signum() != 0) heaviest.setAmountG(heaviest.getAmountG().add(residue));

        log.info("adjusted '{}' to {} g (scale={}, locked={} g)", formulation.getName(), targetG, scale, lockedWeight);
    }

    /**
     * Sets one ingredient's amount. With {@code maintainTotal} the other unlocked
     * ingredients absorb the difference; otherwise the total weight changes.
     */
    public void setIngredientAmount(Formulation formulation, int index, BigDecimal amountG, boolean maintainTotal) {
        if (amountG == null || amountG.signum() < 0) {
            throw new InvalidFormulationException("Amount cannot be negative: " + amountG);
        }
        Ingredient ingredient = formulation.getIngredient(index);
        if (!maintainTotal) {
            ingredient.setAmountG(amountG);
            return;
        }

        BigDecimal oldAmount = ingredient.getAmountG();
        BigDecimal oldTotal = formulation.getTotalWeight();
        ingredient.setAmountG(amountG);
        try (LockOverride ignored = new LockOverride(ingredient, true)) {
            adjustToTargetWeight(formulation, oldTotal);
        } catch (InvalidFormulationException ex) {
            ingredient.setAmountG(oldAmount);
            throw ex;
        }
    }

    /**
     * Percent-mode edit: sets one ingredient to {@code targetPercent} of the current total,
     * keeps locked percentages, and rescales the other unlocked ingredients to fill the
     * rest. The total weight is preserved exactly, the division residue going to the heaviest
     * free ingredient (100 g is used when the formulation weighs nothing).
     */
    public void applyPercentEdit(Formulation formulation, int index, BigDecimal targetPercent) {
        if (targetPercent == null || targetPercent.signum() < 0 || targetPercent.compareTo(HUNDRED) > 0) {
            throw new InvalidFormulationException("Percent must be between 0 and 100: " + targetPercent);
        }
        List<Ingredient> ingredients = formulation.getIngredients();
        if (index < 0 || index >= ingredients.size()) {
            throw new InvalidFormulationException("Invalid ingredient index: " + index);
        }

        BigDecimal total = formulation.getTotalWeight();
        BigDecimal baseTotal = total.signum() == 0 ? HUNDRED : total;
        List<BigDecimal> percents = new ArrayList<>();
        for (Ingredient i : ingredients) percents.add(i.calculatePercentage(baseTotal));

        BigDecimal lockedSum = BigDecimal.ZERO;
        List<Integer> free = new ArrayList<>();
        for (int i = 0; i < ingredients.size(); i++) {
            if (i == index) continue;
            if (ingredients.get(i).isLocked()) lockedSum = lockedSum.add(percents.get(i));
            else free.add(i);
        }
        if (lockedSum.compareTo(HUNDRED) > 0) {
            throw new InvalidFormulationException("Locked ingredients exceed 100%: " + lockedSum);
        }
        BigDecimal remaining = HUNDRED.subtract(lockedSum).subtract(targetPercent);
        if (remaining.signum() < 0) {
            throw new InvalidFormulationException("Not enough percent left for this value; " + HUNDRED.subtract(lockedSum) + "% is available");
        }
        if (remaining.signum() != 0 && free.isEmpty()) {
            throw new InvalidFormulationException("No unlocked ingredients left to absorb " + remaining + "%");
        }

        List<BigDecimal> updated = new ArrayList<>(percents);
        updated.set(index, targetPercent);
        BigDecimal freeSum = BigDecimal.ZERO;
        for (int i : free) freeSum = freeSum.add(percents.get(i));
        if (freeSum.signum() > 0) {
            for (int i : free) updated.set(i, percents.get(i).multiply(remaining).divide(freeSum, MathContext.DECIMAL128));
        } else if (!free.isEmpty()) {
            for (int i : free) updated.set(i, BigDecimal.ZERO);
            updated.set(free.get(0), remaining);
        }
        for (BigDecimal p : updated) {
            if (p.signum() < 0) throw new InvalidFormulationException("Percent edit would produce a negative amount");
        }

        for (int i = 0; i < ingredients.size(); i++) {
            // locked rows are already at their percentage of the base total
            if (i != index && ingredients.get(i).isLocked()) continue;
            ingredients.get(i).setAmountG(updated.get(i).multiply(baseTotal).divide(HUNDRED, MathContext.DECIMAL128));
        }
        if (!free.isEmpty()) {
            Ingredient heaviest = ingredients.get(free.get(0));
            for (int i : free) {
                if (ingredients.get(i).getAmountG().compareTo(heaviest.getAmountG()) > 0) heaviest = ingredients.get(i);
            }
            BigDecimal residue = baseTotal.subtract(formulation.getTotalWeight());
            if (residue.signum() != 0) heaviest.setAmountG(heaviest.getAmountG().add(residue));
        }
        log.debug("percent edit row={} -> {}% (locked={}%, free rows={})", index, targetPercent, lockedSum, free.size());
    }

    /** Scales every ingredient, locked or not, so the total is 100 g. */
    public void normalizeTo100g(Formulation formulation) {
        normalizeToTargetWeight(formulation, HUNDRED);
    }

    /** Scales every ingredient proportionally to {@code targetG}, ignoring locks. No-op for a weightless formulation. */
    public void normalizeToTargetWeight(Formulation formulation, BigDecimal targetG) {
        if (targetG == null || targetG.signum() <= 0) {
            throw new InvalidFormulationException("Target weight must be positive: " + targetG);
        }
        BigDecimal current = formulation.getTotalWeight();
        if (current.signum() == 0 || current.compareTo(targetG) == 0) return;
        BigDecimal scale = targetG.divide(current, MathContext.DECIMAL128);
        for (Ingredient i : formulation.getIngredients()) i.setAmountG(i.getAmountG().multiply(scale, MathContext.DECIMAL128));
    }

    public void lockIngredient(Formulation formulation, int index) {
        formulation.getIngredient(index).setLocked(true);
    }

    public void unlockIngredient(Formulation formulation, int index) {
        formulation.getIngredient(index).setLocked(false);
    }

    /** Flips the lock and returns the new state. */
    public boolean toggleLock(Formulation formulation, int index) {
        Ingredient ingredient = formulation.getIngredient(index);
        ingredient.setLocked(!ingredient.isLocked());
        return ingredient.isLocked();
    }
}
