package com.example.formulator;

import com.example.formulator.engine.FormulatorEngine;
import com.example.formulator.model.*;
import com.example.formulator.services.*;
import com.example.formulator.storage.*;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/** Minimal CLI demo: builds a formulation from bundled foods, redistributes it and prints nutrition and costs. */
public class CliDemo {
    public static void main(String[] args) throws IOException {
        SettingsStorage settingsStorage = new SettingsStorage();
        FormulatorEngine engine = new FormulatorEngine(settingsStorage.load());
        JsonStorage storage = new JsonStorage();

        Food chicken = engine.importFood(loadFood(storage, "/sample-data/chicken-breast.json"));
        Food granola = engine.importFood(loadFood(storage, "/sample-data/branded-granola.json"));

        Formulation bar = engine.newFormulation("Protein bar");
        engine.addFood(bar, chicken, new BigDecimal("40"));
        Ingredient g = engine.addFood(bar, granola, new BigDecimal("60"));
        g.costPackAmount = new BigDecimal("1"); g.costPackUnit = "kg"; g.costValue = new BigDecimal("6.50"); g.costCurrencySymbol = "$";

        engine.formulations().lockIngredient(bar, 0);
        engine.adjustToTargetWeight(bar, new BigDecimal("250"));
        System.out.println(bar);
        for (Ingredient i : bar.getIngredients()) {
            System.out.printf(" - %-40s %8s g %6s%%%s%n", i.getDescription(), round(i.getAmountG()),
                    round(i.calculatePercentage(bar.getTotalWeight())), i.isLocked() ? " (locked)" : "");
        }

        System.out.println("\nPer 100 g:");
        for (NutrientTotal t : engine.totalsByHeaderKey(bar).values()) {
            System.out.printf(" %-32s %10s %s  [%s]%n", t.name, round(t.amount), t.unit, engine.ordering().categoryFor(t.name));
        }

        System.out.println("\nSaved formulation from sample data:");
        Formulation saved;
        try (InputStream in = CliDemo.class.getResourceAsStream("/sample-data/formulation.json")) {
            if (in == null) throw new IOException("Missing /sample-data/formulation.json");
            saved = storage.loadFormulation(in);
        }
        CostService.CostTotal ingredients = engine.totalIngredientsCostBatch(saved);
        CostService.CostTotal processes = engine.totalProcessCostBatch(saved);
        System.out.println(saved);
        System.out.println(" ingredients: " + round(ingredients.total) + " (missing " + ingredients.missingCount + ")");
        System.out.println(" processes:   " + round(processes.total) + " (incomplete " + processes.missingCount + ")");
        System.out.println(" per unit:    " + engine.costs().unitCostsForTargetMass(saved));
    }

    private static FoodLookupResult loadFood(JsonStorage storage, String resource) throws IOException {
        try (InputStream in = CliDemo.class.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("Missing " + resource);
            return storage.loadFoodDetails(in);
        }
    }

    private static BigDecimal round(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }
}
