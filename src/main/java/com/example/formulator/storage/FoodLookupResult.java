package com.example.formulator.storage;

import com.example.formulator.model.NutrientRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Food record as returned by the food database, full or abridged. Abridged search rows
 * carry the nutrient fields flat on the entry instead of in a nested {@code nutrient}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FoodLookupResult {
    public Integer fdcId;
    public String description;
    public String dataType;
    public String brandOwner;
    public List<FoodNutrient> foodNutrients = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FoodNutrient {
        public NutrientInfo nutrient;
        public BigDecimal amount;
        // abridged shape
        public Integer nutrientId;
        public String nutrientName;
        public String nutrientNumber;
        public String unitName;
        public BigDecimal value;

        /** Merges both shapes; nested fields win. */
        public NutrientRecord toRecord() {
            NutrientInfo n = nutrient == null ? new NutrientInfo() : nutrient;
            String name = n.name != null ? n.name : nutrientName;
            String unit = n.unitName != null ? n.unitName : unitName;
            Integer id = n.id != null ? n.id : nutrientId;
            String number = n.number != null ? n.number : nutrientNumber;
            return new NutrientRecord(name, unit, amount != null ? amount : value, id, number, n.rank);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NutrientInfo {
        public Integer id;
        public String number;
        public String name;
        public Integer rank;
        public String unitName;
    }

    public List<NutrientRecord> nutrientRecords() {
        List<NutrientRecord> out = new ArrayList<>();
        if (foodNutrients == null) return out;
        for (FoodNutrient fn : foodNutrients) if (fn != null) out.add(fn.toRecord());
        return out;
    }
}
