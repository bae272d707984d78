package com.example.formulator.storage;

import com.example.formulator.model.Food;
import com.example.formulator.model.Nutrient;
import com.example.formulator.model.NutrientRecord;
import com.example.formulator.services.NutrientNormalizer;
import com.example.formulator.services.NutrientOrdering;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns a food lookup payload into a {@link Food} with normalized nutrients. */
public class FoodImporter {
    private static final Logger log = LoggerFactory.getLogger(FoodImporter.class);

    private final NutrientNormalizer normalizer;
    private final NutrientOrdering ordering;

    public FoodImporter(NutrientNormalizer normalizer, NutrientOrdering ordering) {
        this.normalizer = normalizer;
        this.ordering = ordering;
    }

    /**
     * Category header rows and rows whose unit cannot be inferred are skipped; a row with a
     * unit but no amount becomes 0. The full row list also feeds the ordering's reference hints.
     */
    public Food importFood(FoodLookupResult payload) {
        if (payload == null) throw new IllegalArgumentException("Food payload cannot be null");
        List<NutrientRecord> raw = payload.nutrientRecords();
        ordering.updateReferenceFromDetails(raw);

        List<Nutrient> nutrients = new ArrayList<>();
        for (NutrientRecord r : normalizer.normalize(raw, payload.dataType)) {
            if (r.name.isBlank()) continue;
            // category header
            if (!r.hasAmount() && (r.unit == null || r.unit.isBlank())) continue;
            String unit = ordering.inferUnit(r);
            if (unit.isEmpty()) {
                log.debug("skipping nutrient without unit: {}", r.name);
                continue;
            }
            BigDecimal amount = r.amount == null ? BigDecimal.ZERO : r.amount;
            nutrients.add(new Nutrient(r.name, unit, amount, r.id, r.number));
        }

        int fdcId = payload.fdcId == null ? 0 : payload.fdcId;
        String dataType = payload.dataType == null || payload.dataType.isBlank() ? Food.MANUAL_DATA_TYPE : payload.dataType;
        log.debug("imported fdcId={} '{}' with {} nutrients", fdcId, payload.description, nutrients.size());
        return new Food(fdcId, payload.description, dataType, payload.brandOwner, nutrients);
    }
}
