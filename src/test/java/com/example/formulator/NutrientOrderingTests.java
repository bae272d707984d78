package com.example.formulator;

import com.example.formulator.model.NutrientRecord;
import com.example.formulator.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.*;

public class NutrientOrderingTests {
    private final NutrientOrdering ordering = new NutrientOrdering();

    private static NutrientRecord rec(String name, String unit, String amount) {
        return new NutrientRecord(name, unit, amount == null ? null : new BigDecimal(amount));
    }

    @Test
    void catalog_rank_is_category_index_times_1000_plus_position() {
        assertEquals(0, ordering.orderForName("Water"));
        assertEquals(3, ordering.orderForName("protein"));
        assertEquals(1006, ordering.orderForName("Sugars, Total"));
        assertEquals(2000, ordering.orderForName("Calcium, Ca"));
        assertEquals(5000, ordering.orderForName("Tryptophan"));
        assertNull(ordering.orderForName("Unobtainium"));
    }

    @Test
    void identity_keys_follow_precedence() {
        assertEquals("energy:kcal", ordering.nutrientKey(new NutrientRecord("Energy", "kcal", null, 1008, "208", null)));
        assertEquals("water|g", ordering.nutrientKey(new NutrientRecord("Water", "g", null, 1051, "255", null)));
        assertEquals("id:1003", ordering.nutrientKey(new NutrientRecord("Protein", "g", null, 1003, "203", null)));
        assertEquals("num:203", ordering.nutrientKey(new NutrientRecord("Protein", "g", null, null, "203", null)));
        assertEquals("name:protein", ordering.nutrientKey(rec("Protein", "g", "1")));
        assertEquals("", ordering.nutrientKey(rec("", null, null)));
    }

    @Test
    void header_key_uses_canonical_name_and_unit() {
        NutrientOrdering.HeaderKey hk = ordering.headerKey(rec("Total Sugars", "G", "5"));
        assertEquals("sugars, total|g", hk.key);
        assertEquals("Sugars, Total", hk.name);
        assertEquals("g", hk.unit);

        // unit inferred from the name
        assertEquals("carbohydrate, by difference|g", ordering.headerKey(rec("Carbohydrate, by summation", null, "3")).key);
        assertEquals("vitamin b-12|" + Units.MICROGRAM, ordering.headerKey(rec("Vitamin B-12", "mcg", "1")).key);
    }

    @Test
    void header_key_falls_back_to_identity_for_dropped_names() {
        NutrientRecord atwater = new NutrientRecord("Energy (Atwater General Factors)", "kcal", null, 2047, "957", null);
        assertEquals("id:2047|kcal", ordering.headerKey(atwater).key);
    }

    @Test
    void totals_by_header_key_apply_alias_priority() {
        List<NutrientTotal> summationFirst = List.of(
                new NutrientTotal("Carbohydrate, by summation", "g", new BigDecimal("12")),
                new NutrientTotal("Carbohydrate, by difference", "g", new BigDecimal("10")));
        List<NutrientTotal> differenceFirst = List.of(
                new NutrientTotal("Carbohydrate, by difference", "g", new BigDecimal("10")),
                new NutrientTotal("Carbohydrate, by summation", "g", new BigDecimal("12")));

        for (List<NutrientTotal> totals : List.of(summationFirst, differenceFirst)) {
            Map<String, NutrientTotal> out = ordering.normalizeTotalsByHeaderKey(totals);
            assertEquals(1, out.size());
            NutrientTotal carbs = out.get("carbohydrate, by difference|g");
            assertEquals("Carbohydrate, by difference", carbs.name);
            assertEquals(0, new BigDecimal("10").compareTo(carbs.amount));
        }
    }

    @Test
    void totals_with_equal_priority_keep_the_later_entry() {
        Map<String, NutrientTotal> out = ordering.normalizeTotalsByHeaderKey(List.of(
                new NutrientTotal("Protein", "g", new BigDecimal("1")),
                new NutrientTotal("protein", "G", new BigDecimal("2"))));
        assertEquals(0, new BigDecimal("2").compareTo(out.get("protein|g").amount));
    }

    @Test
    void categories_from_catalog_rules_and_fallback() {
        assertEquals(NutrientCatalog.PROXIMATES, ordering.categoryFor("Energy"));
        assertEquals(NutrientCatalog.MINERALS, ordering.categoryFor("iron, fe"));
        assertEquals(NutrientCatalog.VITAMINS_AND_OTHER, ordering.categoryFor("Vitamin K2 (menaquinone-7)"));
        assertEquals(NutrientCatalog.LIPIDS, ordering.categoryFor("Fatty acids, total omega-3"));
        assertEquals(NutrientCatalog.PHYTOSTEROLS, ordering.categoryFor("Ergosterol"));
        assertEquals(NutrientCatalog.ORGANIC_ACIDS, ordering.categoryFor("Lactic acid"));
        assertEquals(NutrientCatalog.AMINO_ACIDS, ordering.categoryFor("Cystine"));
        assertEquals(NutrientCatalog.OTHER, ordering.categoryFor("Mystery compound"));
        assertEquals(NutrientCatalog.OTHER, ordering.categoryFor(null));
    }

    @Test
    void reference_details_supply_category_and_rank() {
        NutrientRecord boron = new NutrientRecord("Boron, B", Units.MICROGRAM, new BigDecimal("12"), 1137, "354", 5350);
        ordering.updateReferenceFromDetails(List.of(rec("Minerals", null, null), boron));

        NutrientRecord unranked = new NutrientRecord("Boron, B", Units.MICROGRAM, new BigDecimal("3"), 1137, null, null);
        assertEquals(NutrientCatalog.MINERALS, ordering.categoryFor("Boron, B", unranked));
        assertEquals(5350, ordering.nutrientOrder(unranked, 99));
        assertEquals(Units.MICROGRAM, ordering.referenceInfo(unranked).unit);
    }

    @Test
    void explicit_rank_beats_reference_and_catalog() {
        NutrientRecord ranked = new NutrientRecord("Water", "g", BigDecimal.ONE, null, null, 42);
        assertEquals(42, ordering.nutrientOrder(ranked, 7));
        assertEquals(0, ordering.nutrientOrder(rec("Water", "g", "1"), 7));
        assertEquals(7, ordering.nutrientOrder(rec("Mystery", "g", "1"), 7));
    }

    @Test
    void display_sort_is_stable_with_unknowns_last() {
        NutrientRecord ca = rec("Calcium, Ca", "mg", "5");
        NutrientRecord a = rec("Mystery A", "g", "1");
        NutrientRecord protein = rec("Protein", "g", "3");
        NutrientRecord water = rec("Water", "g", "70");
        NutrientRecord b = rec("Mystery B", "g", "1");

        List<NutrientRecord> sorted = ordering.sortForDisplay(List.of(ca, a, protein, water, b));
        assertEquals(List.of(water, protein, ca, a, b), sorted);
        assertTrue(ordering.sortForDisplay(null).isEmpty());
    }

    @Test
    void unit_inference() {
        assertEquals("g", ordering.inferUnit(rec("Anything", "g", "1")));
        assertEquals("kJ", ordering.inferUnit(new NutrientRecord("Energy", null, null, null, "268", null)));
        assertEquals("kcal", ordering.inferUnit(rec("Energy (kcal)", null, null)));
        assertEquals("g", ordering.inferUnit(rec("PUFA 18:2", null, null)));
        assertEquals("g", ordering.inferUnit(rec("Leucine", null, null)));
        assertEquals("g", ordering.inferUnit(rec("Sucrose", null, null)));
        assertEquals("g", ordering.inferUnit(rec("Alcohol, ethyl", null, null)));
        assertEquals("", ordering.inferUnit(rec("Boron, B", null, null)));
    }

    @Test
    void unit_for_name_prefers_catalog_table() {
        assertEquals("mg", ordering.unitForName("Iron, Fe"));
        assertEquals(Units.MICROGRAM, ordering.unitForName("Vitamin B-12"));
        assertEquals("iu", ordering.unitForName("Vitamin A, IU"));
        assertEquals("g", ordering.unitForName("Protein"));
        assertEquals("", ordering.unitForName(" "));
    }
}
