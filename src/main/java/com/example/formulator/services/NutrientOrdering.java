package com.example.formulator.services;

import com.example.formulator.model.NutrientRecord;
import java.util.*;
import java.util.function.Predicate;

/**
 * Stable ordering, identity keys and categories for nutrient rows, so that rows coming
 * from different sources line up in one set of columns.
 * <p>
 * Holds a mutable map of reference hints learned from full food details; one instance is
 * meant to be shared by a single caller thread.
 */
public class NutrientOrdering {

    /** Deduplication key for a display column plus the canonical name and unit it stands for. */
    public static class HeaderKey {
        public final String key;
        public final String name;
        public final String unit;
        public HeaderKey(String key, String name, String unit) { this.key = key; this.name = name; this.unit = unit; }
        @Override public String toString() { return key; }
    }

    /** Rank, category and unit recorded for a nutrient from a reference food. */
    public static class ReferenceInfo {
        public final Integer rank;
        public final String category;
        public final String unit;
        public ReferenceInfo(Integer rank, String category, String unit) { this.rank = rank; this.category = category; this.unit = unit; }
    }

    private static class CategoryRule {
        final Predicate<String> matches;
        final String category;
        CategoryRule(Predicate<String> matches, String category) { this.matches = matches; this.category = category; }
    }

    private static final List<String> VITAMIN_HINTS = List.of(
            "tocopherol", "tocotrienol", "carotene", "lycopene", "lutein", "zeaxanthin", "retinol", "folate",
            "folic acid", "betaine", "choline", "caffeine", "theobromine");
    private static final List<String> MACRO_HINTS = List.of(
            "water", "protein", "lipid", "fat", "ash", "carbohydrate", "fiber", "sugar", "starch", "nitrogen",
            "fatty acids", "sfa", "mufa", "pufa");
    private static final Set<String> LIPID_NAMES = Set.of("cholesterol", "total lipid (fat)", "total fat (nlea)");

    /** Evaluated in order against the lower-cased name of an uncatalogued nutrient. */
    private static final List<CategoryRule> CATEGORY_RULES = List.of(
            new CategoryRule(n -> n.startsWith("vitamin ") || VITAMIN_HINTS.stream().anyMatch(n::contains),
                    NutrientCatalog.VITAMINS_AND_OTHER),
            new CategoryRule(NutrientCatalog.AMINO_ACID_NAMES::contains, NutrientCatalog.AMINO_ACIDS),
            new CategoryRule(n -> n.contains("fatty acids") || n.startsWith("sfa ") || n.startsWith("mufa ")
                    || n.startsWith("pufa ") || LIPID_NAMES.contains(n), NutrientCatalog.LIPIDS),
            new CategoryRule(n -> n.contains("sterol"), NutrientCatalog.PHYTOSTEROLS),
            new CategoryRule(n -> NutrientCatalog.ORGANIC_ACID_NAMES.contains(n)
                    || (n.endsWith("acid") && !NutrientCatalog.AMINO_ACID_NAMES.contains(n)), NutrientCatalog.ORGANIC_ACIDS),
            new CategoryRule(NutrientCatalog.OLIGOSACCHARIDE_NAMES::contains, NutrientCatalog.OLIGOSACCHARIDES),
            new CategoryRule(NutrientCatalog.ISOFLAVONE_NAMES::contains, NutrientCatalog.ISOFLAVONES));

    /**
     * When two totals collapse onto one header key the higher priority name is kept.
     * Equal priorities let the later entry replace the earlier one.
     */
    private static final Map<String, Integer> ALIAS_PRIORITY = Map.of(
            "carbohydrate, by difference", 2,
            "carbohydrate, by summation", 1,
            "carbohydrate by summation", 1,
            "sugars, total", 2,
            "total sugars", 1);

    private final Units units;
    private final AliasResolver aliases;
    private final Map<String, Integer> orderMap = new HashMap<>();
    private final Map<String, String> categoryMap = new HashMap<>();
    private final Map<String, ReferenceInfo> referenceMap = new HashMap<>();

    public NutrientOrdering() {
        this(new Units(), AliasResolver.nutrientDefaults());
    }

    public NutrientOrdering(Units units, AliasResolver aliases) {
        this.units = units;
        this.aliases = aliases;
        int idx = 0;
        for (var e : NutrientCatalog.CATEGORIES.entrySet()) {
            List<String> names = e.getValue();
            for (int offset = 0; offset < names.size(); offset++) {
                String key = names.get(offset).trim().toLowerCase();
                orderMap.put(key, idx * 1000 + offset);
                categoryMap.put(key, e.getKey());
            }
            idx++;
        }
    }

    /** Catalog rank, or null for uncatalogued names. */
    public Integer orderForName(String name) {
        return name == null ? null : orderMap.get(name.trim().toLowerCase());
    }

    /**
     * Identity key of a nutrient row: energy per unit, water per unit, then source id,
     * source number and finally the name. Empty when nothing identifies the row.
     */
    public String nutrientKey(NutrientRecord nutrient) {
        String name = nutrient.normalizedName();
        String unit = nutrient.unit == null ? "" : nutrient.unit.trim().toLowerCase();
        if (name.equals("energy") && !unit.isEmpty()) return "energy:" + unit;
        if (name.equals("water")) return "water|" + unit;
        if (nutrient.id != null) return "id:" + nutrient.id;
        if (nutrient.number != null && !nutrient.number.isEmpty()) return "num:" + nutrient.number;
        return name.isEmpty() ? "" : "name:" + name;
    }

    public HeaderKey headerKey(NutrientRecord nutrient) {
        String name = aliases.canonical(nutrient.name);
        String rawUnit = nutrient.unit != null && !nutrient.unit.isBlank() ? nutrient.unit : inferUnit(nutrient);
        String unit = units.canonicalUnit(rawUnit);
        String unitPart = unit.trim().toLowerCase();
        String namePart = name.trim().toLowerCase();
        if (!namePart.isEmpty()) return new HeaderKey(namePart + "|" + unitPart, name, unit);
        String baseKey = nutrientKey(nutrient);
        if (baseKey.isEmpty()) return new HeaderKey("", name, unit);
        return new HeaderKey(baseKey + "|" + unitPart, name, unit);
    }

    /** Re-keys totals by header key, resolving alias collisions with the priority table. */
    public Map<String, NutrientTotal> normalizeTotalsByHeaderKey(Collection<NutrientTotal> totals) {
        Map<String, NutrientTotal> normalized = new LinkedHashMap<>();
        Map<String, Integer> bestPriority = new HashMap<>();
        for (NutrientTotal t : totals) {
            HeaderKey hk = headerKey(new NutrientRecord(t.name, t.unit, t.amount));
            if (hk.key.isEmpty()) continue;
            int priority = ALIAS_PRIORITY.getOrDefault(t.name.trim().toLowerCase(), 0);
            if (priority < bestPriority.getOrDefault(hk.key, -1)) continue;
            bestPriority.put(hk.key, priority);
            String name = hk.name.isEmpty() ? t.name : hk.name;
            String unit = hk.unit.isEmpty() ? t.unit : hk.unit;
            normalized.put(hk.key, new NutrientTotal(name, unit, t.amount));
        }
        return normalized;
    }

    // ---- reference hints ----

    public ReferenceInfo referenceInfo(NutrientRecord nutrient) {
        return referenceMap.get(nutrientKey(nutrient));
    }

    /**
     * Learns rank, category and unit from the rows of a full food record. Rows without an
     * amount are category headers: they set the category of the rows that follow.
     */
    public void updateReferenceFromDetails(List<NutrientRecord> details) {
        if (details == null || details.isEmpty()) return;
        String currentCategory = null;
        for (NutrientRecord n : details) {
            String key = nutrientKey(n);
            if (key.isEmpty()) continue;
            if (!n.hasAmount()) {
                if (!n.name.isBlank()) currentCategory = n.name.trim();
                referenceMap.putIfAbsent(key, new ReferenceInfo(n.rank, currentCategory, n.unit));
                continue;
            }
            referenceMap.put(key, new ReferenceInfo(n.rank, currentCategory, n.unit));
        }
    }

    // ---- ordering ----

    /** Explicit rank, then the recorded reference rank, then the catalog rank, then the fallback. */
    public int nutrientOrder(NutrientRecord nutrient, int fallback) {
        if (nutrient.rank != null) return nutrient.rank;
        ReferenceInfo ref = referenceInfo(nutrient);
        if (ref != null && ref.rank != null) return ref.rank;
        Integer catalog = orderForName(nutrient.name);
        return catalog != null ? catalog : fallback;
    }

    /** Stable sort; rows with no known order keep their relative position after ranked ones. */
    public List<NutrientRecord> sortForDisplay(List<NutrientRecord> nutrients) {
        if (nutrients == null || nutrients.isEmpty()) return new ArrayList<>();
        Map<NutrientRecord, Integer> order = new IdentityHashMap<>();
        for (int i = 0; i < nutrients.size(); i++) order.put(nutrients.get(i), nutrientOrder(nutrients.get(i), i + 10000));
        List<NutrientRecord> sorted = new ArrayList<>(nutrients);
        sorted.sort(Comparator.comparingInt(order::get));
        return sorted;
    }

    // ---- categories ----

    public String categoryFor(String name) {
        return categoryFor(name, null);
    }

    /** Catalog category, else the first matching inference rule, else a recorded hint, else "Other". */
    public String categoryFor(String name, NutrientRecord nutrient) {
        String lower = name == null ? "" : name.trim().toLowerCase();
        String known = categoryMap.get(lower);
        if (known != null) return known;
        for (CategoryRule rule : CATEGORY_RULES) if (rule.matches.test(lower)) return rule.category;
        if (nutrient != null) {
            ReferenceInfo ref = referenceInfo(nutrient);
            if (ref != null && ref.category != null) return ref.category;
        }
        return NutrientCatalog.OTHER;
    }

    // ---- units ----

    /** The record's own unit, else a default from its number or its name; "" when unknown. */
    public String inferUnit(NutrientRecord nutrient) {
        if (nutrient.unit != null && !nutrient.unit.isBlank()) return nutrient.unit;
        String number = nutrient.number == null ? "" : nutrient.number.trim();
        String byNumber = NutrientCatalog.UNITS_BY_NUMBER.get(number);
        if (byNumber != null) return byNumber;

        String name = nutrient.name.toLowerCase();
        if (name.contains("energy") && name.contains("kcal")) return "kcal";
        if (name.contains("energy") && name.contains("kj")) return "kJ";
        if (MACRO_HINTS.stream().anyMatch(name::contains) || name.contains(":")) return "g";
        if (NutrientCatalog.AMINO_ACID_NAMES.contains(name)) return "g";
        if (NutrientCatalog.SIMPLE_SUGAR_NAMES.contains(name)) return "g";
        if (name.equals("alcohol, ethyl")) return "g";
        return "";
    }

    /** Usual unit for a nutrient name, canonicalized. */
    public String unitForName(String name) {
        String lower = name == null ? "" : name.trim().toLowerCase();
        if (lower.isEmpty()) return "";
        String mapped = NutrientCatalog.UNITS_BY_NAME.get(lower);
        if (mapped != null) return mapped;
        return units.canonicalUnit(inferUnit(new NutrientRecord(name, null, null)));
    }
}
