package com.example.formulator.services;

import java.util.*;

/** Static nutrient taxonomy: categories in display order, their members, and default units. */
public final class NutrientCatalog {
    public static final String PROXIMATES = "Proximates";
    public static final String CARBOHYDRATES = "Carbohydrates";
    public static final String MINERALS = "Minerals";
    public static final String VITAMINS_AND_OTHER = "Vitamins and Other Components";
    public static final String LIPIDS = "Lipids";
    public static final String AMINO_ACIDS = "Amino acids";
    public static final String PHYTOSTEROLS = "Phytosterols";
    public static final String ORGANIC_ACIDS = "Organic acids";
    public static final String OLIGOSACCHARIDES = "Oligosaccharides";
    public static final String ISOFLAVONES = "Isoflavones";
    public static final String OTHER = "Other";

    /** Category name to ordered member names. Iteration order is the display order. */
    public static final Map<String, List<String>> CATEGORIES;

    public static final Set<String> AMINO_ACID_NAMES = Set.of(
            "tryptophan", "threonine", "isoleucine", "leucine", "lysine", "methionine",
            "phenylalanine", "tyrosine", "valine", "arginine", "histidine", "alanine",
            "aspartic acid", "glutamic acid", "glycine", "proline", "serine",
            "hydroxyproline", "cysteine", "cystine");
    public static final Set<String> ORGANIC_ACID_NAMES = Set.of("citric acid", "malic acid", "oxalic acid", "quinic acid");
    public static final Set<String> OLIGOSACCHARIDE_NAMES = Set.of("raffinose", "stachyose", "verbascose");
    public static final Set<String> ISOFLAVONE_NAMES = Set.of("daidzein", "genistein", "daidzin", "genistin", "glycitin");
    public static final Set<String> SIMPLE_SUGAR_NAMES = Set.of("sucrose", "glucose", "fructose", "lactose", "maltose", "galactose");

    /** Default units keyed by source nutrient number, used when a record omits its unit. */
    public static final Map<String, String> UNITS_BY_NUMBER = Map.ofEntries(
            Map.entry("255", "g"),    // Water
            Map.entry("203", "g"),    // Protein
            Map.entry("204", "g"),    // Total lipid (fat)
            Map.entry("298", "g"),    // Total fat (NLEA)
            Map.entry("202", "g"),    // Nitrogen
            Map.entry("207", "g"),    // Ash
            Map.entry("205", "g"),    // Carbohydrate, by difference
            Map.entry("291", "g"),    // Fiber, total dietary
            Map.entry("269", "g"),    // Sugars, total
            Map.entry("268", "kJ"),
            Map.entry("208", "kcal"),
            Map.entry("951", "g"),    // Proximates header
            Map.entry("956", "g"));   // Carbohydrates header

    /** Lower-cased nutrient name to its usual unit. */
    public static final Map<String, String> UNITS_BY_NAME;

    static {
        Map<String, List<String>> c = new LinkedHashMap<>();
        c.put(PROXIMATES, List.of(
                "Water", "Energy", "Nitrogen", "Protein", "Total fat (NLEA)", "Total lipid (fat)", "Ash",
                "Carbohydrate, by difference"));
        c.put(CARBOHYDRATES, List.of(
                "Fiber, total dietary", "Fiber, soluble", "Fiber, insoluble", "Total dietary fiber (AOAC 2011.25)",
                "High Molecular Weight Dietary Fiber (HMWDF)", "Low Molecular Weight Dietary Fiber (LMWDF)",
                "Sugars, Total", "Sucrose", "Glucose", "Fructose", "Lactose", "Maltose", "Galactose", "Starch",
                "Resistant starch", "Sugars, added"));
        c.put(MINERALS, List.of(
                "Calcium, Ca", "Iron, Fe", "Magnesium, Mg", "Phosphorus, P", "Potassium, K", "Sodium, Na",
                "Zinc, Zn", "Copper, Cu", "Manganese, Mn", "Iodine, I", "Selenium, Se", "Molybdenum, Mo",
                "Fluoride, F"));
        c.put(VITAMINS_AND_OTHER, List.of(
                "Thiamin", "Riboflavin", "Niacin", "Vitamin B-6", "Folate, total", "Folic acid", "Folate, DFE",
                "Choline, total", "Choline, free", "Choline, from phosphocholine", "Choline, from phosphatidyl choline",
                "Choline, from glycerophosphocholine", "Choline, from sphingomyelin", "Betaine", "Vitamin B-12",
                "Vitamin B-12, added", "Vitamin A, RAE", "Retinol", "Carotene, beta", "cis-beta-Carotene",
                "trans-beta-Carotene", "Carotene, alpha", "Carotene, gamma", "Cryptoxanthin, beta",
                "Cryptoxanthin, alpha", "Vitamin A, IU", "Lycopene", "cis-Lycopene", "trans-Lycopene",
                "Lutein + zeaxanthin", "cis-Lutein/Zeaxanthin", "Lutein", "Zeaxanthin", "Phytoene", "Phytofluene",
                "Vitamin D (D2 + D3), International Units", "Vitamin D (D2 + D3)", "Vitamin D2 (ergocalciferol)",
                "Vitamin D3 (cholecalciferol)", "25-hydroxycholecalciferol", "Vitamin K (phylloquinone)",
                "Vitamin K (Dihydrophylloquinone)", "Vitamin K (Menaquinone-4)", "Vitamin E (alpha-tocopherol)",
                "Vitamin E, added", "Tocopherol, beta", "Tocopherol, gamma", "Tocopherol, delta", "Tocotrienol, alpha",
                "Tocotrienol, beta", "Tocotrienol, gamma", "Tocotrienol, delta", "Vitamin C, total ascorbic acid",
                "Pantothenic acid", "Biotin", "Caffeine", "Theobromine"));
        c.put(LIPIDS, List.of(
                "Fatty acids, total saturated",
                "SFA 4:0", "SFA 5:0", "SFA 6:0", "SFA 7:0", "SFA 8:0", "SFA 9:0", "SFA 10:0", "SFA 11:0", "SFA 12:0",
                "SFA 13:0", "SFA 14:0", "SFA 15:0", "SFA 16:0", "SFA 17:0", "SFA 18:0", "SFA 20:0", "SFA 21:0",
                "SFA 22:0", "SFA 23:0", "SFA 24:0",
                "Fatty acids, total monounsaturated",
                "MUFA 12:1", "MUFA 14:1", "MUFA 14:1 c", "MUFA 15:1", "MUFA 16:1", "MUFA 16:1 c", "MUFA 17:1",
                "MUFA 17:1 c", "MUFA 18:1", "MUFA 18:1 c", "MUFA 20:1", "MUFA 20:1 c", "MUFA 22:1", "MUFA 22:1 c",
                "MUFA 22:1 n-9", "MUFA 22:1 n-11", "MUFA 24:1 c",
                "Fatty acids, total polyunsaturated",
                "PUFA 18:2", "PUFA 18:2 c", "PUFA 18:2 n-6 c,c", "PUFA 18:2 CLAs", "PUFA 18:2 i", "PUFA 18:3",
                "PUFA 18:3 c", "PUFA 18:3 n-3 c,c,c (ALA)", "PUFA 18:3 n-6 c,c,c", "PUFA 18:4", "PUFA 20:2 c",
                "PUFA 20:2 n-6 c,c", "PUFA 20:3", "PUFA 20:3 c", "PUFA 20:3 n-3", "PUFA 20:3 n-6", "PUFA 20:3 n-9",
                "PUFA 20:4", "PUFA 20:4c", "PUFA 20:5c", "PUFA 20:5 n-3 (EPA)", "PUFA 22:2", "PUFA 22:3", "PUFA 22:4",
                "PUFA 22:5 c", "PUFA 22:5 n-3 (DPA)", "PUFA 22:6 c", "PUFA 22:6 n-3 (DHA)",
                "Fatty acids, total trans", "Fatty acids, total trans-monoenoic", "Fatty acids, total trans-dienoic",
                "Fatty acids, total trans-polyenoic",
                "TFA 14:1 t", "TFA 16:1 t", "TFA 18:1 t", "TFA 18:2 t", "TFA 18:2 t,t", "TFA 18:2 t not further defined",
                "TFA 18:3 t", "TFA 20:1 t", "TFA 22:1 t",
                "Cholesterol"));
        c.put(AMINO_ACIDS, List.of(
                "Tryptophan", "Threonine", "Isoleucine", "Leucine", "Lysine", "Methionine", "Phenylalanine",
                "Tyrosine", "Valine", "Arginine", "Histidine", "Alanine", "Aspartic acid", "Glutamic acid", "Glycine",
                "Proline", "Serine", "Hydroxyproline", "Cysteine"));
        c.put(PHYTOSTEROLS, List.of(
                "Phytosterols", "Beta-sitosterol", "Brassicasterol", "Campesterol", "Campestanol",
                "Delta-5-avenasterol", "Phytosterols, other", "Stigmasterol", "Beta-sitostanol"));
        c.put(ORGANIC_ACIDS, List.of("Citric acid", "Malic acid", "Oxalic acid", "Quinic acid"));
        c.put(OLIGOSACCHARIDES, List.of("Verbascose", "Raffinose", "Stachyose"));
        c.put(ISOFLAVONES, List.of("Daidzin", "Genistin", "Glycitin", "Daidzein", "Genistein"));
        CATEGORIES = Collections.unmodifiableMap(c);

        Map<String, String> u = new HashMap<>();
        put(u, "mg", "Calcium, Ca", "Iron, Fe", "Magnesium, Mg", "Phosphorus, P", "Potassium, K", "Sodium, Na",
                "Zinc, Zn", "Copper, Cu", "Manganese, Mn");
        put(u, Units.MICROGRAM, "Iodine, I", "Selenium, Se", "Molybdenum, Mo", "Fluoride, F");
        put(u, "mg", "Thiamin", "Riboflavin", "Niacin", "Vitamin B-6", "Choline, total", "Choline, free",
                "Choline, from phosphocholine", "Choline, from phosphatidyl choline",
                "Choline, from glycerophosphocholine", "Choline, from sphingomyelin", "Betaine",
                "Vitamin E (alpha-tocopherol)", "Vitamin E, added", "Tocopherol, beta", "Tocopherol, gamma",
                "Tocopherol, delta", "Tocotrienol, alpha", "Tocotrienol, beta", "Tocotrienol, gamma",
                "Tocotrienol, delta", "Vitamin C, total ascorbic acid", "Pantothenic acid", "Caffeine", "Theobromine");
        put(u, Units.MICROGRAM, "Folate, total", "Folic acid", "Folate, DFE", "Vitamin B-12", "Vitamin B-12, added",
                "Vitamin A, RAE", "Retinol", "Carotene, beta", "cis-beta-Carotene", "trans-beta-Carotene",
                "Carotene, alpha", "Carotene, gamma", "Cryptoxanthin, beta", "Cryptoxanthin, alpha", "Lycopene",
                "cis-Lycopene", "trans-Lycopene", "Lutein + zeaxanthin", "cis-Lutein/Zeaxanthin", "Lutein",
                "Zeaxanthin", "Phytoene", "Phytofluene", "Vitamin D (D2 + D3)", "Vitamin D2 (ergocalciferol)",
                "Vitamin D3 (cholecalciferol)", "25-hydroxycholecalciferol", "Vitamin K (phylloquinone)",
                "Vitamin K (Dihydrophylloquinone)", "Vitamin K (Menaquinone-4)", "Biotin");
        put(u, "iu", "Vitamin A, IU", "Vitamin D (D2 + D3), International Units");
        put(u, "mg", "Cholesterol", "Phytosterols", "Beta-sitosterol", "Brassicasterol", "Campesterol",
                "Campestanol", "Delta-5-avenasterol", "Phytosterols, other", "Stigmasterol", "Beta-sitostanol");
        put(u, "mg", "Citric acid", "Malic acid", "Oxalic acid", "Quinic acid");
        put(u, "mg", "Daidzin", "Genistin", "Glycitin", "Daidzein", "Genistein");
        put(u, "g", "Verbascose", "Raffinose", "Stachyose");
        put(u, "kcal", "Energy");
        UNITS_BY_NAME = Collections.unmodifiableMap(u);
    }

    private NutrientCatalog() {}

    private static void put(Map<String, String> map, String unit, String... names) {
        for (String n : names) map.put(n.trim().toLowerCase(), unit);
    }
}
