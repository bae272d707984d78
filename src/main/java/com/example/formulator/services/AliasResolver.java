package com.example.formulator.services;

import java.util.*;

/**
 * Maps nutrient name aliases coming from different catalogs to one display name.
 * Names listed as dropped resolve to "" and are removed by the normalizer.
 */
public class AliasResolver {
    private final Map<String, String> aliasToCanonical = new HashMap<>();
    private final Set<String> dropped = new HashSet<>();

    public AliasResolver(Map<String, List<String>> aliases, Collection<String> droppedNames) {
        if (aliases != null) {
            for (var e : aliases.entrySet()) {
                String canon = e.getKey();
                aliasToCanonical.put(canon.toLowerCase(), canon);
                for (String a : e.getValue()) aliasToCanonical.put(a.toLowerCase(), canon);
            }
        }
        if (droppedNames != null) for (String d : droppedNames) dropped.add(d.toLowerCase());
    }

    /** The built-in nutrient alias table. */
    public static AliasResolver nutrientDefaults() {
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        aliases.put("Sugars, Total", List.of("total sugars"));
        aliases.put("Cysteine", List.of("cystine"));
        aliases.put("Carbohydrate, by difference", List.of("carbohydrate, by summation", "carbohydrate by summation"));
        aliases.put("Choline, from phosphatidyl choline", List.of("choline, from phosphotidyl choline"));
        return new AliasResolver(aliases, List.of(
                "energy (atwater general factors)",
                "energy (atwater specific factors)"));
    }

    /** Canonical display name, "" for dropped names, the trimmed input when unknown. */
    public String canonical(String name) {
        if (name == null) return "";
        String trimmed = name.trim();
        String lower = trimmed.toLowerCase();
        if (dropped.contains(lower)) return "";
        return aliasToCanonical.getOrDefault(lower, trimmed);
    }

    public boolean isDropped(String name) {
        return name != null && dropped.contains(name.trim().toLowerCase());
    }
}
