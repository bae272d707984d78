package com.example.formulator.services;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/** Mass and energy conversion plus canonical spelling of unit strings. */
public class Units {
    public static final String MICROGRAM = "μg";
    public static final BigDecimal KCAL_TO_KJ = new BigDecimal("4.184");

    private static final Set<String> MICRO_ALIASES = Set.of("ug", "mcg", "µg", "μg", "æg");
    private static final Set<String> FORMULATION_MASS_UNITS = Set.of("g", "kg", "ton", "lb", "oz");

    private final Map<String, BigDecimal> toGrams;

    public Units() {
        this(null);
    }

    /** Extra gram factors are added on top of the built-in table; built-ins are never overridden. */
    public Units(Map<String, BigDecimal> extraMassFactors) {
        this.toGrams = (extraMassFactors == null) ? new HashMap<>() : new HashMap<>(extraMassFactors);
        this.toGrams.put(MICROGRAM, new BigDecimal("0.000001"));
        this.toGrams.put("mg", new BigDecimal("0.001"));
        this.toGrams.put("g", BigDecimal.ONE);
        this.toGrams.put("kg", new BigDecimal("1000"));
        this.toGrams.put("ton", new BigDecimal("1000000"));
        this.toGrams.put("lb", new BigDecimal("453.59237"));
        this.toGrams.put("oz", new BigDecimal("28.349523125"));
    }

    /**
     * Map case and alias variants to one spelling: micro-gram variants to "μg", kilojoules
     * to "kJ", mass words (English and Spanish) to their short symbol. Unknown tokens are
     * returned lower-cased; null or blank yields "".
     */
    public String canonicalUnit(String unit) {
        if (unit == null) return "";
        String u = unit.trim();
        if (u.isEmpty()) return "";
        String lower = u.toLowerCase();
        if (MICRO_ALIASES.contains(lower)) return MICROGRAM;
        switch (lower) {
            case "kj": case "kjoule": case "kilojoule": case "kilojoules": return "kJ";
            case "kcal": case "kilocalorie": case "kilocalories": return "kcal";
            case "iu": return "iu";
            case "g": case "gram": case "grams": case "gramo": case "gramos": return "g";
            case "kg": case "kilogram": case "kilograms": case "kilogramo": case "kilogramos": return "kg";
            case "t": case "tn": case "ton": case "tonne": case "tonnes": case "tonelada": case "toneladas": return "ton";
            case "lb": case "lbs": case "libra": case "libras": case "pound": case "pounds": return "lb";
            case "oz": case "onza": case "onzas": case "ounce": case "ounces": return "oz";
            case "mg": return "mg";
            default:
                return lower;
        }
    }

    /** Canonical unit if it is one a formulation or a cost pack may be measured in, else "". */
    public String normalizeMassUnit(String unit) {
        String canonical = canonicalUnit(unit);
        return FORMULATION_MASS_UNITS.contains(canonical) ? canonical : "";
    }

    public boolean isMassUnit(String unit) {
        return toGrams.containsKey(canonicalUnit(unit));
    }

    /** Null when either unit is unknown. */
    public BigDecimal convertMass(BigDecimal value, String from, String to) {
        if (value == null) return null;
        String source = canonicalUnit(from);
        String target = canonicalUnit(to);
        if (source.isEmpty() || target.isEmpty()) return null;
        if (source.equals(target)) return value;
        BigDecimal f = toGrams.get(source);
        BigDecimal t = toGrams.get(target);
        if (f == null || t == null) return null;
        return value.multiply(f).divide(t, MathContext.DECIMAL128);
    }

    /** Converts between two mass units or between kcal and kJ; null for incompatible units. */
    public BigDecimal convertAmount(BigDecimal value, String from, String to) {
        if (value == null) return null;
        String source = canonicalUnit(from);
        String target = canonicalUnit(to);
        if (source.isEmpty() || target.isEmpty()) return null;
        if (source.equals(target)) return value;
        if (toGrams.containsKey(source) && toGrams.containsKey(target)) return convertMass(value, source, target);
        if (source.equals("kcal") && target.equals("kJ")) return value.multiply(KCAL_TO_KJ);
        if (source.equals("kJ") && target.equals("kcal")) return value.divide(KCAL_TO_KJ, MathContext.DECIMAL128);
        return null;
    }

    public BigDecimal massToGrams(BigDecimal value, String unit) { return convertMass(value, unit, "g"); }

    public BigDecimal massToKilograms(BigDecimal value, String unit) { return convertMass(value, unit, "kg"); }
}
