package com.example.formulator.services;

import com.example.formulator.model.NutrientRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills in nutrients a food source left out and removes duplicate spellings.
 * <p>
 * Steps, in order: fat equivalence, canonical units, alias merge, nitrogen from protein,
 * water estimate for branded foods, energy from macros. The input list is never modified.
 * Running the pipeline on its own output changes nothing except that energy is recomputed
 * (to the same values).
 */
public class NutrientNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NutrientNormalizer.class);

    public static final BigDecimal ATWATER_PROTEIN = BigDecimal.valueOf(4);
    public static final BigDecimal ATWATER_CARBOHYDRATE = BigDecimal.valueOf(4);
    public static final BigDecimal ATWATER_FAT = BigDecimal.valueOf(9);
    public static final BigDecimal PROTEIN_TO_NITROGEN = new BigDecimal("6.25");

    static final String LIPID = "total lipid (fat)";
    static final String NLEA = "total fat (nlea)";
    static final String LIPID_NAME = "Total lipid (fat)";
    static final String NLEA_NAME = "Total fat (NLEA)";
    static final String PROTEIN = "protein";
    static final String CARBOHYDRATE = "carbohydrate, by difference";
    static final String ASH = "ash";
    static final String FIBER = "fiber, total dietary";
    static final String WATER = "water";
    static final String NITROGEN = "nitrogen";
    static final String ENERGY = "energy";

    private static final Set<String> ENERGY_MACROS = Set.of(PROTEIN, CARBOHYDRATE, LIPID, NLEA);
    private static final Set<String> WATER_MACROS = Set.of(PROTEIN, CARBOHYDRATE, LIPID, NLEA, ASH, FIBER);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Units units;
    private final AliasResolver aliases;

    public NutrientNormalizer() {
        this(new Units(), AliasResolver.nutrientDefaults());
    }

    public NutrientNormalizer(Units units, AliasResolver aliases) {
        this.units = units;
        this.aliases = aliases;
    }

    /** Runs the whole pipeline. {@code dataType} decides whether the branded water estimate applies. */
    public List<NutrientRecord> normalize(List<NutrientRecord> nutrients, String dataType) {
        List<NutrientRecord> normalized = augmentFat(nutrients == null ? List.of() : nutrients);
        normalized = canonicalizeUnits(normalized);
        normalized = mergeAliases(normalized);
        normalized = augmentNitrogen(normalized);
        normalized = augmentBrandedWater(normalized, dataType);
        return augmentEnergy(normalized);
    }

    /**
     * Makes "Total lipid (fat)" and "Total fat (NLEA)" mirror each other. A missing one is
     * cloned from its counterpart (without source ids) right next to it; duplicates of
     * either name are reduced to their first occurrence.
     */
    List<NutrientRecord> augmentFat(List<NutrientRecord> nutrients) {
        if (nutrients.isEmpty()) return new ArrayList<>();
        log.debug("augmentFat input={}", nutrients.size());

        List<NutrientRecord> filtered = new ArrayList<>();
        NutrientRecord lipid = null, nlea = null;
        int lipidIdx = -1, nleaIdx = -1;
        boolean lipidFirst = false;
        for (NutrientRecord n : nutrients) {
            String name = n.normalizedName();
            if (name.equals(LIPID)) {
                if (lipid == null) {
                    lipid = n;
                    lipidIdx = filtered.size();
                    lipidFirst = nlea == null;
                }
                continue;
            }
            if (name.equals(NLEA)) {
                if (nlea == null) {
                    nlea = n;
                    nleaIdx = filtered.size();
                }
                continue;
            }
            filtered.add(n);
        }

        boolean hasLipid = lipid != null && lipid.hasAmount();
        boolean hasNlea = nlea != null && nlea.hasAmount();
        if (!hasLipid && !hasNlea) return new ArrayList<>(nutrients);

        List<NutrientRecord> result = new ArrayList<>(filtered);
        if (!hasLipid) {
            result.add(nleaIdx, nlea.withName(LIPID_NAME).withoutSourceIds());
            result.add(nleaIdx + 1, nlea);
        } else if (!hasNlea) {
            result.add(lipidIdx, lipid);
            result.add(lipidIdx + 1, lipid.withName(NLEA_NAME).withoutSourceIds());
        } else {
            NutrientRecord first = lipidFirst ? lipid : nlea;
            NutrientRecord second = lipidFirst ? nlea : lipid;
            int firstIdx = Math.min(lipidIdx, nleaIdx);
            int secondIdx = Math.max(lipidIdx, nleaIdx);
            result.add(firstIdx, first);
            // shifted by one because the first entry now precedes it
            result.add(secondIdx + 1, second);
        }
        return result;
    }

    List<NutrientRecord> canonicalizeUnits(List<NutrientRecord> nutrients) {
        List<NutrientRecord> result = new ArrayList<>(nutrients.size());
        for (NutrientRecord n : nutrients) {
            String canonical = units.canonicalUnit(n.unit);
            result.add(canonical.isEmpty() ? n : n.withUnit(canonical));
        }
        return result;
    }

    /**
     * One entry per canonical name; the first non-null amount wins. Energy rows are merged
     * per unit so kcal and kJ stay separate. Atwater energy variants are dropped.
     */
    List<NutrientRecord> mergeAliases(List<NutrientRecord> nutrients) {
        Map<String, NutrientRecord> merged = new LinkedHashMap<>();
        for (NutrientRecord n : nutrients) {
            String canonical = aliases.canonical(n.name);
            if (canonical.isEmpty()) continue;
            String key = canonical;
            if (canonical.equalsIgnoreCase(ENERGY)) key = canonical + "|" + (n.unit == null ? "" : n.unit.toLowerCase());
            NutrientRecord existing = merged.get(key);
            if (existing == null) {
                merged.put(key, n.name.equals(canonical) ? n : n.withName(canonical));
            } else if (n.hasAmount() && !existing.hasAmount()) {
                merged.put(key, existing.withAmount(n.amount));
            }
        }
        return new ArrayList<>(merged.values());
    }

    /** Nitrogen = Protein / 6.25, placed at the protein row, unless a valued nitrogen row exists. */
    List<NutrientRecord> augmentNitrogen(List<NutrientRecord> nutrients) {
        List<NutrientRecord> result = new ArrayList<>(nutrients);
        int emptyNitrogenIdx = -1;
        int proteinIdx = -1;
        BigDecimal protein = null;
        for (int i = 0; i < nutrients.size(); i++) {
            NutrientRecord n = nutrients.get(i);
            String name = n.normalizedName();
            if (name.equals(NITROGEN)) {
                if (n.hasAmount()) return result;
                if (emptyNitrogenIdx < 0) emptyNitrogenIdx = i;
            } else if (name.equals(PROTEIN) && protein == null && n.hasAmount()) {
                protein = n.amount;
                proteinIdx = i;
            }
        }
        if (protein == null) return result;

        BigDecimal nitrogen = protein.divide(PROTEIN_TO_NITROGEN, MathContext.DECIMAL128);
        if (emptyNitrogenIdx >= 0) {
            result.set(emptyNitrogenIdx, withDefaultUnit(result.get(emptyNitrogenIdx).withAmount(nitrogen), "g"));
        } else {
            result.add(proteinIdx, new NutrientRecord("Nitrogen", "g", nitrogen));
        }
        return result;
    }

    /**
     * Branded labels rarely report water; estimate it as what the other macros leave of
     * 100 g, never below zero.
     */
    List<NutrientRecord> augmentBrandedWater(List<NutrientRecord> nutrients, String dataType) {
        List<NutrientRecord> result = new ArrayList<>(nutrients);
        if (nutrients.isEmpty()) return result;
        if (dataType == null || !dataType.trim().equalsIgnoreCase("branded")) return result;

        int emptyWaterIdx = -1;
        for (int i = 0; i < nutrients.size(); i++) {
            NutrientRecord n = nutrients.get(i);
            if (!n.normalizedName().equals(WATER)) continue;
            if (n.hasAmount()) return result;
            if (emptyWaterIdx < 0) emptyWaterIdx = i;
        }

        BigDecimal solids = findAmount(nutrients, LIPID, NLEA)
                .add(findAmount(nutrients, PROTEIN))
                .add(findAmount(nutrients, CARBOHYDRATE))
                .add(findAmount(nutrients, ASH))
                .add(findAmount(nutrients, FIBER));
        BigDecimal water = HUNDRED.subtract(solids).max(BigDecimal.ZERO);
        log.debug("estimated branded water={} from solids={}", water, solids);

        if (emptyWaterIdx >= 0) {
            result.set(emptyWaterIdx, withDefaultUnit(result.get(emptyWaterIdx).withAmount(water), "g"));
        } else {
            result.add(firstIndexOf(nutrients, WATER_MACROS), new NutrientRecord("Water", "g", water));
        }
        return result;
    }

    /**
     * Energy is always derived from macros with Atwater factors (4/4/9), kJ = kcal x 4.184.
     * Existing kcal and kJ rows are updated in place, other energy rows are dropped.
     */
    List<NutrientRecord> augmentEnergy(List<NutrientRecord> nutrients) {
        if (nutrients.isEmpty()) return new ArrayList<>();

        List<NutrientRecord> result = new ArrayList<>();
        int kcalIdx = -1, kjIdx = -1;
        for (NutrientRecord n : nutrients) {
            if (!n.normalizedName().equals(ENERGY)) {
                result.add(n);
                continue;
            }
            String unit = n.unit == null ? "" : n.unit.trim().toLowerCase();
            if (unit.equals("kcal") && kcalIdx < 0) {
                kcalIdx = result.size();
                result.add(n.withoutSourceIds());
            } else if (unit.equals("kj") && kjIdx < 0) {
                kjIdx = result.size();
                result.add(n.withoutSourceIds());
            } else {
                log.debug("dropping extra energy row unit={}", n.unit);
            }
        }

        BigDecimal protein = findAmount(result, PROTEIN);
        BigDecimal carbs = findAmount(result, CARBOHYDRATE);
        BigDecimal fat = findAmount(result, LIPID, NLEA);
        BigDecimal kcal = protein.multiply(ATWATER_PROTEIN)
                .add(carbs.multiply(ATWATER_CARBOHYDRATE))
                .add(fat.multiply(ATWATER_FAT));
        BigDecimal kj = kcal.multiply(Units.KCAL_TO_KJ);

        if (kcalIdx >= 0) {
            result.set(kcalIdx, result.get(kcalIdx).withAmount(kcal).withUnit("kcal"));
        } else {
            kcalIdx = firstIndexOf(result, ENERGY_MACROS);
            result.add(kcalIdx, new NutrientRecord("Energy", "kcal", kcal));
            if (kjIdx >= kcalIdx) kjIdx++;
        }
        if (kjIdx >= 0) {
            result.set(kjIdx, result.get(kjIdx).withAmount(kj).withUnit("kJ"));
        } else {
            result.add(kcalIdx + 1, new NutrientRecord("Energy", "kJ", kj));
        }
        return result;
    }

    /** Amount of the first valued row whose name is one of {@code names}; zero when none. */
    private static BigDecimal findAmount(List<NutrientRecord> nutrients, String... names) {
        List<String> wanted = Arrays.asList(names);
        for (NutrientRecord n : nutrients) {
            if (wanted.contains(n.normalizedName()) && n.hasAmount()) return n.amount;
        }
        return BigDecimal.ZERO;
    }

    /** Smallest index of a row named in {@code names}, or 0. */
    private static int firstIndexOf(List<NutrientRecord> nutrients, Set<String> names) {
        for (int i = 0; i < nutrients.size(); i++) {
            if (names.contains(nutrients.get(i).normalizedName())) return i;
        }
        return 0;
    }

    private static NutrientRecord withDefaultUnit(NutrientRecord n, String unit) {
        return n.unit == null || n.unit.isBlank() ? n.withUnit(unit) : n;
    }
}
