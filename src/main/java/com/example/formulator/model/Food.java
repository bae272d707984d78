package com.example.formulator.model;

import java.util.List;

/** A food from the nutrition database, or a manually entered one. Immutable. */
public class Food {
    public static final String MANUAL_DATA_TYPE = "Manual";

    public final int fdcId;
    public final String description;
    public final String dataType;
    public final String brandOwner;
    public final List<Nutrient> nutrients;

    public Food(int fdcId, String description, String dataType) {
        this(fdcId, description, dataType, "", List.of());
    }

    public Food(int fdcId, String description, String dataType, String brandOwner, List<Nutrient> nutrients) {
        String type = dataType == null ? "" : dataType.trim();
        if (fdcId <= 0 && !type.equalsIgnoreCase(MANUAL_DATA_TYPE)) throw new IllegalArgumentException("Invalid FDC ID: " + fdcId);
        if (description == null || description.isEmpty()) throw new IllegalArgumentException("Food description cannot be empty");
        if (type.isEmpty()) throw new IllegalArgumentException("Food data type cannot be empty");
        this.fdcId = fdcId;
        this.description = description;
        this.dataType = dataType;
        this.brandOwner = brandOwner == null ? "" : brandOwner;
        this.nutrients = nutrients == null ? List.of() : List.copyOf(nutrients);
    }

    /** Case-insensitive lookup; null when absent. */
    public Nutrient getNutrient(String name) {
        if (name == null) return null;
        for (Nutrient n : nutrients) if (n.name.equalsIgnoreCase(name)) return n;
        return null;
    }

    public boolean hasNutrient(String name) { return getNutrient(name) != null; }

    @Override public String toString() { return description + " (" + fdcId + ", " + dataType + ")"; }
}
