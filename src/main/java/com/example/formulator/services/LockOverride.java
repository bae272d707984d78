package com.example.formulator.services;

import com.example.formulator.model.Ingredient;

/** Forces an ingredient's lock flag for the duration of a try-with-resources block. */
final class LockOverride implements AutoCloseable {
    private final Ingredient ingredient;
    private final boolean wasLocked;

    LockOverride(Ingredient ingredient, boolean locked) {
        this.ingredient = ingredient;
        this.wasLocked = ingredient.isLocked();
        ingredient.setLocked(locked);
    }

    @Override
    public void close() {
        ingredient.setLocked(wasLocked);
    }
}
