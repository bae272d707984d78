package com.example.formulator.services;

/**
 * A redistribution request the current formulation cannot satisfy (for example a target
 * below the locked weight). The formulation is left unchanged; the user can correct the
 * input and retry.
 */
public class InvalidFormulationException extends RuntimeException {
    public InvalidFormulationException(String message) {
        super(message);
    }
}
