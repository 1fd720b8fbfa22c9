package com.botrank.botrank_api.rating;

import java.util.Locale;

/** Interchangeable implementations of the same MM update. */
public enum Formulation {

    /** Per ranking, per finisher sums. Quadratic in ranking length. */
    REFERENCE,

    /** Padded position-by-contest matrix with cumulative sums over whole rows. */
    MATRIX;

    public PlackettLuceFitter newFitter() {
        return switch (this) {
            case REFERENCE -> new ReferencePlackettLuceFitter();
            case MATRIX -> new MatrixPlackettLuceFitter();
        };
    }

    public static Formulation fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return REFERENCE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown rating formulation '" + value + "' (expected 'reference' or 'matrix')", e);
        }
    }
}
