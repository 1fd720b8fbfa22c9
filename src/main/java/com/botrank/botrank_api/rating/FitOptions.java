package com.botrank.botrank_api.rating;

/**
 * Knobs for a single Plackett-Luce fit.
 *
 * @param tolerance         stop once the L2 distance between successive
 *                          strength vectors is at or below this value
 * @param checkPrecondition run the connectivity check before iterating
 * @param normalize         rescale strengths to sum to 1 after every iteration
 * @param maxIterations     iteration cap; 0 means loop until converged
 * @param verbose           log every iteration at INFO instead of DEBUG
 */
public record FitOptions(
        double tolerance,
        boolean checkPrecondition,
        boolean normalize,
        int maxIterations,
        boolean verbose
) {
    public static final double DEFAULT_TOLERANCE = 1e-9;

    public FitOptions {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("Max iterations must be 0 (unbounded) or positive: " + maxIterations);
        }
    }

    public static FitOptions defaults() {
        return new FitOptions(DEFAULT_TOLERANCE, true, true, 0, false);
    }

    public FitOptions withTolerance(double tolerance) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }

    public FitOptions withPreconditionCheck(boolean checkPrecondition) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }

    public FitOptions withNormalize(boolean normalize) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }

    public FitOptions withMaxIterations(int maxIterations) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }

    public FitOptions withVerbose(boolean verbose) {
        return new FitOptions(tolerance, checkPrecondition, normalize, maxIterations, verbose);
    }
}
