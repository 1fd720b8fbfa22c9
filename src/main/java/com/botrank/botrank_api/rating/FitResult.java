package com.botrank.botrank_api.rating;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a Plackett-Luce fit.
 *
 * ILL_POSED is an expected outcome, not an error: the competitors split into
 * groups with no result linking them, so the strengths are not identifiable
 * and no iteration was attempted. Callers branch on {@link #status()}.
 *
 * @param strengths      competitor → strength in first-seen order; empty when ill-posed
 * @param componentCount strongly connected components found by the
 *                       precondition check, or 0 when the check was skipped
 */
public record FitResult<T>(
        Status status,
        Map<T, Double> strengths,
        int iterations,
        int componentCount,
        double finalDifference
) {
    public enum Status {
        CONVERGED,
        ILL_POSED,
        DID_NOT_CONVERGE
    }

    public FitResult {
        strengths = Collections.unmodifiableMap(new LinkedHashMap<>(strengths));
    }

    public static <T> FitResult<T> converged(Map<T, Double> strengths, int iterations,
                                             int componentCount, double finalDifference) {
        return new FitResult<>(Status.CONVERGED, strengths, iterations, componentCount, finalDifference);
    }

    public static <T> FitResult<T> illPosed(int componentCount) {
        return new FitResult<>(Status.ILL_POSED, Map.of(), 0, componentCount, Double.NaN);
    }

    public static <T> FitResult<T> notConverged(Map<T, Double> strengths, int iterations,
                                                int componentCount, double finalDifference) {
        return new FitResult<>(Status.DID_NOT_CONVERGE, strengths, iterations, componentCount, finalDifference);
    }

    public boolean isConverged() {
        return status == Status.CONVERGED;
    }

    public boolean isIllPosed() {
        return status == Status.ILL_POSED;
    }
}
