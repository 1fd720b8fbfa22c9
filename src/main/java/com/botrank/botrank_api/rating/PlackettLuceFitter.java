package com.botrank.botrank_api.rating;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Maximum-likelihood Plackett-Luce strengths via Hunter's MM algorithm
 * (Hunter, "MM algorithms for generalized Bradley-Terry models",
 * Ann. Statist. 32 (2004), sections 5 and 6).
 *
 * Update, applied to every competitor from the same frozen previous vector:
 *
 *   gamma'[c] = wins[c] / sum over rankings containing c,
 *                         over stages q = 0 .. min(pos(c), last - 1),
 *                         of 1 / (sum of gamma at positions q..last)
 *
 * where wins[c] counts the rankings in which c did not finish last. The last
 * stage of every ranking is the reference event and contributes nothing.
 * With two entries per ranking this is the classic Bradley-Terry update
 * gamma'[i] = w[i] / sum_j n[i][j] / (gamma[i] + gamma[j]).
 *
 * Subclasses only differ in how they compute the denominators; the loop,
 * the precondition check and convergence handling live here.
 */
public abstract class PlackettLuceFitter {
    private static final Logger log = LoggerFactory.getLogger(PlackettLuceFitter.class);

    /** Denominator term of the MM update for every competitor index. */
    @FunctionalInterface
    protected interface Denominators {
        double[] compute(double[] gammas);
    }

    /**
     * Build the denominator computation for one set of rankings. Called once
     * per fit; the result is invoked once per iteration.
     *
     * @param rankings    competitor indices per ranking, first place first
     * @param competitors size of the competitor pool
     */
    protected abstract Denominators prepare(int[][] rankings, int competitors);

    public abstract Formulation formulation();

    // =========================================================================
    // Fit
    // =========================================================================

    public <T> FitResult<T> fit(List<List<T>> rankings, FitOptions options) {
        IndexedRankings<T> data = IndexedRankings.of(rankings);
        int n = data.size();
        if (n == 0) {
            return FitResult.converged(Map.of(), 0, 0, 0.0);
        }

        int components = 0;
        if (options.checkPrecondition()) {
            components = countComponents(rankings, data);
            if (components == 1) {
                logDiagnostic(options, "No disjoint sets found. Convergence conditions are met for {} competitors.", n);
            } else {
                log.warn("{} disjoint sets found among {} competitors. Strengths are not identifiable.", components, n);
                return FitResult.illPosed(components);
            }
        }

        Denominators denominators = prepare(data.rankings(), n);
        double[] gammas = new double[n];
        Arrays.fill(gammas, 1.0 / n);

        double difference = Double.POSITIVE_INFINITY;
        int iterations = 0;
        long start = System.nanoTime();
        while (difference > options.tolerance()) {
            if (options.maxIterations() > 0 && iterations >= options.maxIterations()) {
                log.warn("Stopped after {} iterations without converging (L2={}, tolerance={})",
                        iterations, difference, options.tolerance());
                return FitResult.notConverged(data.toMap(gammas), iterations, components, difference);
            }

            double[] next = advance(denominators, data.wins(), gammas, options.normalize());
            double previousDifference = difference;
            difference = distance(next, gammas);
            gammas = next;
            iterations++;

            long now = System.nanoTime();
            if (options.verbose() || log.isDebugEnabled()) {
                logDiagnostic(options, "{} {} seconds L2={}", iterations,
                        String.format("%.2f", (now - start) / 1e9), String.format("%.2e", difference));
            }
            if (difference > previousDifference) {
                log.warn("Gamma difference increased at iteration {}: {} > {}",
                        iterations, difference, previousDifference);
            }
            start = now;
        }

        log.debug("{} formulation converged in {} iterations for {} competitors",
                formulation(), iterations, n);
        return FitResult.converged(data.toMap(gammas), iterations, components, difference);
    }

    public <T> FitResult<T> fit(List<List<T>> rankings) {
        return fit(rankings, FitOptions.defaults());
    }

    /**
     * One MM update starting from the given strengths. Every competitor in
     * the rankings must have an entry.
     */
    public <T> Map<T, Double> step(List<List<T>> rankings, Map<T, Double> strengths, boolean normalize) {
        IndexedRankings<T> data = IndexedRankings.of(rankings);
        double[] gammas = data.toArray(strengths);
        double[] next = advance(prepare(data.rankings(), data.size()), data.wins(), gammas, normalize);
        return data.toMap(next);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Next strength vector, built as a new array from the frozen previous one.
     * A competitor with a zero denominator only appears in single-entry
     * rankings and keeps its previous value.
     */
    private static double[] advance(Denominators denominators, int[] wins, double[] gammas, boolean normalize) {
        double[] terms = denominators.compute(gammas);
        double[] next = new double[gammas.length];
        for (int i = 0; i < next.length; i++) {
            next[i] = terms[i] > 0 ? wins[i] / terms[i] : gammas[i];
        }
        if (normalize) {
            double total = 0;
            for (double gamma : next) {
                total += gamma;
            }
            if (total > 0) {
                for (int i = 0; i < next.length; i++) {
                    next[i] /= total;
                }
            }
        }
        return next;
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Components of the precedence graph. Competitors that never share a
     * ranking with anyone have no edges and count as components of their own.
     */
    private static <T> int countComponents(List<List<T>> rankings, IndexedRankings<T> data) {
        Map<T, T> roots = StronglyConnectedComponents.analyze(Rankings.precedenceEdges(rankings));
        int components = StronglyConnectedComponents.countComponents(roots);
        for (T competitor : data.competitors()) {
            if (!roots.containsKey(competitor)) {
                components++;
            }
        }
        return components;
    }

    private static void logDiagnostic(FitOptions options, String format, Object... args) {
        if (options.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
