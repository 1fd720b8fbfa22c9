package com.botrank.botrank_api.rating;

import java.util.Arrays;

/**
 * Bulk formulation after Hunter's plackmm.m. Contests are laid out as the
 * columns of a padded position-by-contest matrix and every step is a whole
 * row operation:
 *
 *   1. g[p][j]  = gamma of the finisher at position p of contest j (0 = padding)
 *   2. reversed cumulative sum down each column (strength still in contention)
 *   3. zero the last finisher's row of each contest (reference stage)
 *   4. element-wise reciprocal of the positive cells
 *   5. forward cumulative sum down each column
 *   6. scatter g[pos][contest] of every (competitor, contest, pos) entry
 *      into that competitor's denominator
 *
 * The working matrix is reused across iterations, so a prepared
 * computation must not be shared between threads.
 */
public class MatrixPlackettLuceFitter extends PlackettLuceFitter {

    private static final int PADDING = -1;

    @Override
    public Formulation formulation() {
        return Formulation.MATRIX;
    }

    @Override
    protected Denominators prepare(int[][] rankings, int competitors) {
        int contests = rankings.length;
        int longest = 0;
        int entries = 0;
        for (int[] ranking : rankings) {
            longest = Math.max(longest, ranking.length);
            entries += ranking.length;
        }
        int positions = longest;

        int[][] finishers = new int[positions][contests];
        for (int[] row : finishers) {
            Arrays.fill(row, PADDING);
        }
        int[] contestSize = new int[contests];
        int[] entryCompetitor = new int[entries];
        int[] entryContest = new int[entries];
        int[] entryPosition = new int[entries];

        int e = 0;
        for (int j = 0; j < contests; j++) {
            int[] ranking = rankings[j];
            contestSize[j] = ranking.length;
            for (int p = 0; p < ranking.length; p++) {
                finishers[p][j] = ranking[p];
                entryCompetitor[e] = ranking[p];
                entryContest[e] = j;
                entryPosition[e] = p;
                e++;
            }
        }

        double[][] g = new double[positions][contests];

        return gammas -> {
            for (int p = 0; p < positions; p++) {
                int[] finisherRow = finishers[p];
                double[] row = g[p];
                for (int j = 0; j < contests; j++) {
                    row[j] = finisherRow[j] == PADDING ? 0.0 : gammas[finisherRow[j]];
                }
            }

            for (int p = positions - 2; p >= 0; p--) {
                addRow(g[p], g[p + 1]);
            }

            for (int j = 0; j < contests; j++) {
                if (contestSize[j] > 0) {
                    g[contestSize[j] - 1][j] = 0.0;
                }
            }

            for (double[] row : g) {
                for (int j = 0; j < contests; j++) {
                    if (row[j] > 0) {
                        row[j] = 1.0 / row[j];
                    }
                }
            }

            for (int p = 1; p < positions; p++) {
                addRow(g[p], g[p - 1]);
            }

            double[] denominators = new double[competitors];
            for (int i = 0; i < entryCompetitor.length; i++) {
                denominators[entryCompetitor[i]] += g[entryPosition[i]][entryContest[i]];
            }
            return denominators;
        };
    }

    private static void addRow(double[] target, double[] source) {
        for (int j = 0; j < target.length; j++) {
            target[j] += source[j];
        }
    }
}
