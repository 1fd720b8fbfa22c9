package com.botrank.botrank_api.rating;

/**
 * Straightforward formulation: for every ranking, reciprocal sums of the
 * strengths still in contention at each stage, then for every finisher the
 * sum of the stages it took part in. Costs O(length^2) per ranking.
 */
public class ReferencePlackettLuceFitter extends PlackettLuceFitter {

    @Override
    public Formulation formulation() {
        return Formulation.REFERENCE;
    }

    @Override
    protected Denominators prepare(int[][] rankings, int competitors) {
        return gammas -> {
            double[] denominators = new double[competitors];
            for (int[] ranking : rankings) {
                int last = ranking.length - 1;
                if (last < 1) {
                    continue;
                }
                double[] stages = stageReciprocals(ranking, gammas);
                for (int p = 0; p <= last; p++) {
                    double sum = 0;
                    for (int q = 0; q <= Math.min(p, last - 1); q++) {
                        sum += stages[q];
                    }
                    denominators[ranking[p]] += sum;
                }
            }
            return denominators;
        };
    }

    /**
     * stages[q] = 1 / (sum of gammas finishing at position q or later), for
     * every stage but the last.
     */
    private static double[] stageReciprocals(int[] ranking, double[] gammas) {
        int last = ranking.length - 1;
        double[] stages = new double[last];
        double inContention = gammas[ranking[last]];
        for (int q = last - 1; q >= 0; q--) {
            inContention += gammas[ranking[q]];
            stages[q] = inContention > 0 ? 1.0 / inContention : 0.0;
        }
        return stages;
    }
}
