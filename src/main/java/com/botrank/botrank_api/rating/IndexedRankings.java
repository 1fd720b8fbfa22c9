package com.botrank.botrank_api.rating;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rankings re-expressed over dense competitor indices so the fitters can
 * work on primitive arrays. Index order is first-seen order.
 */
final class IndexedRankings<T> {

    private final List<T> competitors;
    private final int[][] rankings;
    private final int[] wins;

    private IndexedRankings(List<T> competitors, int[][] rankings, int[] wins) {
        this.competitors = competitors;
        this.rankings = rankings;
        this.wins = wins;
    }

    static <T> IndexedRankings<T> of(List<List<T>> rankings) {
        List<T> competitors = new ArrayList<>(Rankings.pool(rankings));
        Map<T, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < competitors.size(); i++) {
            indexOf.put(competitors.get(i), i);
        }

        int[][] indexed = new int[rankings.size()][];
        int[] wins = new int[competitors.size()];
        for (int r = 0; r < rankings.size(); r++) {
            List<T> ranking = rankings.get(r);
            indexed[r] = new int[ranking.size()];
            for (int p = 0; p < ranking.size(); p++) {
                int index = indexOf.get(ranking.get(p));
                indexed[r][p] = index;
                // Every finisher except the last one "won" that elimination stage
                if (p < ranking.size() - 1) {
                    wins[index]++;
                }
            }
        }
        return new IndexedRankings<>(competitors, indexed, wins);
    }

    int size() {
        return competitors.size();
    }

    int[][] rankings() {
        return rankings;
    }

    int[] wins() {
        return wins;
    }

    double[] toArray(Map<T, Double> strengths) {
        double[] gammas = new double[competitors.size()];
        for (int i = 0; i < gammas.length; i++) {
            Double value = strengths.get(competitors.get(i));
            if (value == null) {
                throw new IllegalArgumentException("No strength given for competitor " + competitors.get(i));
            }
            gammas[i] = value;
        }
        return gammas;
    }

    Map<T, Double> toMap(double[] gammas) {
        Map<T, Double> strengths = new LinkedHashMap<>();
        for (int i = 0; i < gammas.length; i++) {
            strengths.put(competitors.get(i), gammas[i]);
        }
        return strengths;
    }

    List<T> competitors() {
        return competitors;
    }
}
