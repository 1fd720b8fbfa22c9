package com.botrank.botrank_api.rating;

import com.botrank.botrank_api.rating.StronglyConnectedComponents.Edge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conversions between the stored "competitor → finish position" form of a
 * game and the ordered form the fitters work on.
 *
 * Ties are rejected upstream (see GameService); they are not handled here.
 */
public final class Rankings {

    private Rankings() {
    }

    /** Competitors ordered from first place to last place. */
    public static <T> List<T> order(Map<T, Integer> finishes) {
        List<Map.Entry<T, Integer>> entries = new ArrayList<>(finishes.entrySet());
        entries.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));

        List<T> ranking = new ArrayList<>(entries.size());
        for (Map.Entry<T, Integer> entry : entries) {
            ranking.add(entry.getKey());
        }
        return ranking;
    }

    public static <T> List<List<T>> orderAll(Collection<Map<T, Integer>> games) {
        List<List<T>> rankings = new ArrayList<>(games.size());
        for (Map<T, Integer> game : games) {
            rankings.add(order(game));
        }
        return rankings;
    }

    /**
     * One edge earlier → later for every ordered pair in every ranking (all
     * pairs, not just neighbours). Duplicates across rankings are kept; the
     * analyzer treats them as a single edge.
     */
    public static <T> List<Edge<T>> precedenceEdges(List<List<T>> rankings) {
        List<Edge<T>> edges = new ArrayList<>();
        for (List<T> ranking : rankings) {
            for (int i = 0; i < ranking.size(); i++) {
                for (int j = i + 1; j < ranking.size(); j++) {
                    edges.add(new Edge<>(ranking.get(i), ranking.get(j)));
                }
            }
        }
        return edges;
    }

    /** Every distinct competitor, in first-seen order. */
    public static <T> Set<T> pool(List<List<T>> rankings) {
        Set<T> pool = new LinkedHashSet<>();
        for (List<T> ranking : rankings) {
            pool.addAll(ranking);
        }
        return pool;
    }
}
