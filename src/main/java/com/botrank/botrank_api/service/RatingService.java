package com.botrank.botrank_api.service;

import com.botrank.botrank_api.model.Bot;
import com.botrank.botrank_api.rating.FitOptions;
import com.botrank.botrank_api.rating.FitResult;
import com.botrank.botrank_api.rating.PlackettLuceFitter;
import com.botrank.botrank_api.rating.Rankings;
import com.botrank.botrank_api.repository.BotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch Plackett-Luce ratings over the full game history.
 *
 * Flow:
 * 1. Load every stored game and order each one by finish position.
 * 2. Fit strengths with the configured formulation and options.
 * 3. Optionally drop inactive bots from the output and renormalize the
 *    remaining strengths so they sum to 1. Inactive bots still take part
 *    in step 2, so hiding them never changes anyone else's fitted value.
 * 4. Sort by strength, strongest first.
 */
@Service
public class RatingService {
    private static final Logger log = LoggerFactory.getLogger(RatingService.class);

    private final GameService gameService;
    private final BotRepository botRepository;
    private final PlackettLuceFitter fitter;
    private final FitOptions fitOptions;

    public RatingService(GameService gameService,
                         BotRepository botRepository,
                         PlackettLuceFitter fitter,
                         FitOptions fitOptions) {
        this.gameService = gameService;
        this.botRepository = botRepository;
        this.fitter = fitter;
        this.fitOptions = fitOptions;
    }

    public Leaderboard computeLeaderboard(boolean excludeInactive) {
        List<List<String>> rankings = Rankings.orderAll(gameService.loadRankings());
        log.info("Fitting {} games with the {} formulation", rankings.size(), fitter.formulation());

        FitResult<String> result = fitter.fit(rankings, fitOptions);
        if (result.isIllPosed()) {
            log.warn("Cannot rank bots: {} groups have no results linking them", result.componentCount());
            return new Leaderboard(result.status(), result.iterations(), result.componentCount(), List.of());
        }

        Map<String, Bot> bots = new HashMap<>();
        for (Bot bot : botRepository.findAll()) {
            bots.put(bot.getName(), bot);
        }

        List<Map.Entry<String, Double>> included = new ArrayList<>();
        double normalizingConstant = 0;
        for (Map.Entry<String, Double> entry : result.strengths().entrySet()) {
            if (!excludeInactive || isActive(bots.get(entry.getKey()))) {
                included.add(entry);
                normalizingConstant += entry.getValue();
            }
        }

        included.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<String, Double>comparingByKey()));

        List<RankedBot> ranked = new ArrayList<>(included.size());
        for (int i = 0; i < included.size(); i++) {
            Map.Entry<String, Double> entry = included.get(i);
            Bot bot = bots.get(entry.getKey());
            double strength = normalizingConstant > 0 ? entry.getValue() / normalizingConstant : entry.getValue();
            ranked.add(new RankedBot(
                    i + 1,
                    entry.getKey(),
                    strength,
                    isActive(bot),
                    bot != null ? bot.getPath() : null
            ));
        }

        return new Leaderboard(result.status(), result.iterations(), result.componentCount(), ranked);
    }

    /** Bots with results but no metadata row count as active. */
    private static boolean isActive(Bot bot) {
        return bot == null || bot.isActive();
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record Leaderboard(
            FitResult.Status status,
            int iterations,
            int componentCount,
            List<RankedBot> bots
    ) {}

    public record RankedBot(int rank, String name, double strength, boolean active, String path) {}
}
