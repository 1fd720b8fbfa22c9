package com.botrank.botrank_api.controller;

import com.botrank.botrank_api.service.GameService;
import com.botrank.botrank_api.service.RatingService;
import com.botrank.botrank_api.service.RatingService.Leaderboard;
import com.botrank.botrank_api.service.RatingService.RankedBot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class RankingsController {

    private final RatingService ratingService;
    private final GameService gameService;

    public RankingsController(RatingService ratingService, GameService gameService) {
        this.ratingService = ratingService;
        this.gameService = gameService;
    }

    // =========================================================================
    // Leaderboard (Plackett-Luce strengths over the full history)
    // =========================================================================

    /**
     * GET /api/rankings?excludeInactive=false&limit=50
     *
     * Inactive bots are only hidden from the response; they are always part
     * of the fit.
     */
    @GetMapping("/rankings")
    public ResponseEntity<?> getRankings(
            @RequestParam(defaultValue = "false") boolean excludeInactive,
            @RequestParam(defaultValue = "50") int limit) {

        limit = Math.max(1, Math.min(limit, 500));
        Leaderboard leaderboard = ratingService.computeLeaderboard(excludeInactive);

        return switch (leaderboard.status()) {
            case ILL_POSED -> ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(
                    "Insufficient data to compare all bots: " + leaderboard.componentCount()
                            + " groups have no results linking them."));
            case DID_NOT_CONVERGE -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                    "Ratings did not converge after " + leaderboard.iterations() + " iterations."));
            case CONVERGED -> {
                List<RankedBot> bots = leaderboard.bots();
                List<RankedBot> page = bots.subList(0, Math.min(limit, bots.size()));
                yield ResponseEntity.ok(new RankingsResponse(
                        page, bots.size(), gameService.countGames(), leaderboard.iterations()));
            }
        };
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RankingsResponse(
            List<RankedBot> bots,
            int totalRankedBots,
            long gamesPlayed,
            int iterations     // MM iterations the fit needed
    ) {}

    public record ErrorResponse(String error) {}
}
