package com.botrank.botrank_api;

import com.botrank.botrank_api.controller.BotController;
import com.botrank.botrank_api.controller.BotController.BotDTO;
import com.botrank.botrank_api.controller.BotController.BotRequest;
import com.botrank.botrank_api.controller.GameController;
import com.botrank.botrank_api.controller.GameController.GameRecorded;
import com.botrank.botrank_api.controller.GameController.GameRequest;
import com.botrank.botrank_api.controller.RankingsController;
import com.botrank.botrank_api.controller.RankingsController.ErrorResponse;
import com.botrank.botrank_api.controller.RankingsController.RankingsResponse;
import com.botrank.botrank_api.rating.FitResult;
import com.botrank.botrank_api.service.BotService;
import com.botrank.botrank_api.service.BotService.BotException;
import com.botrank.botrank_api.service.GameService;
import com.botrank.botrank_api.service.GameService.InvalidGameException;
import com.botrank.botrank_api.service.RatingService;
import com.botrank.botrank_api.service.RatingService.Leaderboard;
import com.botrank.botrank_api.service.RatingService.RankedBot;
import com.botrank.util.TestFixtures;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Controller logic in isolation: status mapping and paging.
 * No HTTP, no DB.
 *
 * Run: mvn test -Dtest="*UnitTest"
 */
@ExtendWith(MockitoExtension.class)
class RankingsControllerUnitTest {

    @Mock private RatingService ratingService;
    @Mock private GameService gameService;
    @Mock private BotService botService;

    private RankingsController rankingsController;
    private GameController gameController;
    private BotController botController;

    @BeforeEach
    void setUp() {
        rankingsController = new RankingsController(ratingService, gameService);
        gameController = new GameController(gameService);
        botController = new BotController(botService);
    }

    private static List<RankedBot> rankedBots(int count) {
        List<RankedBot> bots = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bots.add(new RankedBot(i + 1, "bot" + i, 1.0 / count, true, null));
        }
        return bots;
    }

    // =========================================================================
    // GET /api/rankings
    // =========================================================================

    @Nested
    @DisplayName("GET /api/rankings")
    class GetRankings {

        @Test
        @DisplayName("illPosed_returns409WithComponentCount")
        void illPosed_returns409WithComponentCount() {
            when(ratingService.computeLeaderboard(false))
                    .thenReturn(new Leaderboard(FitResult.Status.ILL_POSED, 0, 3, List.of()));

            ResponseEntity<?> response = rankingsController.getRankings(false, 50);

            assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
            ErrorResponse body = (ErrorResponse) response.getBody();
            assertNotNull(body);
            assertTrue(body.error().contains("3 groups"));
            verifyNoInteractions(gameService);
        }

        @Test
        @DisplayName("didNotConverge_returns500")
        void didNotConverge_returns500() {
            when(ratingService.computeLeaderboard(false))
                    .thenReturn(new Leaderboard(FitResult.Status.DID_NOT_CONVERGE, 100, 1, rankedBots(3)));

            ResponseEntity<?> response = rankingsController.getRankings(false, 50);

            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
            assertInstanceOf(ErrorResponse.class, response.getBody());
        }

        @Test
        @DisplayName("converged_returnsPageAndTotals")
        void converged_returnsPageAndTotals() {
            when(ratingService.computeLeaderboard(true))
                    .thenReturn(new Leaderboard(FitResult.Status.CONVERGED, 42, 1, rankedBots(10)));
            when(gameService.countGames()).thenReturn(25L);

            ResponseEntity<?> response = rankingsController.getRankings(true, 4);

            assertEquals(HttpStatus.OK, response.getStatusCode());
            RankingsResponse body = (RankingsResponse) response.getBody();
            assertNotNull(body);
            assertEquals(4, body.bots().size());
            assertEquals(10, body.totalRankedBots());
            assertEquals(25L, body.gamesPlayed());
            assertEquals(42, body.iterations());
            assertEquals("bot0", body.bots().get(0).name());
        }

        @Test
        @DisplayName("limit_isClampedToAtLeastOne")
        void limit_isClampedToAtLeastOne() {
            when(ratingService.computeLeaderboard(false))
                    .thenReturn(new Leaderboard(FitResult.Status.CONVERGED, 5, 1, rankedBots(3)));
            when(gameService.countGames()).thenReturn(2L);

            RankingsResponse body = (RankingsResponse) rankingsController.getRankings(false, 0).getBody();

            assertNotNull(body);
            assertEquals(1, body.bots().size());
        }
    }

    // =========================================================================
    // POST /api/games
    // =========================================================================

    @Nested
    @DisplayName("POST /api/games")
    class PostGame {

        @Test
        @DisplayName("validGame_returns201")
        void validGame_returns201() {
            Map<String, Integer> finishes = TestFixtures.finishes("alpha", "beta");
            when(gameService.recordGame("g1", finishes)).thenReturn(2);

            ResponseEntity<?> response = gameController.recordGame(new GameRequest("g1", finishes));

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertEquals(new GameRecorded("g1", 2), response.getBody());
        }

        @Test
        @DisplayName("invalidGame_returns400WithReason")
        void invalidGame_returns400WithReason() {
            when(gameService.recordGame(eq("g1"), anyMap()))
                    .thenThrow(new InvalidGameException("Tie at finish 1 in game g1. Ties are not supported."));

            ResponseEntity<?> response = gameController.recordGame(
                    new GameRequest("g1", Map.of("alpha", 1, "beta", 1)));

            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertTrue(((ErrorResponse) response.getBody()).error().startsWith("Tie"));
        }
    }

    // =========================================================================
    // /api/bots
    // =========================================================================

    @Nested
    @DisplayName("/api/bots")
    class Bots {

        @Test
        @DisplayName("register_returns201")
        void register_returns201() {
            when(botService.register("alpha", "bots/alpha")).thenReturn(TestFixtures.buildBot("alpha"));

            ResponseEntity<?> response = botController.register(new BotRequest("alpha", "bots/alpha"));

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertEquals(new BotDTO("alpha", "bots/alpha", true), response.getBody());
        }

        @Test
        @DisplayName("registerDuplicate_returns409")
        void registerDuplicate_returns409() {
            when(botService.register("alpha", null)).thenThrow(new BotException("Bot alpha is already registered."));

            ResponseEntity<?> response = botController.register(new BotRequest("alpha", null));

            assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        }

        @Test
        @DisplayName("deactivateUnknownBot_returns404")
        void deactivateUnknownBot_returns404() {
            when(botService.setActive("ghost", false)).thenReturn(Optional.empty());

            assertEquals(HttpStatus.NOT_FOUND, botController.deactivate("ghost").getStatusCode());
        }

        @Test
        @DisplayName("deactivate_returnsUpdatedBot")
        void deactivate_returnsUpdatedBot() {
            when(botService.setActive("alpha", false))
                    .thenReturn(Optional.of(TestFixtures.buildBot("alpha", "bots/alpha", false)));

            ResponseEntity<BotDTO> response = botController.deactivate("alpha");

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertFalse(response.getBody().active());
        }
    }
}
