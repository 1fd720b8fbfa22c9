package com.botrank.botrank_api.service;

import com.botrank.botrank_api.model.Bot;
import com.botrank.botrank_api.model.GameResult;
import com.botrank.botrank_api.repository.BotRepository;
import com.botrank.botrank_api.repository.GameResultRepository;
import com.botrank.botrank_api.service.GameService.InvalidGameException;
import com.botrank.botrank_api.service.ResultFileParser.ParsedGame;
import com.botrank.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    @Mock private GameResultRepository gameResultRepository;
    @Mock private BotRepository botRepository;

    @Captor private ArgumentCaptor<Iterable<GameResult>> rowsCaptor;

    private GameService gameService;

    @BeforeEach
    void setUp() {
        gameService = new GameService(gameResultRepository, botRepository);
    }

    private static List<GameResult> captured(Iterable<GameResult> rows) {
        List<GameResult> list = new ArrayList<>();
        rows.forEach(list::add);
        return list;
    }

    // =========================================================================
    // Recording
    // =========================================================================

    @Nested
    @DisplayName("Record game")
    class Record {

        @Test
        @DisplayName("validGame_storesOneRowPerFinisher")
        void validGame_storesOneRowPerFinisher() {
            when(gameResultRepository.existsByGameId("g1")).thenReturn(false);
            when(botRepository.existsByName(anyString())).thenReturn(true);

            int stored = gameService.recordGame("g1", TestFixtures.finishes("alpha", "beta", "gamma"));

            assertEquals(3, stored);
            verify(gameResultRepository).saveAll(rowsCaptor.capture());
            List<GameResult> rows = captured(rowsCaptor.getValue());
            assertEquals(3, rows.size());
            assertEquals("alpha", rows.get(0).getBotName());
            assertEquals(1, rows.get(0).getFinish());
            assertEquals("gamma", rows.get(2).getBotName());
            assertEquals(3, rows.get(2).getFinish());
            assertTrue(rows.stream().allMatch(r -> r.getFieldSize() == 3 && r.getGameId().equals("g1")));
            verify(botRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknownBot_isRegisteredAsActive")
        void unknownBot_isRegisteredAsActive() {
            when(gameResultRepository.existsByGameId("g1")).thenReturn(false);
            when(botRepository.existsByName("alpha")).thenReturn(true);
            when(botRepository.existsByName("rookie")).thenReturn(false);

            gameService.recordGame("g1", TestFixtures.finishes("alpha", "rookie"));

            ArgumentCaptor<Bot> botCaptor = ArgumentCaptor.forClass(Bot.class);
            verify(botRepository).save(botCaptor.capture());
            assertEquals("rookie", botCaptor.getValue().getName());
            assertTrue(botCaptor.getValue().isActive());
            assertNull(botCaptor.getValue().getPath());
        }

        @Test
        @DisplayName("gapsInFinishPositions_areAccepted")
        void gapsInFinishPositions_areAccepted() {
            when(gameResultRepository.existsByGameId("g1")).thenReturn(false);
            when(botRepository.existsByName(anyString())).thenReturn(true);

            assertEquals(2, gameService.recordGame("g1", Map.of("alpha", 2, "beta", 5)));
        }

        @Test
        @DisplayName("duplicateGameId_isRejected")
        void duplicateGameId_isRejected() {
            when(gameResultRepository.existsByGameId("g1")).thenReturn(true);

            InvalidGameException e = assertThrows(InvalidGameException.class,
                    () -> gameService.recordGame("g1", TestFixtures.finishes("alpha", "beta")));

            assertTrue(e.getMessage().contains("already recorded"));
            verify(gameResultRepository, never()).saveAll(any());
        }

        @Test
        @DisplayName("tie_isRejectedBeforeTouchingTheDatabase")
        void tie_isRejectedBeforeTouchingTheDatabase() {
            Map<String, Integer> finishes = new LinkedHashMap<>();
            finishes.put("alpha", 1);
            finishes.put("beta", 1);

            InvalidGameException e = assertThrows(InvalidGameException.class,
                    () -> gameService.recordGame("g1", finishes));

            assertTrue(e.getMessage().contains("Tie"));
            verifyNoInteractions(gameResultRepository, botRepository);
        }

        @Test
        @DisplayName("malformedGames_areRejected")
        void malformedGames_areRejected() {
            Map<String, Integer> nullFinish = new HashMap<>();
            nullFinish.put("alpha", null);

            assertThrows(InvalidGameException.class, () -> gameService.recordGame(" ", TestFixtures.finishes("a")));
            assertThrows(InvalidGameException.class, () -> gameService.recordGame("g1", Map.of()));
            assertThrows(InvalidGameException.class, () -> gameService.recordGame("g1", null));
            assertThrows(InvalidGameException.class, () -> gameService.recordGame("g1", Map.of("alpha", 0)));
            assertThrows(InvalidGameException.class, () -> gameService.recordGame("g1", Map.of(" ", 1)));
            assertThrows(InvalidGameException.class, () -> gameService.recordGame("g1", nullFinish));
            verifyNoInteractions(gameResultRepository, botRepository);
        }
    }

    // =========================================================================
    // Import
    // =========================================================================

    @Nested
    @DisplayName("Import games")
    class Import {

        @Test
        @DisplayName("existingGames_areSkipped")
        void existingGames_areSkipped() {
            when(gameResultRepository.existsByGameId("1")).thenReturn(true);
            when(gameResultRepository.existsByGameId("2")).thenReturn(false);
            when(botRepository.existsByName(anyString())).thenReturn(true);

            int imported = gameService.importGames(List.of(
                    new ParsedGame("1", TestFixtures.finishes("alpha", "beta")),
                    new ParsedGame("2", TestFixtures.finishes("beta", "alpha"))));

            assertEquals(1, imported);
            verify(gameResultRepository, times(1)).saveAll(any());
        }
    }

    // =========================================================================
    // Load
    // =========================================================================

    @Nested
    @DisplayName("Load rankings")
    class Load {

        @Test
        @DisplayName("rowsAreGroupedPerGame_inRecordedOrder")
        void rowsAreGroupedPerGame_inRecordedOrder() {
            List<GameResult> rows = new ArrayList<>();
            rows.addAll(TestFixtures.buildRows("g1", "alpha", "beta", "gamma"));
            rows.addAll(TestFixtures.buildRows("g2", "gamma", "alpha"));
            when(gameResultRepository.findAllInRecordedOrder()).thenReturn(rows);

            List<Map<String, Integer>> games = gameService.loadRankings();

            assertEquals(2, games.size());
            assertEquals(TestFixtures.finishes("alpha", "beta", "gamma"), games.get(0));
            assertEquals(TestFixtures.finishes("gamma", "alpha"), games.get(1));
        }

        @Test
        @DisplayName("emptyHistory_loadsNothing")
        void emptyHistory_loadsNothing() {
            when(gameResultRepository.findAllInRecordedOrder()).thenReturn(List.of());

            assertTrue(gameService.loadRankings().isEmpty());
        }
    }
}
