package com.botrank.botrank_api.service;

import com.botrank.botrank_api.model.Bot;
import com.botrank.botrank_api.model.GameResult;
import com.botrank.botrank_api.repository.BotRepository;
import com.botrank.botrank_api.repository.GameResultRepository;
import com.botrank.botrank_api.service.ResultFileParser.ParsedGame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranking source for the fit: validates and stores completed games, and
 * hands the full history back as one "bot → finish" map per game.
 *
 * Ties and other malformed games are rejected here, before they can reach
 * the rating code.
 */
@Service
public class GameService {
    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final GameResultRepository gameResultRepository;
    private final BotRepository botRepository;

    public GameService(GameResultRepository gameResultRepository, BotRepository botRepository) {
        this.gameResultRepository = gameResultRepository;
        this.botRepository = botRepository;
    }

    // =========================================================================
    // Record
    // =========================================================================

    /**
     * Store one completed game. Bots seen for the first time are registered
     * as active with no path.
     *
     * @return number of finishers stored
     */
    @Transactional
    public int recordGame(String gameId, Map<String, Integer> finishes) {
        validate(gameId, finishes);
        if (gameResultRepository.existsByGameId(gameId)) {
            throw new InvalidGameException("Game " + gameId + " is already recorded.");
        }

        int fieldSize = finishes.size();
        List<GameResult> rows = new ArrayList<>(fieldSize);
        for (Map.Entry<String, Integer> entry : finishes.entrySet()) {
            ensureBotExists(entry.getKey());
            rows.add(new GameResult(gameId, entry.getKey(), entry.getValue(), fieldSize));
        }
        gameResultRepository.saveAll(rows);

        log.info("Recorded game {} with {} bots", gameId, fieldSize);
        return fieldSize;
    }

    /**
     * Record every game whose id is not stored yet.
     *
     * @return number of games imported
     */
    @Transactional
    public int importGames(List<ParsedGame> games) {
        int imported = 0;
        for (ParsedGame game : games) {
            if (gameResultRepository.existsByGameId(game.gameId())) {
                log.debug("Skipping game {}: already recorded", game.gameId());
                continue;
            }
            recordGame(game.gameId(), game.finishes());
            imported++;
        }
        log.info("Imported {} of {} games", imported, games.size());
        return imported;
    }

    // =========================================================================
    // Load
    // =========================================================================

    /** Every stored game as bot → finish position, in recorded order. */
    @Transactional(readOnly = true)
    public List<Map<String, Integer>> loadRankings() {
        Map<String, Map<String, Integer>> games = new LinkedHashMap<>();
        for (GameResult row : gameResultRepository.findAllInRecordedOrder()) {
            games.computeIfAbsent(row.getGameId(), k -> new LinkedHashMap<>())
                    .put(row.getBotName(), row.getFinish());
        }
        log.debug("Loaded {} games from history", games.size());
        return new ArrayList<>(games.values());
    }

    public long countGames() {
        return gameResultRepository.countGames();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void validate(String gameId, Map<String, Integer> finishes) {
        if (gameId == null || gameId.isBlank()) {
            throw new InvalidGameException("Game id is required.");
        }
        if (finishes == null || finishes.isEmpty()) {
            throw new InvalidGameException("Game " + gameId + " has no finishers.");
        }

        Set<Integer> positions = new HashSet<>();
        for (Map.Entry<String, Integer> entry : finishes.entrySet()) {
            String bot = entry.getKey();
            Integer finish = entry.getValue();
            if (bot == null || bot.isBlank()) {
                throw new InvalidGameException("Game " + gameId + " has a finisher without a name.");
            }
            if (finish == null || finish < 1) {
                throw new InvalidGameException("Bot " + bot + " has invalid finish " + finish + " in game " + gameId + ".");
            }
            if (!positions.add(finish)) {
                throw new InvalidGameException("Tie at finish " + finish + " in game " + gameId + ". Ties are not supported.");
            }
        }
    }

    private void ensureBotExists(String name) {
        if (!botRepository.existsByName(name)) {
            botRepository.save(new Bot(name, null));
            log.info("Registered new bot {}", name);
        }
    }

    // =========================================================================
    // Exception
    // =========================================================================

    public static class InvalidGameException extends RuntimeException {
        public InvalidGameException(String message) {
            super(message);
        }
    }
}
