package com.botrank.botrank_api.config;

import com.botrank.botrank_api.service.GameService;
import com.botrank.botrank_api.service.ResultFileParser;
import com.botrank.botrank_api.service.ResultFileParser.ParsedGame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads game results from a text file at start-up when
 * {@code botrank.import.file} is set. Games already stored are skipped, so
 * restarting with the same file is harmless.
 */
@Component
public class ResultImporter implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ResultImporter.class);

    private final GameService gameService;
    private final ResultFileParser parser;
    private final String importFile;

    public ResultImporter(GameService gameService,
                          ResultFileParser parser,
                          @Value("${botrank.import.file:}") String importFile) {
        this.gameService = gameService;
        this.parser = parser;
        this.importFile = importFile;
    }

    @Override
    public void run(String... args) throws Exception {
        if (importFile == null || importFile.isBlank()) {
            return;
        }

        Path file = Path.of(importFile);
        log.info("Importing game results from {}", file.toAbsolutePath());
        List<ParsedGame> games = parser.parse(file);
        int imported = gameService.importGames(games);
        log.info("Import finished: {} new games, {} already present", imported, games.size() - imported);
    }
}
