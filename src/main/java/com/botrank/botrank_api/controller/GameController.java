package com.botrank.botrank_api.controller;

import com.botrank.botrank_api.controller.RankingsController.ErrorResponse;
import com.botrank.botrank_api.service.GameService;
import com.botrank.botrank_api.service.GameService.InvalidGameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/games")
@CrossOrigin(origins = "*")
public class GameController {
    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    // =========================================================================
    // POST /api/games
    // =========================================================================
    @PostMapping
    public ResponseEntity<?> recordGame(@RequestBody GameRequest request) {
        try {
            int finishers = gameService.recordGame(request.gameId(), request.finishes());
            return ResponseEntity.status(HttpStatus.CREATED).body(new GameRecorded(request.gameId(), finishers));
        } catch (InvalidGameException e) {
            log.warn("Rejected game {}: {}", request.gameId(), e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // GET /api/games/count
    // =========================================================================
    @GetMapping("/count")
    public long countGames() {
        return gameService.countGames();
    }

    // =========================================================================
    // Request/Response DTOs
    // =========================================================================
    public record GameRequest(String gameId, Map<String, Integer> finishes) {}
    public record GameRecorded(String gameId, int finishers) {}
}
