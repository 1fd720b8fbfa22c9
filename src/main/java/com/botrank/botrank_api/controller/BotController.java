package com.botrank.botrank_api.controller;

import com.botrank.botrank_api.controller.RankingsController.ErrorResponse;
import com.botrank.botrank_api.model.Bot;
import com.botrank.botrank_api.service.BotService;
import com.botrank.botrank_api.service.BotService.BotException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/bots")
@CrossOrigin(origins = "*")
public class BotController {

    private final BotService botService;

    public BotController(BotService botService) {
        this.botService = botService;
    }

    @PostMapping
    public ResponseEntity<?> register(@RequestBody BotRequest request) {
        try {
            Bot bot = botService.register(request.name(), request.path());
            return ResponseEntity.status(HttpStatus.CREATED).body(BotDTO.from(bot));
        } catch (BotException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
        }
    }

    @PostMapping("/{name}/activate")
    public ResponseEntity<BotDTO> activate(@PathVariable String name) {
        return botService.setActive(name, true)
                .map(bot -> ResponseEntity.ok(BotDTO.from(bot)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/deactivate")
    public ResponseEntity<BotDTO> deactivate(@PathVariable String name) {
        return botService.setActive(name, false)
                .map(bot -> ResponseEntity.ok(BotDTO.from(bot)))
                .orElse(ResponseEntity.notFound().build());
    }

    // =========================================================================
    // Request/Response DTOs
    // =========================================================================
    public record BotRequest(String name, String path) {}

    public record BotDTO(String name, String path, boolean active) {
        static BotDTO from(Bot bot) {
            return new BotDTO(bot.getName(), bot.getPath(), bot.isActive());
        }
    }
}
