package com.botrank.botrank_api.service;

import com.botrank.botrank_api.model.Bot;
import com.botrank.botrank_api.repository.BotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Bot metadata: registration and the active flag. Deactivating a bot hides
 * it from filtered leaderboards but keeps its games in every fit.
 */
@Service
public class BotService {
    private static final Logger log = LoggerFactory.getLogger(BotService.class);

    private final BotRepository botRepository;

    public BotService(BotRepository botRepository) {
        this.botRepository = botRepository;
    }

    @Transactional
    public Bot register(String name, String path) {
        if (name == null || name.isBlank()) {
            throw new BotException("Bot name is required.");
        }
        if (name.length() > 100) {
            throw new BotException("Bot name must be 100 characters or fewer.");
        }
        if (botRepository.existsByName(name)) {
            throw new BotException("Bot " + name + " is already registered.");
        }
        Bot bot = botRepository.save(new Bot(name, path));
        log.info("Registered bot {} ({})", name, path);
        return bot;
    }

    /** @return the updated bot, or empty if no bot has that name */
    @Transactional
    public Optional<Bot> setActive(String name, boolean active) {
        Optional<Bot> bot = botRepository.findByName(name);
        bot.ifPresent(b -> {
            if (active) {
                b.activate();
            } else {
                b.deactivate();
            }
            // JPA dirty checking handles the save
            log.info("Bot {} is now {}", name, active ? "active" : "inactive");
        });
        return bot;
    }

    public static class BotException extends RuntimeException {
        public BotException(String message) {
            super(message);
        }
    }
}
