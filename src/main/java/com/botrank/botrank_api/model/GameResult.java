package com.botrank.botrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * One bot's finish in one game. A game with N bots is stored as N rows
 * sharing the same gameId; finish 1 is first place.
 */
@Getter
@Entity
@Table(name = "game_results",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "bot_name"}))
public class GameResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false, length = 100)
    private String gameId;

    @Column(name = "bot_name", nullable = false, length = 100)
    private String botName;

    @Column(nullable = false)
    private int finish;

    @Column(name = "field_size", nullable = false)
    private int fieldSize;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime recordedAt;

    public GameResult() {}

    public GameResult(String gameId, String botName, int finish, int fieldSize) {
        this.gameId = gameId;
        this.botName = botName;
        this.finish = finish;
        this.fieldSize = fieldSize;
    }
}
