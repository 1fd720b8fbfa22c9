package com.botrank.botrank_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Bot metadata. Only used for presenting the leaderboard: the fit always
 * runs over every bot's results, active or not.
 */
@Getter
@Entity
@Table(name = "bots")
public class Bot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    /** Where the bot's build lives (source path or version label). */
    private String path;

    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public Bot() {}

    public Bot(String name, String path) {
        this.name = name;
        this.path = path;
    }

    public void activate() { this.active = true; }
    public void deactivate() { this.active = false; }
}
