package com.botrank.botrank_api.repository;

import com.botrank.botrank_api.model.Bot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface BotRepository extends JpaRepository<Bot, Long> {

    Optional<Bot> findByName(String name);

    boolean existsByName(String name);
}
