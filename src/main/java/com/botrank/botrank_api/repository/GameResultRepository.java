package com.botrank.botrank_api.repository;

import com.botrank.botrank_api.model.GameResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface GameResultRepository extends JpaRepository<GameResult, Long> {

    /** Full history in insertion order. Grouping per game is done by GameService. */
    @Query("""
        SELECT r FROM GameResult r
        ORDER BY r.id ASC
        """)
    List<GameResult> findAllInRecordedOrder();

    boolean existsByGameId(String gameId);

    @Query("SELECT COUNT(DISTINCT r.gameId) FROM GameResult r")
    long countGames();
}
