package com.cred.freestyle.lottery.repository;

import com.cred.freestyle.lottery.domain.model.LotteryGame;
import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Repository interface for LotteryGame entity.
 *
 * @author Lottery Back Office Team
 */
@Repository
public interface LotteryGameRepository extends JpaRepository<LotteryGame, String> {

    /**
     * Find the games of a state excluding one status.
     * Import validation loads the state's non-discontinued games once per file.
     *
     * @param stateId State ID
     * @param status Status to exclude
     * @return Matching games
     */
    List<LotteryGame> findByStateIdAndStatusNot(String stateId, GameStatus status);

    /**
     * Insert a game unless its game code is already taken in the state.
     * Runs inside the commit transaction; a lost race affects only this row.
     *
     * @return 1 if inserted, 0 if another game already holds the code
     */
    @Modifying
    @Query(value = """
            INSERT INTO lottery_games (game_id, state_id, game_code, name, description, price, pack_value,
                                       tickets_per_pack, status, created_by, created_at, updated_at)
            VALUES (:gameId, :stateId, :gameCode, :name, :description, :price, :packValue,
                    :ticketsPerPack, :status, :createdBy, :createdAt, :createdAt)
            ON CONFLICT (state_id, game_code) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("gameId") String gameId,
            @Param("stateId") String stateId,
            @Param("gameCode") String gameCode,
            @Param("name") String name,
            @Param("description") String description,
            @Param("price") BigDecimal price,
            @Param("packValue") BigDecimal packValue,
            @Param("ticketsPerPack") Integer ticketsPerPack,
            @Param("status") String status,
            @Param("createdBy") String createdBy,
            @Param("createdAt") Instant createdAt
    );
}
