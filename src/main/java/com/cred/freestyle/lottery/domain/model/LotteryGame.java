package com.cred.freestyle.lottery.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Lottery game in a state's catalog.
 * A game code is unique within a state.
 *
 * @author Lottery Back Office Team
 */
@Entity
@Table(name = "lottery_games",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_lottery_games_state_game_code", columnNames = {"state_id", "game_code"})
    },
    indexes = {
        @Index(name = "idx_lottery_games_state_status", columnList = "state_id, status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotteryGame {

    @Id
    @Column(name = "game_id", nullable = false, length = 36)
    private String gameId;

    @Column(name = "state_id", nullable = false, length = 36)
    private String stateId;

    /**
     * 4-digit game code printed on tickets.
     */
    @Column(name = "game_code", nullable = false, length = 4)
    private String gameCode;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    /**
     * Ticket price.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    /**
     * Face value of a full pack.
     */
    @Column(name = "pack_value", precision = 10, scale = 2)
    private BigDecimal packValue;

    @Column(name = "tickets_per_pack")
    private Integer ticketsPerPack;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GameStatus status;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (gameId == null) {
            gameId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;

        if (status == null) {
            status = GameStatus.ACTIVE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Game lifecycle status.
     */
    public enum GameStatus {
        ACTIVE,
        INACTIVE,

        /**
         * Retired. Discontinued games are ignored by duplicate detection.
         */
        DISCONTINUED
    }
}
