package com.cred.freestyle.lottery.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * US state that scopes a lottery game catalog. Maintained outside this service.
 *
 * @author Lottery Back Office Team
 */
@Entity
@Table(name = "us_states")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsState {

    @Id
    @Column(name = "state_id", nullable = false, length = 36)
    private String stateId;

    /**
     * Two-letter postal code.
     */
    @Column(name = "code", nullable = false, length = 2, unique = true)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "lottery_enabled", nullable = false)
    private boolean lotteryEnabled;
}
