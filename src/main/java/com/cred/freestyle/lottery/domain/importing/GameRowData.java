package com.cred.freestyle.lottery.domain.importing;

import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Typed values of an import row that passed schema validation.
 * ticketsPerPack holds the explicit CSV value and stays null when the column was blank.
 *
 * @author Lottery Back Office Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameRowData {

    private String gameCode;
    private String name;
    private BigDecimal price;
    private String description;
    private BigDecimal packValue;
    private Integer ticketsPerPack;
    private GameStatus status;
}
