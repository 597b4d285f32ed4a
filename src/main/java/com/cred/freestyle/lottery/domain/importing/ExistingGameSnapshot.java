package com.cred.freestyle.lottery.domain.importing;

import com.cred.freestyle.lottery.domain.model.LotteryGame;
import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Values of a catalog game at validation time, kept for preview display.
 *
 * @author Lottery Back Office Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExistingGameSnapshot {

    private String gameId;
    private String name;
    private BigDecimal price;
    private GameStatus status;

    public static ExistingGameSnapshot of(LotteryGame game) {
        return new ExistingGameSnapshot(game.getGameId(), game.getName(), game.getPrice(), game.getStatus());
    }
}
