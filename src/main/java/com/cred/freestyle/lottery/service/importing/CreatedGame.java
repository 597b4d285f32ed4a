package com.cred.freestyle.lottery.service.importing;

import java.math.BigDecimal;

/**
 * Game created by a commit.
 *
 * @author Lottery Back Office Team
 */
public class CreatedGame {

    private final String gameId;
    private final String gameCode;
    private final String name;
    private final BigDecimal price;
    private final int rowNumber;

    public CreatedGame(String gameId, String gameCode, String name, BigDecimal price, int rowNumber) {
        this.gameId = gameId;
        this.gameCode = gameCode;
        this.name = name;
        this.price = price;
        this.rowNumber = rowNumber;
    }

    public String getGameId() {
        return gameId;
    }

    public String getGameCode() {
        return gameCode;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public int getRowNumber() {
        return rowNumber;
    }
}
