package com.cred.freestyle.lottery.service.upc;

/**
 * Components of a lottery ticket UPC.
 *
 * @author Lottery Back Office Team
 */
public class ParsedUpc {

    private final String gameCodePrefix;
    private final String packNumber;
    private final int ticketSerial;
    private final int checkDigit;

    public ParsedUpc(String gameCodePrefix, String packNumber, int ticketSerial, int checkDigit) {
        this.gameCodePrefix = gameCodePrefix;
        this.packNumber = packNumber;
        this.ticketSerial = ticketSerial;
        this.checkDigit = checkDigit;
    }

    public String getGameCodePrefix() {
        return gameCodePrefix;
    }

    public String getPackNumber() {
        return packNumber;
    }

    public int getTicketSerial() {
        return ticketSerial;
    }

    public int getCheckDigit() {
        return checkDigit;
    }
}
