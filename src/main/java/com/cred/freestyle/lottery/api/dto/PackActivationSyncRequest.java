package com.cred.freestyle.lottery.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;

/**
 * Request DTO for a manual pack activation sync.
 *
 * @author Lottery Back Office Team
 */
public class PackActivationSyncRequest {

    @NotBlank(message = "Store ID is required")
    private String storeId;

    @NotBlank(message = "Pack number is required")
    @Pattern(regexp = "\\d{7}", message = "Pack number must be exactly 7 digits")
    private String packNumber;

    @NotBlank(message = "Game code is required")
    @Pattern(regexp = "\\d{4}", message = "Game code must be exactly 4 digits")
    private String gameCode;

    @NotBlank(message = "Game name is required")
    private String gameName;

    @NotNull(message = "Tickets per pack is required")
    @Min(value = 1, message = "Tickets per pack must be at least 1")
    @Max(value = 999, message = "Tickets per pack must be at most 999")
    private Integer ticketsPerPack;

    @NotNull(message = "Ticket price is required")
    @DecimalMin(value = "0.01", message = "Ticket price must be greater than 0")
    private BigDecimal ticketPrice;

    @Min(value = 0, message = "Starting serial cannot be negative")
    private Integer startingSerial;

    public PackActivationSyncRequest() {
    }

    public String getStoreId() {
        return storeId;
    }

    public void setStoreId(String storeId) {
        this.storeId = storeId;
    }

    public String getPackNumber() {
        return packNumber;
    }

    public void setPackNumber(String packNumber) {
        this.packNumber = packNumber;
    }

    public String getGameCode() {
        return gameCode;
    }

    public void setGameCode(String gameCode) {
        this.gameCode = gameCode;
    }

    public String getGameName() {
        return gameName;
    }

    public void setGameName(String gameName) {
        this.gameName = gameName;
    }

    public Integer getTicketsPerPack() {
        return ticketsPerPack;
    }

    public void setTicketsPerPack(Integer ticketsPerPack) {
        this.ticketsPerPack = ticketsPerPack;
    }

    public BigDecimal getTicketPrice() {
        return ticketPrice;
    }

    public void setTicketPrice(BigDecimal ticketPrice) {
        this.ticketPrice = ticketPrice;
    }

    public Integer getStartingSerial() {
        return startingSerial;
    }

    public void setStartingSerial(Integer startingSerial) {
        this.startingSerial = startingSerial;
    }
}
