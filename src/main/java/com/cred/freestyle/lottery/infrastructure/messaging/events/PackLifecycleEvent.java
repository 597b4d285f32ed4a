package com.cred.freestyle.lottery.infrastructure.messaging.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Pack status change published by store operations.
 *
 * Event Types:
 * - ACTIVATED: Pack placed in a bin (generate UPCs, push them to the POS)
 * - DEACTIVATED: Pack sold out or returned (remove its UPCs from the POS)
 *
 * Only ACTIVATED events need the game and pack fields.
 *
 * @author Lottery Back Office Team
 */
public class PackLifecycleEvent {

    private EventType eventType;
    private String packId;
    private String storeId;
    private String packNumber;
    private String gameCode;
    private String gameName;
    private Integer ticketsPerPack;
    private BigDecimal ticketPrice;
    private Integer startingSerial;
    private String userId;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public PackLifecycleEvent() {
    }

    public PackLifecycleEvent(EventType eventType, String packId, String storeId) {
        this.eventType = eventType;
        this.packId = packId;
        this.storeId = storeId;
        this.timestamp = Instant.now();
    }

    // Getters and setters
    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getPackId() {
        return packId;
    }

    public void setPackId(String packId) {
        this.packId = packId;
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

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "PackLifecycleEvent{" +
                "eventType=" + eventType +
                ", packId='" + packId + '\'' +
                ", storeId='" + storeId + '\'' +
                ", packNumber='" + packNumber + '\'' +
                ", gameCode='" + gameCode + '\'' +
                '}';
    }

    /**
     * Pack lifecycle event types.
     */
    public enum EventType {
        ACTIVATED,
        DEACTIVATED
    }
}
