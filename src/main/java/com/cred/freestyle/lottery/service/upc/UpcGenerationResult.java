package com.cred.freestyle.lottery.service.upc;

import java.util.Collections;
import java.util.List;

/**
 * Result of a UPC family generation.
 *
 * @author Lottery Back Office Team
 */
public class UpcGenerationResult {

    private final boolean success;
    private final List<String> upcs;
    private final Metadata metadata;
    private final String error;

    private UpcGenerationResult(boolean success, List<String> upcs, Metadata metadata, String error) {
        this.success = success;
        this.upcs = upcs;
        this.metadata = metadata;
        this.error = error;
    }

    static UpcGenerationResult success(List<String> upcs, Metadata metadata) {
        return new UpcGenerationResult(true, Collections.unmodifiableList(upcs), metadata, null);
    }

    static UpcGenerationResult failure(String error) {
        return new UpcGenerationResult(false, Collections.emptyList(), null, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<String> getUpcs() {
        return upcs;
    }

    /**
     * Generation metadata, null on failure.
     */
    public Metadata getMetadata() {
        return metadata;
    }

    public String getError() {
        return error;
    }

    /**
     * Describes a generated UPC family. First and last codes are for audit display only.
     */
    public static class Metadata {

        private final String gameCodePrefix;
        private final String packNumber;
        private final int ticketCount;
        private final int startingSerial;
        private final String firstUpc;
        private final String lastUpc;

        Metadata(String gameCodePrefix, String packNumber, int ticketCount, int startingSerial,
                 String firstUpc, String lastUpc) {
            this.gameCodePrefix = gameCodePrefix;
            this.packNumber = packNumber;
            this.ticketCount = ticketCount;
            this.startingSerial = startingSerial;
            this.firstUpc = firstUpc;
            this.lastUpc = lastUpc;
        }

        public String getGameCodePrefix() {
            return gameCodePrefix;
        }

        public String getPackNumber() {
            return packNumber;
        }

        public int getTicketCount() {
            return ticketCount;
        }

        public int getStartingSerial() {
            return startingSerial;
        }

        public String getFirstUpc() {
            return firstUpc;
        }

        public String getLastUpc() {
            return lastUpc;
        }
    }
}
