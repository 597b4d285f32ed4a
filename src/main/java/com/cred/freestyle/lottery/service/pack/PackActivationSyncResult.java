package com.cred.freestyle.lottery.service.pack;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a pack activation sync.
 * success reflects UPC generation only; cache and POS outcomes are reported by their flags.
 *
 * @author Lottery Back Office Team
 */
public class PackActivationSyncResult {

    private final boolean success;
    private final int upcCount;
    private final boolean redisStored;
    private final boolean posExported;
    private final String error;
    private final Details details;

    public PackActivationSyncResult(boolean success, int upcCount, boolean redisStored, boolean posExported,
                             String error, Details details) {
        this.success = success;
        this.upcCount = upcCount;
        this.redisStored = redisStored;
        this.posExported = posExported;
        this.error = error;
        this.details = details;
    }

    public static PackActivationSyncResult generationFailed(String error) {
        return new PackActivationSyncResult(false, 0, false, false, error, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getUpcCount() {
        return upcCount;
    }

    public boolean isRedisStored() {
        return redisStored;
    }

    public boolean isPosExported() {
        return posExported;
    }

    /**
     * Generation error, or the failed side channel's message.
     */
    public String getError() {
        return error;
    }

    public Details getDetails() {
        return details;
    }

    public static class Details {

        private final List<String> upcs;
        private final String firstUpc;
        private final String lastUpc;
        private final String exportFile;

        public Details(List<String> upcs, String firstUpc, String lastUpc, String exportFile) {
            this.upcs = upcs == null ? Collections.emptyList() : upcs;
            this.firstUpc = firstUpc;
            this.lastUpc = lastUpc;
            this.exportFile = exportFile;
        }

        public List<String> getUpcs() {
            return upcs;
        }

        public String getFirstUpc() {
            return firstUpc;
        }

        public String getLastUpc() {
            return lastUpc;
        }

        public String getExportFile() {
            return exportFile;
        }
    }
}
