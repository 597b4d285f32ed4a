package com.cred.freestyle.lottery.service.pack;

/**
 * Outcome of a pack deactivation sync.
 *
 * @author Lottery Back Office Team
 */
public class PackDeactivationSyncResult {

    private final boolean success;
    private final boolean redisDeleted;
    private final boolean posRemoved;
    private final String error;

    public PackDeactivationSyncResult(boolean success, boolean redisDeleted, boolean posRemoved, String error) {
        this.success = success;
        this.redisDeleted = redisDeleted;
        this.posRemoved = posRemoved;
        this.error = error;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isRedisDeleted() {
        return redisDeleted;
    }

    public boolean isPosRemoved() {
        return posRemoved;
    }

    public String getError() {
        return error;
    }
}
