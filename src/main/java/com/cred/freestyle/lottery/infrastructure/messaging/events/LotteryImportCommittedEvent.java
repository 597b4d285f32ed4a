package com.cred.freestyle.lottery.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Published after a game import is committed so downstream catalogs can refresh.
 *
 * @author Lottery Back Office Team
 */
public class LotteryImportCommittedEvent {

    private String importId;
    private String stateId;
    private String userId;
    private int created;
    private int updated;
    private int skipped;
    private int failed;
    private Instant timestamp;

    public LotteryImportCommittedEvent() {
    }

    public LotteryImportCommittedEvent(String importId, String stateId, String userId,
                                       int created, int updated, int skipped, int failed) {
        this.importId = importId;
        this.stateId = stateId;
        this.userId = userId;
        this.created = created;
        this.updated = updated;
        this.skipped = skipped;
        this.failed = failed;
        this.timestamp = Instant.now();
    }

    public String getImportId() { return importId; }
    public String getStateId() { return stateId; }
    public String getUserId() { return userId; }
    public int getCreated() { return created; }
    public int getUpdated() { return updated; }
    public int getSkipped() { return skipped; }
    public int getFailed() { return failed; }
    public Instant getTimestamp() { return timestamp; }
}
