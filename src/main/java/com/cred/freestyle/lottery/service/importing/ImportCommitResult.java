package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.ImportRowError;

import java.util.List;

/**
 * Outcome of a committed import.
 * success is false when any row lost a game code race; skipped error rows do not affect it.
 *
 * @author Lottery Back Office Team
 */
public class ImportCommitResult {

    private final String importId;
    private final String stateId;
    private final boolean success;
    private final CommitSummary summary;
    private final List<CreatedGame> createdGames;
    private final List<ImportRowError> errors;

    public ImportCommitResult(String importId, String stateId, boolean success, CommitSummary summary,
                              List<CreatedGame> createdGames, List<ImportRowError> errors) {
        this.importId = importId;
        this.stateId = stateId;
        this.success = success;
        this.summary = summary;
        this.createdGames = List.copyOf(createdGames);
        this.errors = List.copyOf(errors);
    }

    public String getImportId() {
        return importId;
    }

    public String getStateId() {
        return stateId;
    }

    public boolean isSuccess() {
        return success;
    }

    public CommitSummary getSummary() {
        return summary;
    }

    public List<CreatedGame> getCreatedGames() {
        return createdGames;
    }

    /**
     * Rows that failed during the commit itself.
     */
    public List<ImportRowError> getErrors() {
        return errors;
    }
}
