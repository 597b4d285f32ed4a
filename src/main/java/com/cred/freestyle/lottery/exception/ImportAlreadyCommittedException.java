package com.cred.freestyle.lottery.exception;

/**
 * Exception thrown when a pending import has already been committed.
 * Validation tokens are single use.
 *
 * @author Lottery Back Office Team
 */
public class ImportAlreadyCommittedException extends LotteryImportException {

    private final String importId;

    public ImportAlreadyCommittedException(String importId) {
        super(ImportErrorCode.ALREADY_COMMITTED, "This import has already been committed");
        this.importId = importId;
    }

    public String getImportId() {
        return importId;
    }
}
