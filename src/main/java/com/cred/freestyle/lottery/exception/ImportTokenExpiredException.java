package com.cred.freestyle.lottery.exception;

import java.time.Instant;

/**
 * Exception thrown when a validation token is used after its expiry.
 * Tokens are valid for 15 minutes unless configured otherwise.
 *
 * @author Lottery Back Office Team
 */
public class ImportTokenExpiredException extends LotteryImportException {

    private final String importId;
    private final Instant expiresAt;

    public ImportTokenExpiredException(String importId, Instant expiresAt) {
        super(ImportErrorCode.EXPIRED_TOKEN, String.format(
                "Validation token expired at %s. Please re-upload and validate the file.", expiresAt));
        this.importId = importId;
        this.expiresAt = expiresAt;
    }

    public String getImportId() {
        return importId;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
