package com.cred.freestyle.lottery.exception;

/**
 * Base class of the import commit rejections.
 * Thrown before any change is applied, or from inside the commit transaction to roll it back.
 *
 * @author Lottery Back Office Team
 */
public abstract class LotteryImportException extends RuntimeException {

    private final ImportErrorCode errorCode;

    protected LotteryImportException(ImportErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ImportErrorCode getErrorCode() {
        return errorCode;
    }
}
