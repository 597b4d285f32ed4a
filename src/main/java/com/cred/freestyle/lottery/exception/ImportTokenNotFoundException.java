package com.cred.freestyle.lottery.exception;

/**
 * Exception thrown when a validation token does not match any pending import.
 *
 * @author Lottery Back Office Team
 */
public class ImportTokenNotFoundException extends LotteryImportException {

    private final String validationToken;

    public ImportTokenNotFoundException(String validationToken) {
        super(ImportErrorCode.TOKEN_NOT_FOUND, "Invalid validation token");
        this.validationToken = validationToken;
    }

    public String getValidationToken() {
        return validationToken;
    }
}
