package com.cred.freestyle.lottery.service.csv;

/**
 * A file-level parse error.
 *
 * @author Lottery Back Office Team
 */
public class CsvParseError {

    private final CsvErrorType type;
    private final String message;

    public CsvParseError(CsvErrorType type, String message) {
        this.type = type;
        this.message = message;
    }

    public CsvErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
