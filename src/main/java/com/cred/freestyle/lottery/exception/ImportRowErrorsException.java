package com.cred.freestyle.lottery.exception;

import com.cred.freestyle.lottery.domain.importing.ImportRowError;

import java.util.List;

/**
 * Exception thrown when a commit that does not skip errors finds rows that failed validation.
 *
 * @author Lottery Back Office Team
 */
public class ImportRowErrorsException extends LotteryImportException {

    private final String importId;
    private final List<ImportRowError> rowErrors;

    public ImportRowErrorsException(String importId, List<ImportRowError> rowErrors) {
        super(ImportErrorCode.ROW_ERRORS, String.format(
                "Import contains %d rows with errors. Fix the file or commit with skipErrors enabled.",
                rowErrors.size()));
        this.importId = importId;
        this.rowErrors = List.copyOf(rowErrors);
    }

    public String getImportId() {
        return importId;
    }

    public List<ImportRowError> getRowErrors() {
        return rowErrors;
    }
}
