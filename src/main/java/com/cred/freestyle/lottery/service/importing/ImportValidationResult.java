package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.ValidatedRow;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Preview of a validated import file.
 * A validation token is issued only when at least one row is valid.
 *
 * @author Lottery Back Office Team
 */
public class ImportValidationResult {

    private final boolean success;
    private final String validationToken;
    private final Instant expiresAt;
    private final ImportPreview preview;
    private final List<ValidatedRow> rows;
    private final List<String> errors;
    private final List<String> warnings;

    private ImportValidationResult(boolean success, String validationToken, Instant expiresAt,
                                   ImportPreview preview, List<ValidatedRow> rows,
                                   List<String> errors, List<String> warnings) {
        this.success = success;
        this.validationToken = validationToken;
        this.expiresAt = expiresAt;
        this.preview = preview;
        this.rows = rows;
        this.errors = errors;
        this.warnings = warnings;
    }

    public static ImportValidationResult accepted(String validationToken, Instant expiresAt, ImportPreview preview,
                                                  List<ValidatedRow> rows, List<String> warnings) {
        return new ImportValidationResult(true, validationToken, expiresAt, preview, rows,
                Collections.emptyList(), warnings);
    }

    public static ImportValidationResult rejected(ImportPreview preview, List<ValidatedRow> rows,
                                                  List<String> errors, List<String> warnings) {
        return new ImportValidationResult(false, null, null, preview, rows, errors, warnings);
    }

    public static ImportValidationResult rejected(String error) {
        return rejected(ImportPreview.empty(), Collections.emptyList(), List.of(error), Collections.emptyList());
    }

    public boolean isSuccess() {
        return success;
    }

    public String getValidationToken() {
        return validationToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public ImportPreview getPreview() {
        return preview;
    }

    public List<ValidatedRow> getRows() {
        return rows;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Parser warnings such as a removed byte order mark or dropped rows.
     */
    public List<String> getWarnings() {
        return warnings;
    }
}
