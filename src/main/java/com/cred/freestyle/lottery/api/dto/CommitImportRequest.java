package com.cred.freestyle.lottery.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for committing a validated import.
 *
 * @author Lottery Back Office Team
 */
public class CommitImportRequest {

    @NotBlank(message = "Validation token is required")
    private String validationToken;

    @Valid
    private Options options = new Options();

    public CommitImportRequest() {
    }

    public CommitImportRequest(String validationToken, Options options) {
        this.validationToken = validationToken;
        this.options = options;
    }

    public String getValidationToken() {
        return validationToken;
    }

    public void setValidationToken(String validationToken) {
        this.validationToken = validationToken;
    }

    public Options getOptions() {
        return options;
    }

    public void setOptions(Options options) {
        this.options = options;
    }

    /**
     * Commit options. Error rows are skipped and duplicates left alone unless told otherwise.
     */
    public static class Options {

        private boolean skipErrors = true;
        private boolean updateDuplicates = false;

        public Options() {
        }

        public Options(boolean skipErrors, boolean updateDuplicates) {
            this.skipErrors = skipErrors;
            this.updateDuplicates = updateDuplicates;
        }

        public boolean isSkipErrors() {
            return skipErrors;
        }

        public void setSkipErrors(boolean skipErrors) {
            this.skipErrors = skipErrors;
        }

        public boolean isUpdateDuplicates() {
            return updateDuplicates;
        }

        public void setUpdateDuplicates(boolean updateDuplicates) {
            this.updateDuplicates = updateDuplicates;
        }
    }
}
