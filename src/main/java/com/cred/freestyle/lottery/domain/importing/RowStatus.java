package com.cred.freestyle.lottery.domain.importing;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Validation outcome of an import row. Serialized in lowercase.
 *
 * @author Lottery Back Office Team
 */
public enum RowStatus {
    VALID("valid"),
    ERROR("error"),
    DUPLICATE("duplicate");

    private final String value;

    RowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
