package com.cred.freestyle.lottery.domain.importing;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the commit phase will do with an import row. Serialized in lowercase.
 *
 * @author Lottery Back Office Team
 */
public enum RowAction {
    CREATE("create"),
    UPDATE("update"),
    SKIP("skip");

    private final String value;

    RowAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
