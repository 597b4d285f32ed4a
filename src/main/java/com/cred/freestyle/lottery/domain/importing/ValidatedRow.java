package com.cred.freestyle.lottery.domain.importing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Validation outcome of one import row.
 *
 * Variants, discriminated by the "status" property:
 * - valid: {@link ValidRow}, action create or update
 * - error: {@link ErrorRow}, no action, carries messages
 * - duplicate: {@link DuplicateRow}, action skip, carries the existing game
 *
 * Stored as JSON inside the pending import so commit applies exactly what was previewed.
 *
 * @author Lottery Back Office Team
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ValidRow.class, name = "valid"),
        @JsonSubTypes.Type(value = ErrorRow.class, name = "error"),
        @JsonSubTypes.Type(value = DuplicateRow.class, name = "duplicate")
})
@JsonIgnoreProperties(value = {"status"}, allowGetters = true)
public abstract class ValidatedRow {

    private int rowNumber;

    protected ValidatedRow() {
    }

    protected ValidatedRow(int rowNumber) {
        this.rowNumber = rowNumber;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public void setRowNumber(int rowNumber) {
        this.rowNumber = rowNumber;
    }

    public abstract RowStatus getStatus();

    /**
     * Derived from the status and the caller's options; null for error rows.
     */
    public abstract RowAction getAction();
}
