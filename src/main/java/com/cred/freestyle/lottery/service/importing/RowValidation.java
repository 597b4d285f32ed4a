package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.GameRowData;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating one CSV row against the game schema.
 *
 * @author Lottery Back Office Team
 */
public class RowValidation {

    private final GameRowData data;
    private final List<String> errors;

    private RowValidation(GameRowData data, List<String> errors) {
        this.data = data;
        this.errors = errors;
    }

    static RowValidation valid(GameRowData data) {
        return new RowValidation(data, Collections.emptyList());
    }

    static RowValidation invalid(List<String> errors) {
        return new RowValidation(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Typed row values, null when the row is invalid.
     */
    public GameRowData getData() {
        return data;
    }

    public List<String> getErrors() {
        return errors;
    }
}
