package com.cred.freestyle.lottery.domain.importing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row that failed schema validation or repeats an earlier row's game code.
 * Keeps the raw cell values since they could not be converted.
 *
 * @author Lottery Back Office Team
 */
public class ErrorRow extends ValidatedRow {

    private Map<String, String> data = new LinkedHashMap<>();
    private List<String> errors = new ArrayList<>();

    public ErrorRow() {
    }

    public ErrorRow(int rowNumber, Map<String, String> data, List<String> errors) {
        super(rowNumber);
        this.data = new LinkedHashMap<>(data);
        this.errors = new ArrayList<>(errors);
    }

    @Override
    public RowStatus getStatus() {
        return RowStatus.ERROR;
    }

    @Override
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public RowAction getAction() {
        return null;
    }

    public Map<String, String> getData() {
        return data;
    }

    public void setData(Map<String, String> data) {
        this.data = data;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }
}
