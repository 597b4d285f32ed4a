package com.cred.freestyle.lottery.service.csv;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One data row of a parsed CSV file.
 * Row numbers are 1-based and counted after the header line.
 *
 * @author Lottery Back Office Team
 */
public class ParsedRow {

    private final int rowNumber;
    private final List<String> rawValues;
    private final Map<String, String> data;

    public ParsedRow(int rowNumber, List<String> rawValues, Map<String, String> data) {
        this.rowNumber = rowNumber;
        this.rawValues = Collections.unmodifiableList(rawValues);
        this.data = Collections.unmodifiableMap(data);
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public List<String> getRawValues() {
        return rawValues;
    }

    /**
     * Cell values keyed by normalized header.
     */
    public Map<String, String> getData() {
        return data;
    }

    /**
     * Get a cell value by normalized header.
     *
     * @param header Normalized header name
     * @return Cell value, or empty string if the column is absent
     */
    public String get(String header) {
        return data.getOrDefault(header, "");
    }
}
