package com.cred.freestyle.lottery.service.csv;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a CSV parse. Immutable once returned.
 *
 * @author Lottery Back Office Team
 */
public class CsvParseResult {

    private final Character delimiter;
    private final List<String> originalHeaders;
    private final Map<String, String> headerMapping;
    private final List<ParsedRow> rows;
    private final List<CsvParseError> errors;
    private final List<String> warnings;

    CsvParseResult(
            Character delimiter,
            List<String> originalHeaders,
            Map<String, String> headerMapping,
            List<ParsedRow> rows,
            List<CsvParseError> errors,
            List<String> warnings
    ) {
        this.delimiter = delimiter;
        this.originalHeaders = Collections.unmodifiableList(originalHeaders);
        this.headerMapping = Collections.unmodifiableMap(headerMapping);
        this.rows = Collections.unmodifiableList(rows);
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    static CsvParseResult failure(Character delimiter, CsvParseError error, List<String> warnings) {
        return new CsvParseResult(
                delimiter,
                Collections.emptyList(),
                Collections.emptyMap(),
                Collections.emptyList(),
                List.of(error),
                warnings
        );
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * Delimiter used for tokenizing, or null if parsing stopped before detection.
     */
    public Character getDelimiter() {
        return delimiter;
    }

    public List<String> getOriginalHeaders() {
        return originalHeaders;
    }

    /**
     * Original header text mapped to its normalized form, in column order.
     */
    public Map<String, String> getHeaderMapping() {
        return headerMapping;
    }

    public List<ParsedRow> getRows() {
        return rows;
    }

    public int getTotalRows() {
        return rows.size();
    }

    public List<CsvParseError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
