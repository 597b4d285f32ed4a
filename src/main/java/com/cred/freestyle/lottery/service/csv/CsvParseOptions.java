package com.cred.freestyle.lottery.service.csv;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Options for a single {@link CsvParser#parse} call.
 *
 * Defaults:
 * - maxFileSize: 5 MB
 * - maxRows: 1000 (extra rows are dropped with a warning)
 * - delimiter: null (auto-detect among comma, semicolon, tab and pipe)
 * - hasHeaders: true
 * - headerNormalizer: lowercase, whitespace runs collapsed to underscore
 * - requiredHeaders: none
 * - skipEmptyRows: true
 * - trimValues: true
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder(toBuilder = true)
public class CsvParseOptions {

    public static final long DEFAULT_MAX_FILE_SIZE = 5L * 1024 * 1024;
    public static final int DEFAULT_MAX_ROWS = 1000;

    public static final UnaryOperator<String> DEFAULT_HEADER_NORMALIZER =
            header -> header.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");

    @Builder.Default
    private final long maxFileSize = DEFAULT_MAX_FILE_SIZE;

    @Builder.Default
    private final int maxRows = DEFAULT_MAX_ROWS;

    /**
     * Fixed delimiter. When null the delimiter is sniffed from the first line.
     */
    private final Character delimiter;

    @Builder.Default
    private final boolean hasHeaders = true;

    @Builder.Default
    private final UnaryOperator<String> headerNormalizer = DEFAULT_HEADER_NORMALIZER;

    @Builder.Default
    private final List<String> requiredHeaders = Collections.emptyList();

    @Builder.Default
    private final boolean skipEmptyRows = true;

    @Builder.Default
    private final boolean trimValues = true;

    public static CsvParseOptions defaults() {
        return CsvParseOptions.builder().build();
    }
}
