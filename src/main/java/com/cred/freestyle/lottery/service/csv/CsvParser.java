package com.cred.freestyle.lottery.service.csv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.HashSet;
import java.util.stream.Collectors;

/**
 * Delimiter-sniffing CSV tokenizer with RFC 4180 style quoting.
 *
 * Processing order:
 * 1. Reject files over maxFileSize (raw byte length, before decoding)
 * 2. Decode UTF-8, strip a leading byte order mark (reported as a warning)
 * 3. Normalize CRLF and lone CR to LF
 * 4. Detect the delimiter from the first line unless one is given
 * 5. Tokenize in a single pass
 * 6. Normalize headers and enforce required headers
 * 7. Build data rows, skipping empty rows and truncating at maxRows
 *
 * Row content is never validated here; that belongs to the caller.
 *
 * @author Lottery Back Office Team
 */
@Component
public class CsvParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvParser.class);

    private static final char QUOTE = '"';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // Comma first: it wins ties
    private static final char[] DELIMITER_CANDIDATES = {',', ';', '\t', '|'};

    /**
     * Parse CSV content.
     *
     * @param content Raw file bytes (UTF-8)
     * @param options Parse options
     * @return Parse result; check {@link CsvParseResult#isSuccess()}
     */
    public CsvParseResult parse(byte[] content, CsvParseOptions options) {
        List<String> warnings = new ArrayList<>();
        byte[] bytes = content != null ? content : new byte[0];

        if (bytes.length > options.getMaxFileSize()) {
            logger.warn("Rejected CSV of {} bytes, limit is {}", bytes.length, options.getMaxFileSize());
            return CsvParseResult.failure(null, new CsvParseError(
                    CsvErrorType.SIZE,
                    String.format("File size (%d bytes) exceeds maximum allowed size of %d bytes",
                            bytes.length, options.getMaxFileSize())
            ), warnings);
        }

        String text = new String(bytes, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
            warnings.add("UTF-8 byte order mark removed from start of file");
        }
        text = text.replace("\r\n", "\n").replace('\r', '\n');

        char delimiter = options.getDelimiter() != null
                ? options.getDelimiter()
                : detectDelimiter(text);

        List<List<String>> records = tokenize(text, delimiter, warnings);
        if (records.isEmpty() || records.stream().allMatch(CsvParser::isBlankRecord)) {
            return CsvParseResult.failure(delimiter,
                    new CsvParseError(CsvErrorType.FORMAT, "CSV file is empty"), warnings);
        }

        // Headers
        List<String> originalHeaders = new ArrayList<>();
        List<String> columnKeys = new ArrayList<>();
        Map<String, String> headerMapping = new LinkedHashMap<>();
        int firstDataRecord;

        if (options.isHasHeaders()) {
            int headerIndex = firstNonBlank(records);
            List<String> headerRecord = records.get(headerIndex);
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < headerRecord.size(); i++) {
                String original = headerRecord.get(i).trim();
                String normalized = original.isEmpty()
                        ? "column_" + (i + 1)
                        : options.getHeaderNormalizer().apply(original);
                if (!seen.add(normalized)) {
                    warnings.add(String.format("Duplicate column '%s' ignored (column %d)", original, i + 1));
                    normalized = null;
                }
                originalHeaders.add(original);
                columnKeys.add(normalized);
                if (normalized != null) {
                    headerMapping.put(original, normalized);
                }
            }
            firstDataRecord = headerIndex + 1;

            List<String> missing = options.getRequiredHeaders().stream()
                    .filter(required -> !seen.contains(required))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                return CsvParseResult.failure(delimiter, new CsvParseError(
                        CsvErrorType.HEADER,
                        "Missing required columns: " + String.join(", ", missing)
                ), warnings);
            }
        } else {
            int width = records.stream().mapToInt(List::size).max().orElse(0);
            for (int i = 0; i < width; i++) {
                String key = "column_" + (i + 1);
                columnKeys.add(key);
                headerMapping.put(key, key);
            }
            firstDataRecord = 0;
        }

        // Data rows
        List<ParsedRow> rows = new ArrayList<>();
        int rowNumber = 0;
        for (int r = firstDataRecord; r < records.size(); r++) {
            List<String> record = records.get(r);
            rowNumber++;

            if (options.isSkipEmptyRows() && isBlankRecord(record)) {
                continue;
            }

            if (rows.size() >= options.getMaxRows()) {
                warnings.add(String.format(
                        "File contains more than %d data rows; only the first %d rows were processed",
                        options.getMaxRows(), options.getMaxRows()));
                break;
            }

            List<String> values = new ArrayList<>(record.size());
            for (String cell : record) {
                values.add(options.isTrimValues() ? cell.trim() : cell);
            }

            Map<String, String> data = new LinkedHashMap<>();
            for (int c = 0; c < columnKeys.size(); c++) {
                String key = columnKeys.get(c);
                if (key != null) {
                    data.put(key, c < values.size() ? values.get(c) : "");
                }
            }
            rows.add(new ParsedRow(rowNumber, values, data));
        }

        logger.debug("Parsed CSV: delimiter='{}', {} columns, {} rows, {} warnings",
                delimiter, columnKeys.size(), rows.size(), warnings.size());

        return new CsvParseResult(delimiter, originalHeaders, headerMapping, rows, new ArrayList<>(), warnings);
    }

    /**
     * Detect the delimiter by counting candidates outside quoted spans in the first line.
     *
     * @param text Normalized CSV text
     * @return Most frequent candidate, comma on ties or when none occurs
     */
    char detectDelimiter(String text) {
        int[] counts = new int[DELIMITER_CANDIDATES.length];
        boolean inQuotes = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == QUOTE) {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == '\n') {
                    break;
                }
                for (int k = 0; k < DELIMITER_CANDIDATES.length; k++) {
                    if (c == DELIMITER_CANDIDATES[k]) {
                        counts[k]++;
                    }
                }
            }
        }

        int best = 0;
        for (int k = 1; k < DELIMITER_CANDIDATES.length; k++) {
            if (counts[k] > counts[best]) {
                best = k;
            }
        }
        return DELIMITER_CANDIDATES[best];
    }

    private List<List<String>> tokenize(String text, char delimiter, List<String> warnings) {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean pending = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == QUOTE) {
                inQuotes = true;
                pending = true;
            } else if (c == delimiter) {
                current.add(field.toString());
                field.setLength(0);
                pending = true;
            } else if (c == '\n') {
                current.add(field.toString());
                field.setLength(0);
                records.add(current);
                current = new ArrayList<>();
                pending = false;
            } else {
                field.append(c);
                pending = true;
            }
        }

        if (inQuotes) {
            warnings.add("Unterminated quoted field at end of file");
        }
        if (pending) {
            current.add(field.toString());
            records.add(current);
        }
        return records;
    }

    private static int firstNonBlank(List<List<String>> records) {
        for (int i = 0; i < records.size(); i++) {
            if (!isBlankRecord(records.get(i))) {
                return i;
            }
        }
        return 0;
    }

    private static boolean isBlankRecord(List<String> record) {
        return record.stream().allMatch(cell -> cell.trim().isEmpty());
    }
}
