package com.cred.freestyle.lottery.service.csv;

/**
 * File-level failures reported by {@link CsvParser}.
 *
 * @author Lottery Back Office Team
 */
public enum CsvErrorType {

    /**
     * Raw file exceeds the configured maximum size.
     */
    SIZE,

    /**
     * File decodes to zero lines.
     */
    FORMAT,

    /**
     * A required header is missing after normalization.
     */
    HEADER
}
