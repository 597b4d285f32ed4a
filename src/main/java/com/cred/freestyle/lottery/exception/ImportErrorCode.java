package com.cred.freestyle.lottery.exception;

/**
 * Reasons a commit is rejected before any change is kept.
 *
 * @author Lottery Back Office Team
 */
public enum ImportErrorCode {
    TOKEN_NOT_FOUND,
    ALREADY_COMMITTED,
    EXPIRED_TOKEN,
    ROW_ERRORS
}
