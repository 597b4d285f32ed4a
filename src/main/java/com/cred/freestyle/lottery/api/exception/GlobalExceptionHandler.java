package com.cred.freestyle.lottery.api.exception;

import com.cred.freestyle.lottery.api.dto.ErrorResponse;
import com.cred.freestyle.lottery.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the lottery back office API.
 * Converts exceptions thrown by controllers into {@link ErrorResponse} bodies.
 *
 * @author Lottery Back Office Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 404 NOT FOUND when the validation token is unknown.
     */
    @ExceptionHandler(ImportTokenNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleImportTokenNotFoundException(
            ImportTokenNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Import token not found: {}", ex.getValidationToken());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Import Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("code", ex.getErrorCode().name());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Returns 409 CONFLICT when the import was already committed.
     */
    @ExceptionHandler(ImportAlreadyCommittedException.class)
    public ResponseEntity<ErrorResponse> handleImportAlreadyCommittedException(
            ImportAlreadyCommittedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Import already committed: {}", ex.getImportId());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.CONFLICT.value(),
                "Import Already Committed",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("code", ex.getErrorCode().name());
        error.addDetail("importId", ex.getImportId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Returns 410 GONE when the validation token expired.
     */
    @ExceptionHandler(ImportTokenExpiredException.class)
    public ResponseEntity<ErrorResponse> handleImportTokenExpiredException(
            ImportTokenExpiredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Import token expired: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.GONE.value(),
                "Validation Token Expired",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("code", ex.getErrorCode().name());
        error.addDetail("importId", ex.getImportId());
        error.addDetail("expiresAt", ex.getExpiresAt());

        return ResponseEntity.status(HttpStatus.GONE).body(error);
    }

    /**
     * Returns 422 UNPROCESSABLE ENTITY when a commit without skipErrors meets error rows.
     */
    @ExceptionHandler(ImportRowErrorsException.class)
    public ResponseEntity<ErrorResponse> handleImportRowErrorsException(
            ImportRowErrorsException ex,
            HttpServletRequest request
    ) {
        logger.warn("Import {} rejected: {} rows with errors", ex.getImportId(), ex.getRowErrors().size());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.UNPROCESSABLE_ENTITY.value(),
                "Import Has Row Errors",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("code", ex.getErrorCode().name());
        error.addDetail("importId", ex.getImportId());
        error.addDetail("rowErrors", ex.getRowErrors());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    /**
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.NOT_FOUND.value(),
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        );
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Returns 400 BAD REQUEST for invalid arguments, such as an unsupported upload type.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 400 BAD REQUEST when a required multipart part or request parameter is missing.
     */
    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissingRequestInput(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing request input: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Missing Request Input",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 413 PAYLOAD TOO LARGE when the upload exceeds the multipart limit.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSizeExceededException(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Upload too large: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.PAYLOAD_TOO_LARGE.value(),
                "File Too Large",
                "Uploaded file exceeds the maximum allowed size",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 403 FORBIDDEN when the caller lacks the required role.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.FORBIDDEN.value(),
                "Access Denied",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
