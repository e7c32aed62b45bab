package com.cred.freestyle.warranty.api.exception;

import com.cred.freestyle.warranty.api.dto.ErrorResponse;
import com.cred.freestyle.warranty.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
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
 * Global exception handler for the warranty registration API.
 * Converts ledger and validation exceptions into standardized error responses.
 *
 * @author Warranty Platform Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final long LEDGER_RETRY_AFTER_SECONDS = 2;

    /**
     * Returns 409 CONFLICT when the serial is already registered (or lost a concurrent claim).
     */
    @ExceptionHandler(SerialAlreadyClaimedException.class)
    public ResponseEntity<ErrorResponse> handleSerialAlreadyClaimed(
            SerialAlreadyClaimedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Serial already claimed: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Serial Already Registered",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("serialNumber", ex.getSerialNumber());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Returns 409 CONFLICT when an insert collides with an existing serial.
     */
    @ExceptionHandler(DuplicateSerialException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateSerial(
            DuplicateSerialException ex,
            HttpServletRequest request
    ) {
        logger.warn("Duplicate serial: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Duplicate Serial Number",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("serialNumbers", ex.getSerialNumbers());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Returns 409 CONFLICT when deleting a product that still has serial numbers.
     */
    @ExceptionHandler(ProductInUseException.class)
    public ResponseEntity<ErrorResponse> handleProductInUse(
            ProductInUseException ex,
            HttpServletRequest request
    ) {
        logger.warn("Product in use: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Product In Use",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("productId", ex.getProductId());
        error.addDetail("serialCount", ex.getSerialCount());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(SerialNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSerialNotFound(
            SerialNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Serial not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Serial Not Found",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("serialNumber", ex.getSerialNumber());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Resource Not Found",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Returns 403 FORBIDDEN when the user may not register serials.
     */
    @ExceptionHandler(UserNotEligibleException.class)
    public ResponseEntity<ErrorResponse> handleUserNotEligible(
            UserNotEligibleException ex,
            HttpServletRequest request
    ) {
        logger.warn("User not eligible: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.FORBIDDEN, "Not Eligible",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("userId", ex.getUserId());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.FORBIDDEN, "Forbidden",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Returns 400 BAD REQUEST when releasing a serial that is not registered.
     */
    @ExceptionHandler(NotCurrentlyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleNotCurrentlyRegistered(
            NotCurrentlyRegisteredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Serial not registered: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Serial Not Registered",
                ex.getMessage(), request.getRequestURI());
        error.addDetail("serialNumber", ex.getSerialNumber());
        error.addDetail("expectedOwnerId", ex.getExpectedOwnerId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 400 BAD REQUEST for malformed serials, bills and import files.
     */
    @ExceptionHandler({
            InvalidSerialNumberException.class,
            InvalidEvidenceException.class,
            InvalidImportFileException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidInput(
            RuntimeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid input: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Bad Request",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMissingRequestPart(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing request part: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Bad Request",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

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

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed", request.getRequestURI());
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Upload too large on {}", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(HttpStatus.PAYLOAD_TOO_LARGE, "Payload Too Large",
                "Uploaded file exceeds the maximum allowed size", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(error);
    }

    /**
     * Returns 503 SERVICE UNAVAILABLE with Retry-After when the ledger stays
     * unavailable after retries. Safe for the client to retry.
     */
    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleLedgerUnavailable(
            LedgerUnavailableException ex,
            HttpServletRequest request
    ) {
        logger.error("Ledger unavailable: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "The serial ledger is temporarily unavailable. Please try again.", request.getRequestURI());
        error.addDetail("operation", ex.getOperation());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(LEDGER_RETRY_AFTER_SECONDS))
                .body(error);
    }

    @ExceptionHandler(EvidenceStorageException.class)
    public ResponseEntity<ErrorResponse> handleEvidenceStorage(
            EvidenceStorageException ex,
            HttpServletRequest request
    ) {
        logger.error("Evidence storage failure: {}", ex.getMessage(), ex);

        ErrorResponse error = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "Evidence Storage Failed",
                "The bill could not be stored. Please try again later.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
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

        ErrorResponse error = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
