package com.example.authservice.exception;

import com.example.authservice.dto.ErrorResponse;
import com.example.authservice.web.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for REST API.
 * Every error leaves in the same body shape the gates write.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Business exceptions carry their own code and status.
     */
    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ErrorResponse> handleBaseException(BaseException ex, HttpServletRequest request) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(ErrorResponse.of(ex.getCode(), ex.getMessage(), RequestIdFilter.requestIdOf(request)));
    }

    /**
     * Bean Validation errors - 400 Bad Request, first field message
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse("Validation failed");
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorCode.VALIDATION_ERROR, message, RequestIdFilter.requestIdOf(request)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Malformed request body",
                        RequestIdFilter.requestIdOf(request)));
    }

    /**
     * Non-numeric path id. Every path variable in this service is a user id.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.debug("Type mismatch for parameter {}", ex.getName());
        return handleBaseException(ValidationException.invalidUserId(), request);
    }

    /**
     * Framework errors that already carry a status (unknown route, wrong method, wrong content type, ...)
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class,
            ServletRequestBindingException.class
    })
    public ResponseEntity<ErrorResponse> handleFrameworkError(Exception ex, HttpServletRequest request) {
        return frameworkError((org.springframework.web.ErrorResponse) ex, ex, request);
    }

    /**
     * Anything else - 500, logged with the request id, no internal detail in the body
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse errorResponse) {
            return frameworkError(errorResponse, ex, request);
        }
        String requestId = RequestIdFilter.requestIdOf(request);
        log.error("Unhandled error for requestId={}", requestId, ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "Internal Server Error", requestId));
    }

    private static ResponseEntity<ErrorResponse> frameworkError(
            org.springframework.web.ErrorResponse errorResponse, Exception ex, HttpServletRequest request) {
        HttpStatusCode status = errorResponse.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : String.valueOf(status.value());
        log.debug("Framework error {}: {}", status.value(), ex.getMessage());
        return ResponseEntity
                .status(status)
                .body(ErrorResponse.of(code, ex.getMessage(), RequestIdFilter.requestIdOf(request)));
    }
}
