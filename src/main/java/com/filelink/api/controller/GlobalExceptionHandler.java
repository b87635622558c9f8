package com.filelink.api.controller;

import com.filelink.api.dto.ApiResponse;
import com.filelink.api.exception.DenialReason;
import com.filelink.api.exception.FileLinkException;
import com.filelink.api.exception.LinkUnavailableException;
import com.filelink.api.exception.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiResponse} bodies. Controllers never catch.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String LINK_UNAVAILABLE = "Link unavailable";

    // Same answer for unknown, expired, deleted and throttled links
    @ExceptionHandler(LinkUnavailableException.class)
    public ResponseEntity<ApiResponse> handleLinkUnavailable(LinkUnavailableException e) {
        log.debug("Link unavailable: {} (file {})", e.getDiagnosticCause(), e.getFileId());
        return body(DenialReason.INVALID_TOKEN, LINK_UNAVAILABLE, null);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ApiResponse> handleRateLimited(RateLimitedException e) {
        long seconds = Math.max(1, (e.getRetryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
                .body(response(DenialReason.RATE_LIMITED, "Too many requests, try again in " + seconds + "s",
                        Map.of("retryAfterSeconds", seconds)));
    }

    @ExceptionHandler(FileLinkException.class)
    public ResponseEntity<ApiResponse> handleDenial(FileLinkException e) {
        if (e.getReason() == DenialReason.STORAGE_IO_FAILURE) {
            log.error("Storage failure: {}", e.getMessage(), e);
            return body(e.getReason(), "Storage failure", null);
        }
        log.info("Denied ({}): {}", e.getReason(), e.getMessage());
        return body(e.getReason(), e.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse> handleMaxUpload(MaxUploadSizeExceededException e) {
        return body(DenialReason.SIZE_TOO_LARGE, "Upload exceeds the maximum request size", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .collect(Collectors.joining(", ", "Invalid fields: ", ""));
        return badRequest(message);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse> handleBadRequest(Exception e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.builder()
                        .statusCode(HttpStatus.INTERNAL_SERVER_ERROR.value())
                        .status("ERROR")
                        .message("Internal error")
                        .build());
    }

    private static ResponseEntity<ApiResponse> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.builder()
                        .statusCode(HttpStatus.BAD_REQUEST.value())
                        .status("BAD_REQUEST")
                        .message(message)
                        .build());
    }

    private static ResponseEntity<ApiResponse> body(DenialReason reason, String message, Object data) {
        return ResponseEntity.status(reason.getHttpStatus()).body(response(reason, message, data));
    }

    private static ApiResponse response(DenialReason reason, String message, Object data) {
        return ApiResponse.builder()
                .statusCode(reason.getHttpStatus().value())
                .status(reason.name())
                .message(message)
                .data(data != null ? data : Map.of("messageKey", reason.getMessageKey()))
                .build();
    }
}
