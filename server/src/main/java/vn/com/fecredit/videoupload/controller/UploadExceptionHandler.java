package vn.com.fecredit.videoupload.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps upload failures to HTTP statuses and {@link UploadError} bodies.
 */
@RestControllerAdvice
public class UploadExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(UploadExceptionHandler.class);

    @ExceptionHandler(UploadException.class)
    public ResponseEntity<UploadError> handleUpload(UploadException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Upload request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Upload request rejected with {}: {}", e.getErrorCode(), e.getMessage());
        }
        UploadError body = UploadError.builder()
                .code(e.getErrorCode().name())
                .message(e.getMessage())
                .details(Map.of("retryable", e.isRetryable()))
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<UploadError> handleInvalid(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(UploadError.builder()
                .code(ErrorCode.INVALID_FILENAME.name())
                .message("Request validation failed: " + details)
                .details(Map.of("details", details))
                .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<UploadError> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(UploadError.builder()
                .code(ErrorCode.MALFORMED_MESSAGE.name())
                .message("Request body is not valid JSON for this endpoint")
                .build());
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case UNAUTHORIZED:
                return HttpStatus.UNAUTHORIZED;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case QUOTA_EXCEEDED:
            case SESSION_NOT_ACTIVE:
            case ILLEGAL_TRANSITION:
                return HttpStatus.CONFLICT;
            case EXPIRED:
                return HttpStatus.GONE;
            default:
                break;
        }
        switch (code.getCategory()) {
            case CLIENT:
            case PROTOCOL:
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
