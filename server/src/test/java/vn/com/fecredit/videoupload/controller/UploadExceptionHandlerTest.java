package vn.com.fecredit.videoupload.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UploadExceptionHandlerTest {

    private final UploadExceptionHandler handler = new UploadExceptionHandler();

    @Test
    public void testStatusMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, UploadExceptionHandler.statusOf(ErrorCode.INVALID_SIZE));
        assertEquals(HttpStatus.BAD_REQUEST, UploadExceptionHandler.statusOf(ErrorCode.INVALID_FILENAME));
        assertEquals(HttpStatus.BAD_REQUEST, UploadExceptionHandler.statusOf(ErrorCode.MALFORMED_MESSAGE));
        assertEquals(HttpStatus.UNAUTHORIZED, UploadExceptionHandler.statusOf(ErrorCode.UNAUTHORIZED));
        assertEquals(HttpStatus.NOT_FOUND, UploadExceptionHandler.statusOf(ErrorCode.NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, UploadExceptionHandler.statusOf(ErrorCode.QUOTA_EXCEEDED));
        assertEquals(HttpStatus.CONFLICT, UploadExceptionHandler.statusOf(ErrorCode.SESSION_NOT_ACTIVE));
        assertEquals(HttpStatus.CONFLICT, UploadExceptionHandler.statusOf(ErrorCode.ILLEGAL_TRANSITION));
        assertEquals(HttpStatus.GONE, UploadExceptionHandler.statusOf(ErrorCode.EXPIRED));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, UploadExceptionHandler.statusOf(ErrorCode.STORAGE_FAILURE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, UploadExceptionHandler.statusOf(ErrorCode.FINALIZE_FAILED));
    }

    @Test
    public void testBodyCarriesCodeAndRetryable() {
        ResponseEntity<UploadError> response = handler.handleUpload(
                new UploadException(ErrorCode.STORAGE_FAILURE, "disk full"));

        assertEquals(500, response.getStatusCode().value());
        UploadError body = response.getBody();
        assertNotNull(body);
        assertEquals("STORAGE_FAILURE", body.getCode());
        assertEquals("disk full", body.getMessage());
        assertEquals(Map.of("retryable", true), body.getDetails());
        assertNotNull(body.getTimestamp());
    }
}
