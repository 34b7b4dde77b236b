package vn.com.fecredit.videoupload.client;

/**
 * Upload failure reported to the caller of {@link VideoUploadClient}.
 * {@code errorCode} is the server's error code when the server reported the failure.
 */
public class UploadClientException extends RuntimeException {

    private final String errorCode;

    public UploadClientException(String message) {
        this(null, message, null);
    }

    public UploadClientException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public UploadClientException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
