package vn.com.fecredit.videoupload.core.exception;

import lombok.Getter;

/**
 * Failure of an upload session operation, identified by an {@link ErrorCode}.
 */
@Getter
public class UploadException extends RuntimeException {

    private final ErrorCode errorCode;
    private final boolean retryable;

    public UploadException(ErrorCode errorCode, String message) {
        this(errorCode, message, errorCode.getCategory() == ErrorCode.Category.RESOURCE, null);
    }

    public UploadException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, errorCode.getCategory() == ErrorCode.Category.RESOURCE, cause);
    }

    public UploadException(ErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public static UploadException notFound(String token) {
        return new UploadException(ErrorCode.NOT_FOUND, "Upload session not found: " + abbreviate(token));
    }

    public static UploadException expired(String token) {
        return new UploadException(ErrorCode.EXPIRED, "Upload session expired: " + abbreviate(token));
    }

    public static UploadException notActive(String token, Object status) {
        return new UploadException(ErrorCode.SESSION_NOT_ACTIVE,
                "Upload session " + abbreviate(token) + " is not active (status=" + status + ")");
    }

    /**
     * Tokens are credentials; only a prefix goes into messages and logs.
     */
    public static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
