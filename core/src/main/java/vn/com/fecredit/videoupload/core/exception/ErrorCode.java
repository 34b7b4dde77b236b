package vn.com.fecredit.videoupload.core.exception;

/**
 * Error codes reported to callers, grouped by how they are handled.
 */
public enum ErrorCode {
    INVALID_SIZE(Category.CLIENT),
    INVALID_FILENAME(Category.CLIENT),
    QUOTA_EXCEEDED(Category.CLIENT),
    UNAUTHORIZED(Category.CLIENT),
    INVALID_CHUNK_INDEX(Category.CLIENT),
    CHUNK_SIZE_MISMATCH(Category.CLIENT),
    CHUNK_DIGEST_MISMATCH(Category.CLIENT),
    MALFORMED_CHUNK(Category.CLIENT),
    UNKNOWN_MESSAGE_KIND(Category.CLIENT),
    INCOMPLETE(Category.CLIENT),

    FINALIZE_FAILED(Category.RESOURCE),
    STORAGE_FAILURE(Category.RESOURCE),

    NOT_FOUND(Category.LIFECYCLE),
    EXPIRED(Category.LIFECYCLE),
    SESSION_NOT_ACTIVE(Category.LIFECYCLE),
    ILLEGAL_TRANSITION(Category.LIFECYCLE),

    MALFORMED_MESSAGE(Category.PROTOCOL);

    /**
     * <ul>
     * <li>CLIENT: bad input, reported, never retried by the server</li>
     * <li>RESOURCE: storage or registry failure, the client may retry</li>
     * <li>LIFECYCLE: unknown or finished session, the client needs a new session</li>
     * <li>PROTOCOL: broken envelope, logged and ignored up to a threshold</li>
     * </ul>
     */
    public enum Category {
        CLIENT, RESOURCE, LIFECYCLE, PROTOCOL
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
