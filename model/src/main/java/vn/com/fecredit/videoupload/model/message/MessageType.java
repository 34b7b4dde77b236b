package vn.com.fecredit.videoupload.model.message;

/**
 * Values of the {@code type} field of duplex channel frames.
 */
public final class MessageType {
    // client -> server
    public static final String CHUNK = "chunk";
    public static final String CANCEL = "cancel";

    // server -> client
    public static final String SESSION_INFO = "session_info";
    public static final String PROGRESS = "progress";
    public static final String UPLOAD_COMPLETE = "upload_complete";
    public static final String UPLOAD_CANCELLED = "upload_cancelled";
    public static final String ERROR = "error";

    private MessageType() {
    }
}
