package vn.com.fecredit.videoupload.model.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Frame pushed by the server to the uploading client.
 *
 * <p>
 * {@code data} carries a {@link SessionInfo}, {@link Progress} or {@link UploadComplete}
 * depending on {@code type}; error frames use {@code code}, {@code message} and
 * {@code retryable} instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerMessage {
    private String type;
    private Object data;
    private String message;
    private String code;
    private Boolean retryable;

    public ServerMessage() {
    }

    private ServerMessage(String type, Object data, String message) {
        this.type = type;
        this.data = data;
        this.message = message;
    }

    public static ServerMessage sessionInfo(SessionInfo info) {
        return new ServerMessage(MessageType.SESSION_INFO, info, null);
    }

    public static ServerMessage progress(Progress progress) {
        return new ServerMessage(MessageType.PROGRESS, progress, null);
    }

    public static ServerMessage uploadComplete(UploadComplete complete) {
        return new ServerMessage(MessageType.UPLOAD_COMPLETE, complete, null);
    }

    public static ServerMessage uploadCancelled() {
        return new ServerMessage(MessageType.UPLOAD_CANCELLED, null, "Upload cancelled");
    }

    public static ServerMessage error(String code, String message, boolean retryable) {
        ServerMessage error = new ServerMessage(MessageType.ERROR, null, message);
        error.setCode(code);
        error.setRetryable(retryable);
        return error;
    }

    public boolean isType(String expected) {
        return expected.equals(type);
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Object getData() { return data; }
    public void setData(Object data) { this.data = data; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public Boolean getRetryable() { return retryable; }
    public void setRetryable(Boolean retryable) { this.retryable = retryable; }
}
