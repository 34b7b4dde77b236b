package vn.com.fecredit.videoupload.model.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payload of {@code upload_complete}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UploadComplete {
    private String videoId;
    private String filename;
    private long size;
    private String message;

    public UploadComplete() {
    }

    public UploadComplete(String videoId, String filename, long size) {
        this.videoId = videoId;
        this.filename = filename;
        this.size = size;
        this.message = "Upload completed successfully";
    }

    public String getVideoId() { return videoId; }
    public void setVideoId(String videoId) { this.videoId = videoId; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
