package vn.com.fecredit.videoupload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * Request for a new upload session.
 *
 * <p>
 * Sizes are validated by the session registry rather than by bean validation, so that a
 * bad size is always reported as {@code INVALID_SIZE}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateSessionRequest {

    /** Original name of the file being uploaded. */
    @NotBlank
    private String filename;

    /** Total size of the file in bytes. */
    private long fileSize;

    /** Desired chunk size in bytes; the server default applies when absent. */
    private Integer chunkSize;

    public CreateSessionRequest() {
    }

    public CreateSessionRequest(String filename, long fileSize, Integer chunkSize) {
        this.filename = filename;
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
    }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public long getFileSize() { return fileSize; }
    public void setFileSize(long fileSize) { this.fileSize = fileSize; }
    public Integer getChunkSize() { return chunkSize; }
    public void setChunkSize(Integer chunkSize) { this.chunkSize = chunkSize; }
}
