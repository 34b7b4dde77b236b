package vn.com.fecredit.videoupload.model.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Payload of {@code progress}; {@code progress} is a fraction between 0 and 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Progress {
    private int chunkIndex;
    private double progress;
    private int receivedChunks;
    private int totalChunks;

    public Progress() {
    }

    public Progress(int chunkIndex, int receivedChunks, int totalChunks) {
        this.chunkIndex = chunkIndex;
        this.receivedChunks = receivedChunks;
        this.totalChunks = totalChunks;
        this.progress = totalChunks == 0 ? 0.0 : (double) receivedChunks / totalChunks;
    }

    public int getChunkIndex() { return chunkIndex; }
    public void setChunkIndex(int chunkIndex) { this.chunkIndex = chunkIndex; }
    public double getProgress() { return progress; }
    public void setProgress(double progress) { this.progress = progress; }
    public int getReceivedChunks() { return receivedChunks; }
    public void setReceivedChunks(int receivedChunks) { this.receivedChunks = receivedChunks; }
    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }
}
