package vn.com.fecredit.videoupload.client;

/**
 * Outcome of a finished upload.
 */
public class UploadResult {
    private final String sessionToken;
    private final String videoId;
    private final String filename;
    private final long size;
    private final int chunksSent;

    public UploadResult(String sessionToken, String videoId, String filename, long size, int chunksSent) {
        this.sessionToken = sessionToken;
        this.videoId = videoId;
        this.filename = filename;
        this.size = size;
        this.chunksSent = chunksSent;
    }

    public String getSessionToken() {
        return sessionToken;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getFilename() {
        return filename;
    }

    public long getSize() {
        return size;
    }

    /**
     * Number of chunk frames written by this client, resends included.
     */
    public int getChunksSent() {
        return chunksSent;
    }
}
