package vn.com.fecredit.videoupload.model;

import lombok.Getter;

/**
 * Published exactly once per session after its artifact is durable and catalogued.
 */
@Getter
public class UploadCompletedEvent {
    public static final String ANALYSIS_METADATA_EXTRACTION = "metadata_extraction";

    private final String sessionToken;
    private final String videoId;
    private final String ownerId;
    private final String filename;
    private final long size;
    private final String finalPath;
    private final String analysisType;

    public UploadCompletedEvent(String sessionToken, String videoId, String ownerId, String filename,
                                long size, String finalPath) {
        this.sessionToken = sessionToken;
        this.videoId = videoId;
        this.ownerId = ownerId;
        this.filename = filename;
        this.size = size;
        this.finalPath = finalPath;
        this.analysisType = ANALYSIS_METADATA_EXTRACTION;
    }
}
