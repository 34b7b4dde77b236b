package vn.com.fecredit.videoupload.model.impl;

import lombok.Data;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;

import java.time.LocalDateTime;

/**
 * Plain in-memory upload session, used as the registry's draft record and by the
 * in-memory store.
 */
@Data
public class DefaultUploadSession implements IUploadSession {
    private String token;
    private String ownerId;
    private String filename;
    private long fileSize;
    private int chunkSize;
    private int totalChunks;
    private int receivedChunks;
    private SessionStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime expiresAt;
    private LocalDateTime completedAt;
    private String finalPath;
    private String videoId;
    private boolean completionNotified;

    public static DefaultUploadSession copyOf(IUploadSession source) {
        DefaultUploadSession copy = new DefaultUploadSession();
        copy.setToken(source.getToken());
        copy.setOwnerId(source.getOwnerId());
        copy.setFilename(source.getFilename());
        copy.setFileSize(source.getFileSize());
        copy.setChunkSize(source.getChunkSize());
        copy.setTotalChunks(source.getTotalChunks());
        copy.setReceivedChunks(source.getReceivedChunks());
        copy.setStatus(source.getStatus());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        copy.setExpiresAt(source.getExpiresAt());
        copy.setCompletedAt(source.getCompletedAt());
        copy.setFinalPath(source.getFinalPath());
        copy.setVideoId(source.getVideoId());
        copy.setCompletionNotified(source.isCompletionNotified());
        return copy;
    }
}
