package vn.com.fecredit.videoupload.model.interfaces;

import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.SessionStatus;

import java.time.LocalDateTime;

/**
 * Durable record of one upload session.
 */
public interface IUploadSession {
    String getToken();

    String getOwnerId();

    String getFilename();

    long getFileSize();

    int getChunkSize();

    int getTotalChunks();

    int getReceivedChunks();

    SessionStatus getStatus();

    LocalDateTime getCreatedAt();

    LocalDateTime getUpdatedAt();

    LocalDateTime getExpiresAt();

    LocalDateTime getCompletedAt();

    String getFinalPath();

    String getVideoId();

    boolean isCompletionNotified();

    default ChunkLayout layout() {
        return new ChunkLayout(getFileSize(), getChunkSize());
    }
}
