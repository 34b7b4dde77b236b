package vn.com.fecredit.videoupload.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;

import java.time.LocalDateTime;

@Entity
@Table(name = "upload_sessions")
@Data
public class UploadSessionEntity implements IUploadSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(nullable = false)
    private String ownerId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false)
    private int chunkSize;

    @Column(nullable = false)
    private int totalChunks;

    @Column(nullable = false)
    private int receivedChunks;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private LocalDateTime completedAt;

    @Column(length = 1024)
    private String finalPath;

    private String videoId;

    @Column(nullable = false)
    private boolean completionNotified;

    public static UploadSessionEntity fromSession(IUploadSession source) {
        UploadSessionEntity entity = new UploadSessionEntity();
        entity.setToken(source.getToken());
        entity.setOwnerId(source.getOwnerId());
        entity.setFilename(source.getFilename());
        entity.setFileSize(source.getFileSize());
        entity.setChunkSize(source.getChunkSize());
        entity.setTotalChunks(source.getTotalChunks());
        entity.setReceivedChunks(source.getReceivedChunks());
        entity.setStatus(source.getStatus());
        entity.setCreatedAt(source.getCreatedAt());
        entity.setUpdatedAt(source.getUpdatedAt());
        entity.setExpiresAt(source.getExpiresAt());
        entity.setCompletedAt(source.getCompletedAt());
        entity.setFinalPath(source.getFinalPath());
        entity.setVideoId(source.getVideoId());
        entity.setCompletionNotified(source.isCompletionNotified());
        return entity;
    }
}
