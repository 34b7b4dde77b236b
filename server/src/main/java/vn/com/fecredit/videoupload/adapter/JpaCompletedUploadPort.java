package vn.com.fecredit.videoupload.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.videoupload.model.Video;
import vn.com.fecredit.videoupload.model.VideoRepository;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.interfaces.ICompletedUploadPort;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records finished uploads in the {@code videos} table, once per session token.
 */
@Component
public class JpaCompletedUploadPort implements ICompletedUploadPort {

    private static final Logger log = LoggerFactory.getLogger(JpaCompletedUploadPort.class);

    private final VideoRepository videoRepository;
    private final String defaultMimeType;

    public JpaCompletedUploadPort(VideoRepository videoRepository,
                                  @Value("${videoupload.default-mime-type:video/mp4}") String defaultMimeType) {
        this.videoRepository = videoRepository;
        this.defaultMimeType = defaultMimeType;
    }

    @Override
    @Transactional
    public String recordCompletedUpload(IUploadSession session, Path artifact) {
        return videoRepository.findBySessionToken(session.getToken())
                .map(existing -> {
                    log.debug("Video {} already recorded for this session", existing.getVideoId());
                    return existing.getVideoId();
                })
                .orElseGet(() -> {
                    Video video = new Video();
                    video.setVideoId(UUID.randomUUID().toString());
                    video.setSessionToken(session.getToken());
                    video.setOwnerId(session.getOwnerId());
                    video.setFilename(artifact.getFileName().toString());
                    video.setOriginalFilename(session.getFilename());
                    video.setFilePath(artifact.toString());
                    video.setFileSize(session.getFileSize());
                    video.setMimeType(mimeTypeOf(artifact));
                    video.setUploadStatus(Video.STATUS_UPLOADED);
                    video.setCreatedAt(LocalDateTime.now());
                    videoRepository.save(video);
                    log.info("Recorded video {} for owner={}, file={}", video.getVideoId(), session.getOwnerId(),
                            session.getFilename());
                    return video.getVideoId();
                });
    }

    private String mimeTypeOf(Path artifact) {
        try {
            String probed = Files.probeContentType(artifact);
            if (probed != null && probed.startsWith("video/")) {
                return probed;
            }
        } catch (IOException e) {
            log.debug("Could not probe content type of {}: {}", artifact, e.getMessage());
        }
        return defaultMimeType;
    }
}
