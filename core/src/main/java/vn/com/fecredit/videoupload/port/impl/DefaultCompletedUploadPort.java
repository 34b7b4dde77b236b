package vn.com.fecredit.videoupload.port.impl;

import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.interfaces.ICompletedUploadPort;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of {@link ICompletedUploadPort}. Keeps the video id
 * and artifact path per session token.
 */
public class DefaultCompletedUploadPort implements ICompletedUploadPort {

    private final Map<String, String> videoIdsByToken = new ConcurrentHashMap<>();
    private final Map<String, Path> artifactsByVideoId = new ConcurrentHashMap<>();

    @Override
    public String recordCompletedUpload(IUploadSession session, Path artifact) {
        return videoIdsByToken.computeIfAbsent(session.getToken(), token -> {
            String videoId = UUID.randomUUID().toString();
            artifactsByVideoId.put(videoId, artifact);
            return videoId;
        });
    }

    public Optional<Path> findArtifact(String videoId) {
        return Optional.ofNullable(artifactsByVideoId.get(videoId));
    }

    public int size() {
        return videoIdsByToken.size();
    }
}
