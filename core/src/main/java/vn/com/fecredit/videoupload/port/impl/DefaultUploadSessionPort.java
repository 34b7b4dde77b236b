package vn.com.fecredit.videoupload.port.impl;

import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.impl.DefaultUploadSession;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.interfaces.IUploadSessionPort;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Default in-memory implementation of {@link IUploadSessionPort}.
 *
 * <p>
 * Atomicity comes from {@link ConcurrentHashMap#compute}: all mutations of one token
 * run inside a compute call on that token's entry. Callers only ever see copies.
 */
public class DefaultUploadSessionPort implements IUploadSessionPort {

    // ConcurrentHashMap does not accept null values
    private static final String NO_DIGEST = "";

    private final Map<String, DefaultUploadSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Map<Integer, String>> chunkDigests = new ConcurrentHashMap<>();

    @Override
    public IUploadSession insert(IUploadSession draft) {
        if (draft == null || draft.getToken() == null) {
            throw new IllegalArgumentException("Session or token cannot be null");
        }
        DefaultUploadSession stored = DefaultUploadSession.copyOf(draft);
        if (sessions.putIfAbsent(stored.getToken(), stored) != null) {
            throw new IllegalStateException("Duplicate session token");
        }
        chunkDigests.put(stored.getToken(), new ConcurrentHashMap<>());
        return DefaultUploadSession.copyOf(stored);
    }

    @Override
    public Optional<IUploadSession> findByToken(String token) {
        DefaultUploadSession found = sessions.get(token);
        return found == null ? Optional.empty() : Optional.of(copy(token));
    }

    @Override
    public boolean compareAndSetStatus(String token, SessionStatus expected, SessionStatus next, LocalDateTime now) {
        AtomicBoolean changed = new AtomicBoolean(false);
        sessions.computeIfPresent(token, (k, session) -> {
            if (session.getStatus() == expected) {
                session.setStatus(next);
                session.setUpdatedAt(now);
                if (next == SessionStatus.COMPLETED) {
                    session.setCompletedAt(now);
                }
                changed.set(true);
            }
            return session;
        });
        return changed.get();
    }

    @Override
    public Optional<String> findChunkDigest(String token, int chunkIndex) {
        Map<Integer, String> digests = chunkDigests.get(token);
        if (digests == null) {
            return Optional.empty();
        }
        String digest = digests.get(chunkIndex);
        return digest == null || digest.isEmpty() ? Optional.empty() : Optional.of(digest);
    }

    @Override
    public ChunkReceipt markChunkReceived(String token, int chunkIndex, String digest, LocalDateTime now) {
        AtomicReference<ChunkReceipt> receipt = new AtomicReference<>();
        DefaultUploadSession updated = sessions.computeIfPresent(token, (k, session) -> {
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw UploadException.notActive(token, session.getStatus());
            }
            if (chunkIndex < 0 || chunkIndex >= session.getTotalChunks()) {
                throw new UploadException(ErrorCode.INVALID_CHUNK_INDEX,
                        "Invalid chunk index: " + chunkIndex + ", totalChunks: " + session.getTotalChunks());
            }
            Map<Integer, String> digests = chunkDigests.computeIfAbsent(token, t -> new ConcurrentHashMap<>());
            String stored = digests.get(chunkIndex);
            if (stored != null) {
                if (digest != null && !stored.isEmpty() && !stored.equalsIgnoreCase(digest)) {
                    throw new UploadException(ErrorCode.CHUNK_DIGEST_MISMATCH,
                            "Chunk " + chunkIndex + " was already received with different content");
                }
                if (digest != null && stored.isEmpty()) {
                    digests.put(chunkIndex, digest);
                }
                receipt.set(new ChunkReceipt(session.getReceivedChunks(), session.getTotalChunks(), false));
                return session;
            }
            digests.put(chunkIndex, digest == null ? NO_DIGEST : digest);
            session.setReceivedChunks(session.getReceivedChunks() + 1);
            session.setUpdatedAt(now);
            receipt.set(new ChunkReceipt(session.getReceivedChunks(), session.getTotalChunks(), true));
            return session;
        });
        if (updated == null) {
            throw UploadException.notFound(token);
        }
        return receipt.get();
    }

    @Override
    public boolean markCompletionNotified(String token, String finalPath, String videoId, LocalDateTime now) {
        AtomicBoolean changed = new AtomicBoolean(false);
        sessions.computeIfPresent(token, (k, session) -> {
            if (!session.isCompletionNotified()) {
                session.setCompletionNotified(true);
                session.setFinalPath(finalPath);
                session.setVideoId(videoId);
                session.setUpdatedAt(now);
                changed.set(true);
            }
            return session;
        });
        return changed.get();
    }

    @Override
    public long sumOpenSessionBytes(String ownerId) {
        return sessions.values().stream()
                .filter(s -> s.getOwnerId().equals(ownerId) && SessionStatus.OPEN.contains(s.getStatus()))
                .mapToLong(DefaultUploadSession::getFileSize)
                .sum();
    }

    @Override
    public List<IUploadSession> findActiveExpiredBefore(LocalDateTime now) {
        return sessions.values().stream()
                .filter(s -> s.getStatus() == SessionStatus.ACTIVE && s.getExpiresAt().isBefore(now))
                .map(s -> (IUploadSession) copy(s.getToken()))
                .collect(Collectors.toList());
    }

    @Override
    public List<IUploadSession> findTerminalUpdatedBefore(LocalDateTime cutoff) {
        return sessions.values().stream()
                .filter(s -> s.getStatus().isTerminal() && s.getUpdatedAt().isBefore(cutoff))
                .map(s -> (IUploadSession) copy(s.getToken()))
                .collect(Collectors.toList());
    }

    @Override
    public List<Integer> findReceivedChunkIndices(String token) {
        Map<Integer, String> digests = chunkDigests.get(token);
        if (digests == null) {
            return new ArrayList<>();
        }
        return digests.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public void delete(String token) {
        sessions.remove(token);
        chunkDigests.remove(token);
    }

    private DefaultUploadSession copy(String token) {
        // compute gives a consistent snapshot against concurrent compute calls
        AtomicReference<DefaultUploadSession> snapshot = new AtomicReference<>();
        sessions.computeIfPresent(token, (k, session) -> {
            snapshot.set(DefaultUploadSession.copyOf(session));
            return session;
        });
        return snapshot.get();
    }
}
