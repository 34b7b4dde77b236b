package vn.com.fecredit.videoupload.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.impl.DefaultUploadSession;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.model.util.FileNameValidator;
import vn.com.fecredit.videoupload.port.interfaces.IUploadSessionPort;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Durable registry of upload sessions.
 *
 * <p>
 * All state lives behind {@link IUploadSessionPort}; this class adds validation, token
 * generation, lazy expiry and the status transition rules. Every mutation is a single
 * atomic port operation, so the registry itself holds no session state and may be
 * shared by any number of threads.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int TOKEN_BYTES = 32;

    private final IUploadSessionPort sessionPort;
    private final SessionPolicy policy;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    // Serializes quota check + insert per owner
    private final ConcurrentHashMap<String, Object> ownerLocks = new ConcurrentHashMap<>();

    public SessionRegistry(IUploadSessionPort sessionPort, SessionPolicy policy, Clock clock) {
        this.sessionPort = sessionPort;
        this.policy = policy;
        this.clock = clock;
    }

    public SessionPolicy getPolicy() {
        return policy;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Creates an active session.
     *
     * @param chunkSize requested chunk size, {@code null} for the default
     * @throws UploadException INVALID_SIZE, INVALID_FILENAME or QUOTA_EXCEEDED
     */
    public IUploadSession create(String ownerId, String filename, long fileSize, Integer chunkSize) {
        int effectiveChunkSize = chunkSize == null ? policy.getDefaultChunkSize() : chunkSize;
        if (fileSize <= 0) {
            throw new UploadException(ErrorCode.INVALID_SIZE, "File size must be positive: " + fileSize);
        }
        if (fileSize > policy.getMaxFileSize()) {
            throw new UploadException(ErrorCode.INVALID_SIZE,
                    "File size " + fileSize + " exceeds the limit of " + policy.getMaxFileSize() + " bytes");
        }
        if (effectiveChunkSize <= 0 || effectiveChunkSize > policy.getMaxChunkSize()) {
            throw new UploadException(ErrorCode.INVALID_SIZE,
                    "Chunk size must be between 1 and " + policy.getMaxChunkSize() + ": " + effectiveChunkSize);
        }
        if (!FileNameValidator.isValidFileName(filename)) {
            throw new UploadException(ErrorCode.INVALID_FILENAME, "Invalid filename");
        }
        ChunkLayout layout = new ChunkLayout(fileSize, effectiveChunkSize);

        synchronized (ownerLocks.computeIfAbsent(ownerId, k -> new Object())) {
            long openBytes = sessionPort.sumOpenSessionBytes(ownerId);
            if (openBytes + fileSize > policy.getOwnerQuotaBytes()) {
                log.info("Quota exceeded for owner={}: open={} requested={} quota={}",
                        ownerId, openBytes, fileSize, policy.getOwnerQuotaBytes());
                throw new UploadException(ErrorCode.QUOTA_EXCEEDED,
                        "Upload quota exceeded: " + openBytes + " bytes already in progress");
            }
            LocalDateTime now = now();
            DefaultUploadSession draft = new DefaultUploadSession();
            draft.setToken(newToken());
            draft.setOwnerId(ownerId);
            draft.setFilename(filename);
            draft.setFileSize(fileSize);
            draft.setChunkSize(effectiveChunkSize);
            draft.setTotalChunks(layout.totalChunks);
            draft.setReceivedChunks(0);
            draft.setStatus(SessionStatus.ACTIVE);
            draft.setCreatedAt(now);
            draft.setUpdatedAt(now);
            draft.setExpiresAt(now.plus(policy.getSessionTtl()));
            IUploadSession created = sessionPort.insert(draft);
            log.info("Created upload session {} for owner={}, file={}, size={}, chunks={}",
                    UploadException.abbreviate(created.getToken()), ownerId, filename, fileSize, layout.totalChunks);
            return created;
        }
    }

    /**
     * Returns a live session.
     *
     * @throws UploadException NOT_FOUND, or EXPIRED when the session is (or just became) expired
     */
    public IUploadSession get(String token) {
        IUploadSession session = lookup(token);
        if (session.getStatus() == SessionStatus.EXPIRED) {
            throw UploadException.expired(token);
        }
        return session;
    }

    /**
     * Like {@link #get(String)} but returns an expired session instead of failing.
     *
     * @throws UploadException NOT_FOUND
     */
    public IUploadSession lookup(String token) {
        IUploadSession session = find(token);
        if (session.getStatus() == SessionStatus.ACTIVE && now().isAfter(session.getExpiresAt())) {
            if (sessionPort.compareAndSetStatus(token, SessionStatus.ACTIVE, SessionStatus.EXPIRED, now())) {
                log.info("Upload session {} expired on access", UploadException.abbreviate(token));
            }
            session = find(token);
        }
        return session;
    }

    /**
     * Rejects a resend whose digest differs from the one stored for the same index.
     * Checked before the bytes are written so a conflicting resend never reaches storage.
     */
    public void assertDigestConsistent(String token, int chunkIndex, String digest) {
        if (digest == null) {
            return;
        }
        Optional<String> stored = sessionPort.findChunkDigest(token, chunkIndex);
        if (stored.isPresent() && !stored.get().equalsIgnoreCase(digest)) {
            throw new UploadException(ErrorCode.CHUNK_DIGEST_MISMATCH,
                    "Chunk " + chunkIndex + " was already received with different content");
        }
    }

    public ChunkReceipt recordChunk(String token, int chunkIndex, String digest) {
        ChunkReceipt receipt = sessionPort.markChunkReceived(token, chunkIndex, digest, now());
        if (log.isDebugEnabled()) {
            log.debug("Recorded chunk {} of session {}: received={}/{} firstArrival={}", chunkIndex,
                    UploadException.abbreviate(token), receipt.receivedChunks, receipt.totalChunks, receipt.firstArrival);
        }
        return receipt;
    }

    /**
     * Moves the session to {@code next} by compare-and-set against its current status.
     *
     * @return the session after the transition
     * @throws UploadException ILLEGAL_TRANSITION when the move is not allowed or the
     *                         status changed concurrently
     */
    public IUploadSession transition(String token, SessionStatus next) {
        IUploadSession session = find(token);
        SessionStatus current = session.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new UploadException(ErrorCode.ILLEGAL_TRANSITION,
                    "Cannot move session " + UploadException.abbreviate(token) + " from " + current + " to " + next);
        }
        if (!sessionPort.compareAndSetStatus(token, current, next, now())) {
            throw new UploadException(ErrorCode.ILLEGAL_TRANSITION,
                    "Session " + UploadException.abbreviate(token) + " changed status concurrently");
        }
        log.info("Upload session {} {} -> {}", UploadException.abbreviate(token), current, next);
        return find(token);
    }

    public boolean markCompletionNotified(String token, String finalPath, String videoId) {
        return sessionPort.markCompletionNotified(token, finalPath, videoId, now());
    }

    /**
     * Expires every active session past its expiry time.
     *
     * @param onExpired called for each session this sweep actually expired
     * @return number of sessions expired
     */
    public int sweepExpired(Consumer<IUploadSession> onExpired) {
        int expired = 0;
        for (IUploadSession candidate : sessionPort.findActiveExpiredBefore(now())) {
            String token = candidate.getToken();
            if (!sessionPort.compareAndSetStatus(token, SessionStatus.ACTIVE, SessionStatus.EXPIRED, now())) {
                continue;
            }
            expired++;
            log.info("Upload session {} of owner={} expired by sweep", UploadException.abbreviate(token),
                    candidate.getOwnerId());
            try {
                onExpired.accept(candidate);
            } catch (RuntimeException e) {
                log.warn("Cleanup of expired session {} failed: {}", UploadException.abbreviate(token), e.getMessage());
            }
        }
        return expired;
    }

    /**
     * Deletes terminal sessions last updated before the retention window.
     *
     * @param beforeDelete called for each session before its record is removed
     * @return number of sessions deleted
     */
    public int purgeRetained(Consumer<IUploadSession> beforeDelete) {
        LocalDateTime cutoff = now().minus(policy.getRetention());
        int purged = 0;
        for (IUploadSession session : sessionPort.findTerminalUpdatedBefore(cutoff)) {
            try {
                beforeDelete.accept(session);
            } catch (RuntimeException e) {
                log.warn("Cleanup before purge of session {} failed: {}",
                        UploadException.abbreviate(session.getToken()), e.getMessage());
            }
            sessionPort.delete(session.getToken());
            purged++;
        }
        if (purged > 0) {
            log.info("Purged {} upload sessions older than {}", purged, cutoff);
        }
        return purged;
    }

    public List<Integer> receivedChunkIndices(String token) {
        return sessionPort.findReceivedChunkIndices(token);
    }

    public List<Integer> missingChunkIndices(String token) {
        IUploadSession session = find(token);
        Set<Integer> received = new HashSet<>(sessionPort.findReceivedChunkIndices(token));
        List<Integer> missing = new ArrayList<>(session.getTotalChunks() - received.size());
        for (int i = 0; i < session.getTotalChunks(); i++) {
            if (!received.contains(i)) {
                missing.add(i);
            }
        }
        return missing;
    }

    private IUploadSession find(String token) {
        if (token == null || token.isEmpty()) {
            throw UploadException.notFound(token);
        }
        return sessionPort.findByToken(token).orElseThrow(() -> UploadException.notFound(token));
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
