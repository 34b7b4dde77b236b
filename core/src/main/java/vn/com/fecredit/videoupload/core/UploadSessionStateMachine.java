package vn.com.fecredit.videoupload.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.manager.SessionRegistry;
import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.UploadCompletedEvent;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.model.message.ClientMessage;
import vn.com.fecredit.videoupload.model.message.MessageType;
import vn.com.fecredit.videoupload.model.message.Progress;
import vn.com.fecredit.videoupload.model.message.ServerMessage;
import vn.com.fecredit.videoupload.model.message.SessionInfo;
import vn.com.fecredit.videoupload.model.message.UploadComplete;
import vn.com.fecredit.videoupload.model.util.ChecksumUtil;
import vn.com.fecredit.videoupload.port.interfaces.ICompletedUploadPort;
import vn.com.fecredit.videoupload.port.interfaces.IUploadEventPort;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one upload session through its lifecycle.
 *
 * <p>
 * Every event (chunk, cancel, sweep expiry) runs under this machine's lock, so the
 * events of one session are applied one at a time in arrival order. Exactly one machine
 * exists per live session; see {@link UploadSessionService#machineFor(String)}.
 */
public class UploadSessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionStateMachine.class);

    private final String token;
    private final SessionRegistry registry;
    private final ChunkBuffer buffer;
    private final ICompletedUploadPort completedUploadPort;
    private final IUploadEventPort eventPort;
    private final int finalizeAttempts;
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private int consecutiveFinalizeFailures;

    public UploadSessionStateMachine(String token, SessionRegistry registry, ChunkBuffer buffer,
                                     ICompletedUploadPort completedUploadPort, IUploadEventPort eventPort,
                                     int finalizeAttempts) {
        this.token = token;
        this.registry = registry;
        this.buffer = buffer;
        this.completedUploadPort = completedUploadPort;
        this.eventPort = eventPort;
        this.finalizeAttempts = Math.max(1, finalizeAttempts);
    }

    public String getToken() {
        return token;
    }

    /**
     * Handles one decoded client message. Upload errors become {@code error} replies;
     * nothing is thrown for them.
     */
    public List<ServerMessage> handle(ClientMessage message) {
        try {
            if (message.isType(MessageType.CHUNK)) {
                if (message.getChunkIndex() == null) {
                    throw new UploadException(ErrorCode.MALFORMED_CHUNK, "Chunk message has no chunk_index");
                }
                byte[] data = MessageCodec.decodeChunkData(message.getChunkData());
                return acceptChunk(message.getChunkIndex(), data, message.getChunkDigest());
            }
            if (message.isType(MessageType.CANCEL)) {
                cancel();
                return Collections.singletonList(ServerMessage.uploadCancelled());
            }
            throw new UploadException(ErrorCode.UNKNOWN_MESSAGE_KIND, "Unknown message type: " + message.getType());
        } catch (UploadException e) {
            log.debug("Rejected {} message for session {}: {} {}", message.getType(),
                    UploadException.abbreviate(token), e.getErrorCode(), e.getMessage());
            return Collections.singletonList(toError(e));
        }
    }

    /**
     * Stores one chunk; when it is the last missing one, finalizes the upload.
     *
     * @param digest optional hex SHA-256 of {@code data}
     * @return a {@code progress} message, followed by {@code upload_complete} or a
     * finalize {@code error} when this chunk completed the set
     */
    public List<ServerMessage> acceptChunk(int chunkIndex, byte[] data, String digest) {
        lock.lock();
        try {
            IUploadSession session = requireActive();
            if (!session.layout().isValidIndex(chunkIndex)) {
                throw new UploadException(ErrorCode.INVALID_CHUNK_INDEX,
                        "Invalid chunk index: " + chunkIndex + ", totalChunks: " + session.getTotalChunks());
            }
            if (digest != null) {
                if (!ChecksumUtil.matches(digest, ChecksumUtil.generateChecksum(data))) {
                    throw new UploadException(ErrorCode.CHUNK_DIGEST_MISMATCH,
                            "Digest of chunk " + chunkIndex + " does not match its data");
                }
                registry.assertDigestConsistent(token, chunkIndex, digest);
            }
            if (buffer.isFinalized(session)) {
                // a previous completion renamed the file before failing; keep the artifact
                log.debug("Session {} already has its artifact, skipping write of chunk {}",
                        UploadException.abbreviate(token), chunkIndex);
            } else {
                buffer.write(token, chunkIndex, data);
            }
            ChunkReceipt receipt = registry.recordChunk(token, chunkIndex, digest);

            List<ServerMessage> replies = new ArrayList<>(2);
            replies.add(ServerMessage.progress(new Progress(chunkIndex, receipt.receivedChunks, receipt.totalChunks)));
            if (receipt.isComplete()) {
                replies.addAll(complete());
            }
            return replies;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the session and discards its staging file.
     *
     * @return false when the session was already cancelled
     * @throws UploadException EXPIRED, or SESSION_NOT_ACTIVE for completed sessions
     */
    public boolean cancel() {
        lock.lock();
        try {
            IUploadSession session = getOrDiscardExpired();
            if (session.getStatus() == SessionStatus.CANCELLED) {
                buffer.discard(session);
                return false;
            }
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw UploadException.notActive(token, session.getStatus().wireName());
            }
            registry.transition(token, SessionStatus.CANCELLED);
            buffer.discard(session);
            log.info("Upload session {} cancelled by owner={}", UploadException.abbreviate(token), session.getOwnerId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cleanup after the session was expired, run under the session lock so it is
     * ordered after any in-flight write.
     */
    public void onExpired() {
        lock.lock();
        try {
            buffer.discard(registry.lookup(token));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws UploadException NOT_FOUND, EXPIRED or SESSION_NOT_ACTIVE
     */
    public SessionInfo describe() {
        lock.lock();
        try {
            IUploadSession session = requireActive();
            SessionInfo info = new SessionInfo();
            info.setSessionToken(session.getToken());
            info.setFilename(session.getFilename());
            info.setFileSize(session.getFileSize());
            info.setChunkSize(session.getChunkSize());
            info.setTotalChunks(session.getTotalChunks());
            info.setUploadedChunks(session.getReceivedChunks());
            info.setMissingChunks(registry.missingChunkIndices(token));
            info.setExpiresAt(session.getExpiresAt());
            return info;
        } finally {
            lock.unlock();
        }
    }

    private List<ServerMessage> complete() {
        IUploadSession session = registry.transition(token, SessionStatus.COMPLETING);
        Path artifact;
        String videoId;
        try {
            artifact = buffer.finalizeUpload(token);
            videoId = completedUploadPort.recordCompletedUpload(registry.lookup(token), artifact);
            registry.transition(token, SessionStatus.COMPLETED);
        } catch (RuntimeException e) {
            return finalizeFailed(e);
        }
        consecutiveFinalizeFailures = 0;

        if (!registry.markCompletionNotified(token, artifact.toString(), videoId)) {
            log.debug("Completion of session {} was already notified", UploadException.abbreviate(token));
            return Collections.emptyList();
        }
        try {
            eventPort.publishUploadCompleted(new UploadCompletedEvent(token, videoId, session.getOwnerId(),
                    session.getFilename(), session.getFileSize(), artifact.toString()));
        } catch (RuntimeException e) {
            log.error("Failed to publish completion of session {}", UploadException.abbreviate(token), e);
        }
        log.info("Upload session {} completed: videoId={}, path={}", UploadException.abbreviate(token), videoId, artifact);
        return Collections.singletonList(
                ServerMessage.uploadComplete(new UploadComplete(videoId, session.getFilename(), session.getFileSize())));
    }

    private List<ServerMessage> finalizeFailed(RuntimeException cause) {
        try {
            registry.transition(token, SessionStatus.ACTIVE);
        } catch (UploadException e) {
            log.error("Could not return session {} to active after failed finalize",
                    UploadException.abbreviate(token), e);
        }
        consecutiveFinalizeFailures++;
        boolean retryable = consecutiveFinalizeFailures < finalizeAttempts;
        log.warn("Finalize of session {} failed (attempt {} of {}): {}", UploadException.abbreviate(token),
                consecutiveFinalizeFailures, finalizeAttempts, cause.getMessage());
        String message = retryable
                ? "Finalizing the upload failed, resend any chunk to retry"
                : "Finalizing the upload failed repeatedly";
        return Collections.singletonList(ServerMessage.error(ErrorCode.FINALIZE_FAILED.name(), message, retryable));
    }

    private IUploadSession requireActive() {
        IUploadSession session = getOrDiscardExpired();
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw UploadException.notActive(token, session.getStatus().wireName());
        }
        return session;
    }

    private IUploadSession getOrDiscardExpired() {
        try {
            return registry.get(token);
        } catch (UploadException e) {
            if (e.getErrorCode() == ErrorCode.EXPIRED) {
                buffer.discard(registry.lookup(token));
            }
            throw e;
        }
    }

    public static ServerMessage toError(UploadException e) {
        return ServerMessage.error(e.getErrorCode().name(), e.getMessage(), e.isRetryable());
    }
}
