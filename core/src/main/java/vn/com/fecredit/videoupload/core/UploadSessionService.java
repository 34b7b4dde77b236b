package vn.com.fecredit.videoupload.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.manager.SessionRegistry;
import vn.com.fecredit.videoupload.model.CreateSessionRequest;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.UploadSessionResponse;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.interfaces.ICompletedUploadPort;
import vn.com.fecredit.videoupload.port.interfaces.IUploadEventPort;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the upload core for the REST and duplex layers.
 *
 * <p>
 * Owns the per-session state machines: one is created lazily per token and dropped
 * once its session is terminal. A dropped machine is never needed again because every
 * event on a terminal session is rejected from the registry state alone.
 */
public class UploadSessionService {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionService.class);

    private final SessionRegistry registry;
    private final ChunkBuffer buffer;
    private final ICompletedUploadPort completedUploadPort;
    private final IUploadEventPort eventPort;
    private final int finalizeAttempts;
    private final ConcurrentHashMap<String, UploadSessionStateMachine> machines = new ConcurrentHashMap<>();

    public UploadSessionService(SessionRegistry registry, ChunkBuffer buffer, ICompletedUploadPort completedUploadPort,
                                IUploadEventPort eventPort, int finalizeAttempts) {
        this.registry = registry;
        this.buffer = buffer;
        this.completedUploadPort = completedUploadPort;
        this.eventPort = eventPort;
        this.finalizeAttempts = finalizeAttempts;
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public ChunkBuffer getBuffer() {
        return buffer;
    }

    /**
     * Creates a session and its staging file.
     */
    public IUploadSession createSession(String ownerId, CreateSessionRequest request) {
        if (ownerId == null || ownerId.isEmpty()) {
            throw new UploadException(ErrorCode.UNAUTHORIZED, "No authenticated owner");
        }
        IUploadSession session = registry.create(ownerId, request.getFilename(), request.getFileSize(),
                request.getChunkSize());
        try {
            buffer.allocate(session.getToken());
        } catch (UploadException e) {
            log.warn("Staging allocation failed for session {}, cancelling it: {}",
                    UploadException.abbreviate(session.getToken()), e.getMessage());
            registry.transition(session.getToken(), SessionStatus.CANCELLED);
            throw e;
        }
        return session;
    }

    /**
     * Status lookup for the session owner. Another owner's session is reported as not found.
     */
    public IUploadSession lookup(String ownerId, String token) {
        IUploadSession session = registry.lookup(token);
        if (!session.getOwnerId().equals(ownerId)) {
            throw UploadException.notFound(token);
        }
        if (session.getStatus() == SessionStatus.EXPIRED && machines.containsKey(token)) {
            machineFor(token).onExpired();
            release(token);
        }
        return session;
    }

    /**
     * Cancels on behalf of the owner.
     *
     * @return false when the session was already cancelled
     */
    public boolean cancel(String ownerId, String token) {
        lookup(ownerId, token);
        try {
            return machineFor(token).cancel();
        } finally {
            releaseIfTerminal(token);
        }
    }

    /**
     * Machine of a session that can accept a connection.
     *
     * @throws UploadException NOT_FOUND, EXPIRED or SESSION_NOT_ACTIVE
     */
    public UploadSessionStateMachine activeMachine(String token) {
        IUploadSession session;
        try {
            session = registry.get(token);
        } catch (UploadException e) {
            if (e.getErrorCode() == ErrorCode.EXPIRED) {
                machineFor(token).onExpired();
                release(token);
            }
            throw e;
        }
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw UploadException.notActive(token, session.getStatus().wireName());
        }
        return machineFor(token);
    }

    public UploadSessionStateMachine machineFor(String token) {
        return machines.computeIfAbsent(token, t -> new UploadSessionStateMachine(t, registry, buffer,
                completedUploadPort, eventPort, finalizeAttempts));
    }

    public void release(String token) {
        machines.remove(token);
    }

    public void releaseIfTerminal(String token) {
        try {
            if (registry.lookup(token).getStatus().isTerminal()) {
                release(token);
            }
        } catch (UploadException e) {
            release(token);
        }
    }

    public int liveMachineCount() {
        return machines.size();
    }

    /**
     * Expires overdue sessions and discards their staging files.
     */
    public int sweepExpired() {
        return registry.sweepExpired(session -> {
            machineFor(session.getToken()).onExpired();
            release(session.getToken());
        });
    }

    /**
     * Deletes long-finished sessions, and any staging file they left behind.
     */
    public int purgeRetained() {
        return registry.purgeRetained(session -> {
            buffer.discard(session);
            release(session.getToken());
        });
    }

    public static UploadSessionResponse toResponse(IUploadSession session) {
        UploadSessionResponse response = new UploadSessionResponse();
        response.setSessionToken(session.getToken());
        response.setFilename(session.getFilename());
        response.setFileSize(session.getFileSize());
        response.setChunkSize(session.getChunkSize());
        response.setTotalChunks(session.getTotalChunks());
        response.setUploadedChunks(session.getReceivedChunks());
        response.setStatus(session.getStatus());
        response.setCreatedAt(session.getCreatedAt());
        response.setExpiresAt(session.getExpiresAt());
        response.setCompletedAt(session.getCompletedAt());
        response.setFinalPath(session.getFinalPath());
        response.setVideoId(session.getVideoId());
        return response;
    }
}
