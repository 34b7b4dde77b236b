package vn.com.fecredit.videoupload.port.interfaces;

import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Port for the durable session store.
 *
 * <p>
 * Every mutation is an atomic operation of the store itself (compare-and-set on the
 * status, first-arrival check plus count increment for chunks). Callers never
 * read-modify-write a session.
 */
public interface IUploadSessionPort {

    /**
     * Persists a new session.
     *
     * @param draft fully populated session, status {@code ACTIVE}
     * @return the stored session
     */
    IUploadSession insert(IUploadSession draft);

    Optional<IUploadSession> findByToken(String token);

    /**
     * Sets {@code next} only if the current status is {@code expected}. Entering
     * {@code COMPLETED} also stamps the completion time.
     *
     * @return true when the status was changed
     */
    boolean compareAndSetStatus(String token, SessionStatus expected, SessionStatus next, LocalDateTime now);

    /**
     * @return the digest stored for a received chunk, empty when the chunk has not
     * arrived or arrived without a digest
     */
    Optional<String> findChunkDigest(String token, int chunkIndex);

    /**
     * Marks a chunk as received, incrementing the received count the first time only.
     *
     * @throws vn.com.fecredit.videoupload.core.exception.UploadException NOT_FOUND,
     *         SESSION_NOT_ACTIVE, INVALID_CHUNK_INDEX or CHUNK_DIGEST_MISMATCH
     */
    ChunkReceipt markChunkReceived(String token, int chunkIndex, String digest, LocalDateTime now);

    /**
     * Sets the one-time completion flag together with the artifact path and video id.
     *
     * @return true only for the call that set the flag
     */
    boolean markCompletionNotified(String token, String finalPath, String videoId, LocalDateTime now);

    /**
     * @return combined declared size of the owner's active and completing sessions
     */
    long sumOpenSessionBytes(String ownerId);

    List<IUploadSession> findActiveExpiredBefore(LocalDateTime now);

    List<IUploadSession> findTerminalUpdatedBefore(LocalDateTime cutoff);

    List<Integer> findReceivedChunkIndices(String token);

    /**
     * Removes the session and its chunk records.
     */
    void delete(String token);
}
