package vn.com.fecredit.videoupload.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.ChunkRecord;
import vn.com.fecredit.videoupload.model.ChunkRecordRepository;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.UploadSessionEntity;
import vn.com.fecredit.videoupload.model.UploadSessionRepository;
import vn.com.fecredit.videoupload.model.impl.DefaultUploadSession;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.interfaces.IUploadSessionPort;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link IUploadSessionPort} over Spring Data JPA.
 *
 * <p>
 * Status changes are single conditional {@code UPDATE} statements. Chunk recording
 * locks the session row ({@code SELECT ... FOR UPDATE}) so the first-arrival check and
 * the count increment commit together. Results are returned as detached copies.
 */
@Component
@Transactional
public class JpaUploadSessionPort implements IUploadSessionPort {

    private static final Logger log = LoggerFactory.getLogger(JpaUploadSessionPort.class);

    private final UploadSessionRepository sessionRepository;
    private final ChunkRecordRepository chunkRecordRepository;

    public JpaUploadSessionPort(UploadSessionRepository sessionRepository, ChunkRecordRepository chunkRecordRepository) {
        this.sessionRepository = sessionRepository;
        this.chunkRecordRepository = chunkRecordRepository;
    }

    @Override
    public IUploadSession insert(IUploadSession draft) {
        UploadSessionEntity saved = sessionRepository.save(UploadSessionEntity.fromSession(draft));
        log.debug("Inserted upload session row id={}", saved.getId());
        return DefaultUploadSession.copyOf(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IUploadSession> findByToken(String token) {
        return sessionRepository.findByToken(token).map(DefaultUploadSession::copyOf);
    }

    @Override
    public boolean compareAndSetStatus(String token, SessionStatus expected, SessionStatus next, LocalDateTime now) {
        int updated = next == SessionStatus.COMPLETED
                ? sessionRepository.compareAndSetStatusCompleted(token, expected, next, now)
                : sessionRepository.compareAndSetStatus(token, expected, next, now);
        return updated == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findChunkDigest(String token, int chunkIndex) {
        return chunkRecordRepository.findBySessionTokenAndChunkIndex(token, chunkIndex)
                .map(ChunkRecord::getDigest);
    }

    @Override
    public ChunkReceipt markChunkReceived(String token, int chunkIndex, String digest, LocalDateTime now) {
        UploadSessionEntity session = sessionRepository.findByTokenForUpdate(token)
                .orElseThrow(() -> UploadException.notFound(token));
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw UploadException.notActive(token, session.getStatus().wireName());
        }
        if (chunkIndex < 0 || chunkIndex >= session.getTotalChunks()) {
            throw new UploadException(ErrorCode.INVALID_CHUNK_INDEX,
                    "Invalid chunk index: " + chunkIndex + ", totalChunks: " + session.getTotalChunks());
        }

        Optional<ChunkRecord> existing = chunkRecordRepository.findBySessionTokenAndChunkIndex(token, chunkIndex);
        if (existing.isPresent()) {
            ChunkRecord record = existing.get();
            if (digest != null && record.getDigest() != null && !record.getDigest().equalsIgnoreCase(digest)) {
                throw new UploadException(ErrorCode.CHUNK_DIGEST_MISMATCH,
                        "Chunk " + chunkIndex + " was already received with different content");
            }
            if (digest != null && record.getDigest() == null) {
                record.setDigest(digest);
            }
            return new ChunkReceipt(session.getReceivedChunks(), session.getTotalChunks(), false);
        }

        ChunkRecord record = new ChunkRecord();
        record.setSessionToken(token);
        record.setChunkIndex(chunkIndex);
        record.setDigest(digest);
        record.setReceivedAt(now);
        chunkRecordRepository.save(record);

        session.setReceivedChunks(session.getReceivedChunks() + 1);
        session.setUpdatedAt(now);
        return new ChunkReceipt(session.getReceivedChunks(), session.getTotalChunks(), true);
    }

    @Override
    public boolean markCompletionNotified(String token, String finalPath, String videoId, LocalDateTime now) {
        return sessionRepository.markCompletionNotified(token, finalPath, videoId, now) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public long sumOpenSessionBytes(String ownerId) {
        Long sum = sessionRepository.sumFileSizeByOwnerIdAndStatusIn(ownerId, SessionStatus.OPEN);
        return sum == null ? 0L : sum;
    }

    @Override
    @Transactional(readOnly = true)
    public List<IUploadSession> findActiveExpiredBefore(LocalDateTime now) {
        return sessionRepository.findByStatusAndExpiresAtBefore(SessionStatus.ACTIVE, now).stream()
                .map(DefaultUploadSession::copyOf)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<IUploadSession> findTerminalUpdatedBefore(LocalDateTime cutoff) {
        return sessionRepository.findByStatusInAndUpdatedAtBefore(SessionStatus.TERMINAL, cutoff).stream()
                .map(DefaultUploadSession::copyOf)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Integer> findReceivedChunkIndices(String token) {
        return chunkRecordRepository.findChunkIndicesBySessionToken(token);
    }

    @Override
    public void delete(String token) {
        int chunks = chunkRecordRepository.deleteBySessionToken(token);
        sessionRepository.deleteByToken(token);
        log.debug("Deleted session {} with {} chunk records", UploadException.abbreviate(token), chunks);
    }
}
