package vn.com.fecredit.videoupload.model;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UploadSessionRepository extends JpaRepository<UploadSessionEntity, Long> {

    Optional<UploadSessionEntity> findByToken(String token);

    /**
     * Loads the session row with a write lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from UploadSessionEntity s where s.token = :token")
    Optional<UploadSessionEntity> findByTokenForUpdate(@Param("token") String token);

    /**
     * Compare-and-set of the status.
     *
     * @return number of rows changed, 0 when the current status is not {@code expected}
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UploadSessionEntity s set s.status = :next, s.updatedAt = :now "
            + "where s.token = :token and s.status = :expected")
    int compareAndSetStatus(@Param("token") String token, @Param("expected") SessionStatus expected,
                            @Param("next") SessionStatus next, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UploadSessionEntity s set s.status = :next, s.updatedAt = :now, s.completedAt = :now "
            + "where s.token = :token and s.status = :expected")
    int compareAndSetStatusCompleted(@Param("token") String token, @Param("expected") SessionStatus expected,
                                     @Param("next") SessionStatus next, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UploadSessionEntity s set s.completionNotified = true, s.finalPath = :finalPath, "
            + "s.videoId = :videoId, s.updatedAt = :now where s.token = :token and s.completionNotified = false")
    int markCompletionNotified(@Param("token") String token, @Param("finalPath") String finalPath,
                               @Param("videoId") String videoId, @Param("now") LocalDateTime now);

    /**
     * @return combined declared size, {@code null} when the owner has no matching session
     */
    @Query("select sum(s.fileSize) from UploadSessionEntity s where s.ownerId = :ownerId and s.status in :statuses")
    Long sumFileSizeByOwnerIdAndStatusIn(@Param("ownerId") String ownerId,
                                         @Param("statuses") Collection<SessionStatus> statuses);

    List<UploadSessionEntity> findByStatusAndExpiresAtBefore(SessionStatus status, LocalDateTime now);

    List<UploadSessionEntity> findByStatusInAndUpdatedAtBefore(Collection<SessionStatus> statuses, LocalDateTime cutoff);

    @Modifying
    @Query("delete from UploadSessionEntity s where s.token = :token")
    int deleteByToken(@Param("token") String token);
}
