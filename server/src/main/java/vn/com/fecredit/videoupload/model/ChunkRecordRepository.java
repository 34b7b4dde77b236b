package vn.com.fecredit.videoupload.model;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ChunkRecordRepository extends JpaRepository<ChunkRecord, Long> {

    Optional<ChunkRecord> findBySessionTokenAndChunkIndex(String sessionToken, int chunkIndex);

    @Query("select c.chunkIndex from ChunkRecord c where c.sessionToken = :token order by c.chunkIndex")
    List<Integer> findChunkIndicesBySessionToken(@Param("token") String token);

    long countBySessionToken(String sessionToken);

    @Modifying
    @Query("delete from ChunkRecord c where c.sessionToken = :token")
    int deleteBySessionToken(@Param("token") String token);
}
