package vn.com.fecredit.videoupload.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Arrival of one chunk index of a session. The unique key makes a resend a no-op for counting.
 */
@Entity
@Table(name = "chunk_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_chunk_records_token_index", columnNames = {"session_token", "chunk_index"})
})
@Data
public class ChunkRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_token", nullable = false, length = 64)
    private String sessionToken;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(length = 64)
    private String digest; // SHA-256 hex, optional

    @Column(nullable = false)
    private LocalDateTime receivedAt;
}
