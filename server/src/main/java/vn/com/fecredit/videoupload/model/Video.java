package vn.com.fecredit.videoupload.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Catalog entry of a finished upload.
 */
@Entity
@Table(name = "videos")
@Data
public class Video {

    public static final String STATUS_UPLOADED = "uploaded";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String videoId;

    @Column(nullable = false, unique = true, length = 64)
    private String sessionToken;

    @Column(nullable = false)
    private String ownerId;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false)
    private String originalFilename;

    @Column(nullable = false, length = 1024)
    private String filePath;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false, length = 100)
    private String mimeType;

    @Column(nullable = false, length = 20)
    private String uploadStatus;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
