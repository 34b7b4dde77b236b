package vn.com.fecredit.videoupload.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Analysis job queued for a video; picked up by the analysis workers.
 */
@Entity
@Table(name = "video_analyses")
@Data
public class VideoAnalysis {

    public static final String STATUS_PENDING = "pending";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String videoId;

    @Column(nullable = false, length = 100)
    private String analysisType;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
