package vn.com.fecredit.videoupload.model;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VideoAnalysisRepository extends JpaRepository<VideoAnalysis, Long> {
    List<VideoAnalysis> findByVideoId(String videoId);
}
