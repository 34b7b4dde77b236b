package vn.com.fecredit.videoupload.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.videoupload.model.UploadCompletedEvent;
import vn.com.fecredit.videoupload.model.VideoAnalysis;
import vn.com.fecredit.videoupload.model.VideoAnalysisRepository;

import java.time.LocalDateTime;

/**
 * Queues an analysis job for every completed upload.
 */
@Service
public class AnalysisDispatchListener {

    private static final Logger log = LoggerFactory.getLogger(AnalysisDispatchListener.class);

    private final VideoAnalysisRepository videoAnalysisRepository;

    public AnalysisDispatchListener(VideoAnalysisRepository videoAnalysisRepository) {
        this.videoAnalysisRepository = videoAnalysisRepository;
    }

    @EventListener
    @Transactional
    public void onUploadCompleted(UploadCompletedEvent event) {
        VideoAnalysis analysis = new VideoAnalysis();
        analysis.setVideoId(event.getVideoId());
        analysis.setAnalysisType(event.getAnalysisType());
        analysis.setStatus(VideoAnalysis.STATUS_PENDING);
        analysis.setCreatedAt(LocalDateTime.now());
        videoAnalysisRepository.save(analysis);
        log.info("Queued {} analysis for video {} (owner={}, size={})", event.getAnalysisType(), event.getVideoId(),
                event.getOwnerId(), event.getSize());
    }
}
