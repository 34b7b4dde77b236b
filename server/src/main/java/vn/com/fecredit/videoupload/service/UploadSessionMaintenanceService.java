package vn.com.fecredit.videoupload.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import vn.com.fecredit.videoupload.core.UploadSessionService;

/**
 * Background upkeep of upload sessions: expires overdue sessions every minute and
 * purges long-finished ones every hour.
 */
@Service
public class UploadSessionMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionMaintenanceService.class);

    private final UploadSessionService uploadSessionService;

    public UploadSessionMaintenanceService(UploadSessionService uploadSessionService) {
        this.uploadSessionService = uploadSessionService;
    }

    /**
     * Moves every active session past its expiry time to expired and discards its staging file.
     */
    @Scheduled(fixedDelayString = "${videoupload.sweep-interval-ms:60000}")
    public void expireOverdueSessions() {
        log.debug("Starting sweep of expired upload sessions");
        try {
            int expired = uploadSessionService.sweepExpired();
            if (expired > 0) {
                log.info("Expired {} upload sessions", expired);
            }
        } catch (Exception e) {
            log.error("Error during expired upload sessions sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * Deletes terminal sessions older than the retention window, with any leftover staging file.
     */
    @Scheduled(fixedDelayString = "${videoupload.purge-interval-ms:3600000}",
            initialDelayString = "${videoupload.purge-interval-ms:3600000}")
    public void purgeRetainedSessions() {
        log.debug("Starting purge of retained upload sessions");
        try {
            int purged = uploadSessionService.purgeRetained();
            log.debug("Completed purge of retained upload sessions, {} removed", purged);
        } catch (Exception e) {
            log.error("Error during retained upload sessions purge: {}", e.getMessage(), e);
        }
    }
}
