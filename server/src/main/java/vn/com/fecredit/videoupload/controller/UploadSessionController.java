package vn.com.fecredit.videoupload.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import vn.com.fecredit.videoupload.core.UploadSessionService;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.CreateSessionRequest;
import vn.com.fecredit.videoupload.model.UploadSessionResponse;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;

import java.security.Principal;
import java.util.Map;

/**
 * REST surface of the upload sessions.
 *
 * <p>
 * Exposes endpoints for:
 * <ul>
 * <li>Creating a session, which returns the token used on the WebSocket channel</li>
 * <li>Polling a session's status and progress</li>
 * <li>Cancelling a session</li>
 * </ul>
 * Chunks never travel over this controller; they go through {@code /ws/upload/{token}}.
 */
@RestController
@RequestMapping("/api/upload")
public class UploadSessionController {
    private static final Logger log = LoggerFactory.getLogger(UploadSessionController.class);

    private final UploadSessionService uploadSessionService;

    public UploadSessionController(UploadSessionService uploadSessionService) {
        this.uploadSessionService = uploadSessionService;
    }

    /**
     * Creates an upload session for the authenticated user.
     *
     * @param request   filename, size and optional chunk size
     * @param principal the authenticated user, who becomes the session owner
     * @return the new session, including its token
     */
    @PostMapping("/session")
    public ResponseEntity<UploadSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request,
                                                               Principal principal) {
        log.debug("Create session: filename={}, fileSize={}, chunkSize={}",
                request.getFilename(), request.getFileSize(), request.getChunkSize());
        IUploadSession session = uploadSessionService.createSession(ownerOf(principal), request);
        return ResponseEntity.ok(UploadSessionService.toResponse(session));
    }

    @GetMapping("/session/{token}")
    public ResponseEntity<UploadSessionResponse> getSession(@PathVariable String token, Principal principal) {
        return ResponseEntity.ok(UploadSessionService.toResponse(uploadSessionService.lookup(ownerOf(principal), token)));
    }

    /**
     * Cancels a session. Cancelling an already cancelled session succeeds again.
     */
    @DeleteMapping("/session/{token}")
    public ResponseEntity<Map<String, String>> cancelSession(@PathVariable String token, Principal principal) {
        boolean cancelled = uploadSessionService.cancel(ownerOf(principal), token);
        log.debug("Cancel session {}: {}", UploadException.abbreviate(token),
                cancelled ? "cancelled" : "already cancelled");
        return ResponseEntity.ok(Map.of("message", cancelled ? "Upload cancelled" : "Upload already cancelled"));
    }

    private String ownerOf(Principal principal) {
        return principal != null ? principal.getName() : null;
    }
}
