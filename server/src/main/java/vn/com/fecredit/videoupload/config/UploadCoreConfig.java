package vn.com.fecredit.videoupload.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.videoupload.core.ChunkBuffer;
import vn.com.fecredit.videoupload.core.MessageCodec;
import vn.com.fecredit.videoupload.core.UploadSessionService;
import vn.com.fecredit.videoupload.manager.ConnectionMultiplexer;
import vn.com.fecredit.videoupload.manager.SessionPolicy;
import vn.com.fecredit.videoupload.manager.SessionRegistry;
import vn.com.fecredit.videoupload.port.interfaces.ICompletedUploadPort;
import vn.com.fecredit.videoupload.port.interfaces.IUploadEventPort;
import vn.com.fecredit.videoupload.port.interfaces.IUploadSessionPort;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the framework-free upload core to its JPA and Spring adapters.
 */
@Configuration
public class UploadCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(UploadCoreConfig.class);

    @Bean
    public Clock uploadClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${videoupload.default-chunk-size:1048576}") int defaultChunkSize,
            @Value("${videoupload.max-chunk-size:8388608}") int maxChunkSize,
            @Value("${videoupload.max-file-size:2147483648}") long maxFileSize,
            @Value("${videoupload.owner-quota-bytes:10737418240}") long ownerQuotaBytes,
            @Value("${videoupload.session-ttl:PT24H}") Duration sessionTtl,
            @Value("${videoupload.retention:P7D}") Duration retention) {
        log.info("Session policy: defaultChunkSize={}, maxChunkSize={}, maxFileSize={}, ownerQuota={}, ttl={}, retention={}",
                defaultChunkSize, maxChunkSize, maxFileSize, ownerQuotaBytes, sessionTtl, retention);
        return SessionPolicy.builder()
                .defaultChunkSize(defaultChunkSize)
                .maxChunkSize(maxChunkSize)
                .maxFileSize(maxFileSize)
                .ownerQuotaBytes(ownerQuotaBytes)
                .sessionTtl(sessionTtl)
                .retention(retention)
                .build();
    }

    @Bean
    public SessionRegistry sessionRegistry(IUploadSessionPort uploadSessionPort, SessionPolicy sessionPolicy,
                                           Clock uploadClock) {
        return new SessionRegistry(uploadSessionPort, sessionPolicy, uploadClock);
    }

    @Bean
    public ChunkBuffer chunkBuffer(SessionRegistry sessionRegistry,
                                   @Value("${videoupload.inprogress-dir:uploads/in-progress}") String inProgressDir,
                                   @Value("${videoupload.complete-dir:uploads/complete}") String completeDir)
            throws IOException {
        return new ChunkBuffer(sessionRegistry, inProgressDir, completeDir);
    }

    @Bean
    public UploadSessionService uploadSessionService(SessionRegistry sessionRegistry, ChunkBuffer chunkBuffer,
                                                     ICompletedUploadPort completedUploadPort,
                                                     IUploadEventPort uploadEventPort,
                                                     @Value("${videoupload.finalize-attempts:2}") int finalizeAttempts) {
        return new UploadSessionService(sessionRegistry, chunkBuffer, completedUploadPort, uploadEventPort,
                finalizeAttempts);
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public ConnectionMultiplexer connectionMultiplexer(
            UploadSessionService uploadSessionService, MessageCodec messageCodec,
            @Value("${videoupload.malformed-message-threshold:10}") int malformedMessageThreshold) {
        return new ConnectionMultiplexer(uploadSessionService, messageCodec, malformedMessageThreshold);
    }
}
