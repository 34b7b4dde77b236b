package vn.com.fecredit.videoupload.manager;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * Limits and timings applied by the {@link SessionRegistry}.
 */
@Getter
@Builder
public class SessionPolicy {
    @Builder.Default
    private final int defaultChunkSize = 1024 * 1024;
    @Builder.Default
    private final int maxChunkSize = 8 * 1024 * 1024;
    @Builder.Default
    private final long maxFileSize = 2L * 1024 * 1024 * 1024;
    @Builder.Default
    private final long ownerQuotaBytes = 10L * 1024 * 1024 * 1024;
    @Builder.Default
    private final Duration sessionTtl = Duration.ofHours(24);
    @Builder.Default
    private final Duration retention = Duration.ofDays(7);

    public static SessionPolicy defaults() {
        return SessionPolicy.builder().build();
    }
}
