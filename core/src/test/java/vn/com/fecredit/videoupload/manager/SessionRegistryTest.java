package vn.com.fecredit.videoupload.manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.videoupload.core.MutableClock;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.ChunkReceipt;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.port.impl.DefaultUploadSessionPort;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private static final String OWNER = "alice";

    private MutableClock clock;
    private DefaultUploadSessionPort sessionPort;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        sessionPort = new DefaultUploadSessionPort();
        SessionPolicy policy = SessionPolicy.builder()
                .ownerQuotaBytes(100L * 1024 * 1024)
                .build();
        registry = new SessionRegistry(sessionPort, policy, clock);
    }

    @Test
    void testCreate_DefaultChunkSizeAndLayout() {
        IUploadSession session = registry.create(OWNER, "movie.mp4", 10_000_000L, null);

        assertEquals(1_048_576, session.getChunkSize());
        assertEquals(10, session.getTotalChunks());
        assertEquals(0, session.getReceivedChunks());
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        assertEquals(session.getCreatedAt().plusHours(24), session.getExpiresAt());
        assertEquals(657_616, session.layout().expectedLength(9));
    }

    @Test
    void testCreate_TokensAreUrlSafeAndDistinct() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            String token = registry.create(OWNER, "f" + i + ".mp4", 10, null).getToken();
            assertEquals(43, token.length());
            assertTrue(token.matches("[A-Za-z0-9_-]+"), token);
            tokens.add(token);
        }
        assertEquals(20, tokens.size());
    }

    @Test
    void testCreate_InvalidSizes() {
        UploadException zero = assertThrows(UploadException.class, () -> registry.create(OWNER, "a.mp4", 0, null));
        assertEquals(ErrorCode.INVALID_SIZE, zero.getErrorCode());

        UploadException tooLarge = assertThrows(UploadException.class,
                () -> registry.create(OWNER, "a.mp4", 3L * 1024 * 1024 * 1024, null));
        assertEquals(ErrorCode.INVALID_SIZE, tooLarge.getErrorCode());

        UploadException badChunk = assertThrows(UploadException.class,
                () -> registry.create(OWNER, "a.mp4", 1000, 0));
        assertEquals(ErrorCode.INVALID_SIZE, badChunk.getErrorCode());

        UploadException bigChunk = assertThrows(UploadException.class,
                () -> registry.create(OWNER, "a.mp4", 1000, 9 * 1024 * 1024));
        assertEquals(ErrorCode.INVALID_SIZE, bigChunk.getErrorCode());
    }

    @Test
    void testCreate_InvalidFilename() {
        for (String name : new String[]{"", "   ", "../etc/passwd", "dir\\file.mp4", "nul\0.mp4"}) {
            UploadException ex = assertThrows(UploadException.class, () -> registry.create(OWNER, name, 10, null));
            assertEquals(ErrorCode.INVALID_FILENAME, ex.getErrorCode());
        }
    }

    @Test
    void testCreate_QuotaCountsOnlyOpenSessions() {
        IUploadSession first = registry.create(OWNER, "a.mp4", 60L * 1024 * 1024, null);

        UploadException ex = assertThrows(UploadException.class,
                () -> registry.create(OWNER, "b.mp4", 50L * 1024 * 1024, null));
        assertEquals(ErrorCode.QUOTA_EXCEEDED, ex.getErrorCode());

        // another owner has their own quota
        assertNotNull(registry.create("bob", "b.mp4", 50L * 1024 * 1024, null));

        registry.transition(first.getToken(), SessionStatus.CANCELLED);
        assertNotNull(registry.create(OWNER, "b.mp4", 50L * 1024 * 1024, null));
    }

    @Test
    void testGet_UnknownToken() {
        UploadException ex = assertThrows(UploadException.class, () -> registry.get("no-such-token"));
        assertEquals(ErrorCode.NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void testGet_LazilyExpires() {
        String token = registry.create(OWNER, "a.mp4", 10, null).getToken();
        clock.advance(Duration.ofHours(24).plusSeconds(1));

        UploadException ex = assertThrows(UploadException.class, () -> registry.get(token));
        assertEquals(ErrorCode.EXPIRED, ex.getErrorCode());
        assertEquals(SessionStatus.EXPIRED, registry.lookup(token).getStatus());
        // nothing left for the sweep to do
        assertEquals(0, registry.sweepExpired(s -> fail("already expired")));
    }

    @Test
    void testLookup_ReturnsExpiredSession() {
        String token = registry.create(OWNER, "a.mp4", 10, null).getToken();
        clock.advance(Duration.ofDays(2));

        assertEquals(SessionStatus.EXPIRED, registry.lookup(token).getStatus());
    }

    @Test
    void testRecordChunk_CountsDistinctIndices() {
        String token = registry.create(OWNER, "a.mp4", 10, 1).getToken();

        int[] arrivals = {3, 3, 0, 7, 9, 3, 0};
        ChunkReceipt last = null;
        for (int index : arrivals) {
            last = registry.recordChunk(token, index, null);
        }
        assertNotNull(last);
        assertEquals(4, last.receivedChunks);
        assertFalse(last.firstArrival);
        assertEquals(4, registry.lookup(token).getReceivedChunks());
        assertEquals(List.of(1, 2, 4, 5, 6, 8), registry.missingChunkIndices(token));
        assertEquals(List.of(0, 3, 7, 9), registry.receivedChunkIndices(token));
    }

    @Test
    void testRecordChunk_InvalidIndexAndInactiveSession() {
        String token = registry.create(OWNER, "a.mp4", 10, 5).getToken();

        UploadException invalid = assertThrows(UploadException.class, () -> registry.recordChunk(token, 2, null));
        assertEquals(ErrorCode.INVALID_CHUNK_INDEX, invalid.getErrorCode());

        registry.transition(token, SessionStatus.CANCELLED);
        UploadException inactive = assertThrows(UploadException.class, () -> registry.recordChunk(token, 0, null));
        assertEquals(ErrorCode.SESSION_NOT_ACTIVE, inactive.getErrorCode());
    }

    @Test
    void testRecordChunk_ConflictingDigestRejected() {
        String token = registry.create(OWNER, "a.mp4", 10, 5).getToken();
        registry.recordChunk(token, 0, "aa");

        assertDoesNotThrow(() -> registry.assertDigestConsistent(token, 0, "AA"));
        assertDoesNotThrow(() -> registry.assertDigestConsistent(token, 1, "bb"));
        UploadException ex = assertThrows(UploadException.class, () -> registry.assertDigestConsistent(token, 0, "bb"));
        assertEquals(ErrorCode.CHUNK_DIGEST_MISMATCH, ex.getErrorCode());
        assertThrows(UploadException.class, () -> registry.recordChunk(token, 0, "bb"));
        assertEquals(1, registry.lookup(token).getReceivedChunks());
    }

    @Test
    void testRecordChunk_ConcurrentSendersCountEachIndexOnce() throws Exception {
        String token = registry.create(OWNER, "a.mp4", 64, 1).getToken();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 64; i++) {
                        registry.recordChunk(token, i, null);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(64, registry.lookup(token).getReceivedChunks());
    }

    @Test
    void testTransition_EnforcesTable() {
        String token = registry.create(OWNER, "a.mp4", 10, null).getToken();

        UploadException ex = assertThrows(UploadException.class,
                () -> registry.transition(token, SessionStatus.COMPLETED));
        assertEquals(ErrorCode.ILLEGAL_TRANSITION, ex.getErrorCode());

        registry.transition(token, SessionStatus.COMPLETING);
        registry.transition(token, SessionStatus.ACTIVE);
        registry.transition(token, SessionStatus.COMPLETING);
        IUploadSession completed = registry.transition(token, SessionStatus.COMPLETED);
        assertNotNull(completed.getCompletedAt());

        for (SessionStatus next : SessionStatus.values()) {
            assertThrows(UploadException.class, () -> registry.transition(token, next));
        }
    }

    @Test
    void testMarkCompletionNotified_OnlyOnce() {
        String token = registry.create(OWNER, "a.mp4", 10, null).getToken();

        assertTrue(registry.markCompletionNotified(token, "/data/a.mp4", "v1"));
        assertFalse(registry.markCompletionNotified(token, "/data/other.mp4", "v2"));
        IUploadSession session = registry.lookup(token);
        assertEquals("/data/a.mp4", session.getFinalPath());
        assertEquals("v1", session.getVideoId());
    }

    @Test
    void testSweepExpired_ExpiresOnlyOverdueActiveSessions() {
        String stale = registry.create(OWNER, "a.mp4", 10, null).getToken();
        String cancelled = registry.create(OWNER, "b.mp4", 10, null).getToken();
        registry.transition(cancelled, SessionStatus.CANCELLED);
        clock.advance(Duration.ofHours(23));
        String fresh = registry.create(OWNER, "c.mp4", 10, null).getToken();
        clock.advance(Duration.ofHours(2));

        List<String> expired = new ArrayList<>();
        assertEquals(1, registry.sweepExpired(s -> expired.add(s.getToken())));
        assertEquals(List.of(stale), expired);
        assertEquals(SessionStatus.EXPIRED, registry.lookup(stale).getStatus());
        assertEquals(SessionStatus.CANCELLED, registry.lookup(cancelled).getStatus());
        assertEquals(SessionStatus.ACTIVE, registry.lookup(fresh).getStatus());
        assertEquals(0, registry.sweepExpired(s -> fail("swept twice")));
    }

    @Test
    void testPurgeRetained_DeletesOldTerminalSessions() {
        String cancelled = registry.create(OWNER, "a.mp4", 10, null).getToken();
        registry.transition(cancelled, SessionStatus.CANCELLED);
        String active = registry.create(OWNER, "b.mp4", 10, null).getToken();
        clock.advance(Duration.ofDays(8));

        List<String> purged = new ArrayList<>();
        // only terminal sessions are purged
        assertEquals(1, registry.purgeRetained(s -> purged.add(s.getToken())));
        assertEquals(List.of(cancelled), purged);
        UploadException ex = assertThrows(UploadException.class, () -> registry.lookup(cancelled));
        assertEquals(ErrorCode.NOT_FOUND, ex.getErrorCode());
        assertNotNull(registry.lookup(active));
    }
}
