package vn.com.fecredit.videoupload.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.manager.SessionPolicy;
import vn.com.fecredit.videoupload.manager.SessionRegistry;
import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.CreateSessionRequest;
import vn.com.fecredit.videoupload.model.SessionStatus;
import vn.com.fecredit.videoupload.model.UploadCompletedEvent;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.model.message.ClientMessage;
import vn.com.fecredit.videoupload.model.message.MessageType;
import vn.com.fecredit.videoupload.model.message.Progress;
import vn.com.fecredit.videoupload.model.message.ServerMessage;
import vn.com.fecredit.videoupload.model.message.SessionInfo;
import vn.com.fecredit.videoupload.model.message.UploadComplete;
import vn.com.fecredit.videoupload.model.util.ChecksumUtil;
import vn.com.fecredit.videoupload.port.impl.DefaultCompletedUploadPort;
import vn.com.fecredit.videoupload.port.impl.DefaultUploadSessionPort;
import vn.com.fecredit.videoupload.port.interfaces.IUploadEventPort;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadSessionStateMachineTest {

    private static final int CHUNK_SIZE = 1024;

    @TempDir
    Path tempDir;

    @Mock
    private IUploadEventPort eventPort;

    private MutableClock clock;
    private SessionRegistry registry;
    private ChunkBuffer buffer;
    private DefaultCompletedUploadPort catalog;
    private UploadSessionService service;
    private byte[] source;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new SessionRegistry(new DefaultUploadSessionPort(), SessionPolicy.defaults(), clock);
        buffer = spy(new ChunkBuffer(registry, tempDir.resolve("in-progress").toString(),
                tempDir.resolve("complete").toString()));
        catalog = spy(new DefaultCompletedUploadPort());
        service = new UploadSessionService(registry, buffer, catalog, eventPort, 2);
        source = UploadTestSupport.randomBytes(10 * CHUNK_SIZE - 300, 11L);
    }

    private IUploadSession newSession(String owner) {
        return service.createSession(owner, new CreateSessionRequest("clip.mp4", source.length, CHUNK_SIZE));
    }

    private byte[] chunk(IUploadSession session, int index) {
        return UploadTestSupport.chunkOf(source, session.layout(), index);
    }

    private List<ServerMessage> send(IUploadSession session, int index) {
        byte[] data = chunk(session, index);
        return service.machineFor(session.getToken()).acceptChunk(index, data, ChecksumUtil.generateChecksum(data));
    }

    @Test
    void testReverseOrderUpload_CompletesOnceWithIdenticalArtifact() throws IOException {
        IUploadSession session = newSession("alice");
        String token = session.getToken();

        List<ServerMessage> replies = null;
        for (int i = 9; i >= 0; i--) {
            replies = send(session, i);
        }

        assertNotNull(replies);
        assertEquals(2, replies.size());
        Progress progress = (Progress) replies.get(0).getData();
        assertEquals(1.0, progress.getProgress());
        assertEquals(10, progress.getReceivedChunks());
        assertTrue(replies.get(1).isType(MessageType.UPLOAD_COMPLETE));
        UploadComplete complete = (UploadComplete) replies.get(1).getData();
        assertEquals("clip.mp4", complete.getFilename());
        assertEquals(source.length, complete.getSize());

        IUploadSession completed = registry.lookup(token);
        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getCompletedAt());
        assertEquals(complete.getVideoId(), completed.getVideoId());
        assertTrue(completed.isCompletionNotified());
        assertArrayEquals(source, Files.readAllBytes(Path.of(completed.getFinalPath())));

        ArgumentCaptor<UploadCompletedEvent> captor = ArgumentCaptor.forClass(UploadCompletedEvent.class);
        verify(eventPort, times(1)).publishUploadCompleted(captor.capture());
        assertEquals(token, captor.getValue().getSessionToken());
        assertEquals("metadata_extraction", captor.getValue().getAnalysisType());
        assertEquals(1, catalog.size());

        UploadException late = assertThrows(UploadException.class, () -> send(session, 0));
        assertEquals(ErrorCode.SESSION_NOT_ACTIVE, late.getErrorCode());
        verifyNoMoreInteractions(eventPort);
    }

    @Test
    void testDuplicateChunk_CountedOnce() {
        IUploadSession session = newSession("alice");

        send(session, 4);
        send(session, 4);
        List<ServerMessage> replies = send(session, 4);

        Progress progress = (Progress) replies.get(0).getData();
        assertEquals(1, progress.getReceivedChunks());
        assertEquals(0.1, progress.getProgress(), 1e-9);
        assertEquals(1, registry.lookup(session.getToken()).getReceivedChunks());
    }

    @Test
    void testConflictingResend_RejectedBeforeStorage() throws IOException {
        IUploadSession session = newSession("alice");
        send(session, 0);
        byte[] other = new byte[CHUNK_SIZE];
        Arrays.fill(other, (byte) 7);

        UploadSessionStateMachine machine = service.machineFor(session.getToken());
        UploadException ex = assertThrows(UploadException.class,
                () -> machine.acceptChunk(0, other, ChecksumUtil.generateChecksum(other)));

        assertEquals(ErrorCode.CHUNK_DIGEST_MISMATCH, ex.getErrorCode());
        byte[] staged = Files.readAllBytes(buffer.stagingPath(session));
        assertArrayEquals(chunk(session, 0), Arrays.copyOfRange(staged, 0, CHUNK_SIZE));
    }

    @Test
    void testResendWithoutDigest_LastWriteWins() throws IOException {
        IUploadSession session = newSession("alice");
        UploadSessionStateMachine machine = service.machineFor(session.getToken());
        byte[] other = new byte[CHUNK_SIZE];
        Arrays.fill(other, (byte) 7);

        machine.acceptChunk(0, chunk(session, 0), null);
        machine.acceptChunk(0, other, null);

        byte[] staged = Files.readAllBytes(buffer.stagingPath(session));
        assertArrayEquals(other, Arrays.copyOfRange(staged, 0, CHUNK_SIZE));
        assertEquals(1, registry.lookup(session.getToken()).getReceivedChunks());
    }

    @Test
    void testDigestNotMatchingPayload_Rejected() {
        IUploadSession session = newSession("alice");
        UploadSessionStateMachine machine = service.machineFor(session.getToken());

        UploadException ex = assertThrows(UploadException.class,
                () -> machine.acceptChunk(1, chunk(session, 1), ChecksumUtil.generateChecksum("something else")));

        assertEquals(ErrorCode.CHUNK_DIGEST_MISMATCH, ex.getErrorCode());
        assertEquals(0, registry.lookup(session.getToken()).getReceivedChunks());
    }

    @Test
    void testCancelAfterHalf_DiscardsAndRejectsFurtherChunks() {
        IUploadSession session = newSession("alice");
        for (int i = 0; i < 5; i++) {
            send(session, i);
        }
        Path partPath = buffer.stagingPath(session);
        assertTrue(Files.exists(partPath));

        List<ServerMessage> replies = service.machineFor(session.getToken()).handle(ClientMessage.cancel());

        assertEquals(1, replies.size());
        assertTrue(replies.get(0).isType(MessageType.UPLOAD_CANCELLED));
        assertEquals(SessionStatus.CANCELLED, registry.lookup(session.getToken()).getStatus());
        assertFalse(Files.exists(partPath));
        UploadException ex = assertThrows(UploadException.class, () -> send(session, 5));
        assertEquals(ErrorCode.SESSION_NOT_ACTIVE, ex.getErrorCode());
        // repeated cancel is a no-op
        assertFalse(service.cancel("alice", session.getToken()));
        verifyNoInteractions(eventPort);
    }

    @Test
    void testCancelAfterCompletion_NotActive() {
        IUploadSession session = newSession("alice");
        for (int i = 0; i < 10; i++) {
            send(session, i);
        }

        UploadException ex = assertThrows(UploadException.class, () -> service.cancel("alice", session.getToken()));
        assertEquals(ErrorCode.SESSION_NOT_ACTIVE, ex.getErrorCode());
        assertEquals(SessionStatus.COMPLETED, registry.lookup(session.getToken()).getStatus());
    }

    @Test
    void testFinalizeFailure_RevertsToActiveAndResendCompletes() {
        IUploadSession session = newSession("alice");
        doThrow(new UploadException(ErrorCode.FINALIZE_FAILED, "disk full"))
                .doCallRealMethod()
                .when(buffer).finalizeUpload(anyString());

        List<ServerMessage> replies = null;
        for (int i = 0; i < 10; i++) {
            replies = send(session, i);
        }

        assertEquals(2, replies.size());
        ServerMessage error = replies.get(1);
        assertTrue(error.isType(MessageType.ERROR));
        assertEquals("FINALIZE_FAILED", error.getCode());
        assertTrue(error.getRetryable());
        assertEquals(SessionStatus.ACTIVE, registry.lookup(session.getToken()).getStatus());
        verifyNoInteractions(eventPort);

        List<ServerMessage> retry = send(session, 3);

        assertTrue(retry.get(1).isType(MessageType.UPLOAD_COMPLETE));
        assertEquals(SessionStatus.COMPLETED, registry.lookup(session.getToken()).getStatus());
        verify(eventPort, times(1)).publishUploadCompleted(any());
    }

    @Test
    void testCatalogFailureAfterRename_ResendOfLastChunkKeepsArtifact() throws IOException {
        IUploadSession session = newSession("alice");
        doThrow(new IllegalStateException("catalog unavailable"))
                .doCallRealMethod()
                .when(catalog).recordCompletedUpload(any(), any());

        List<ServerMessage> replies = null;
        for (int i = 0; i < 10; i++) {
            replies = send(session, i);
        }
        assertEquals("FINALIZE_FAILED", replies.get(1).getCode());
        assertTrue(replies.get(1).getRetryable());
        assertEquals(SessionStatus.ACTIVE, registry.lookup(session.getToken()).getStatus());
        assertTrue(buffer.isFinalized(session));

        List<ServerMessage> retry = send(session, 9);

        assertTrue(retry.get(1).isType(MessageType.UPLOAD_COMPLETE));
        IUploadSession completed = registry.lookup(session.getToken());
        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertFalse(Files.exists(buffer.stagingPath(session)));
        assertArrayEquals(source, Files.readAllBytes(Path.of(completed.getFinalPath())));
        verify(eventPort, times(1)).publishUploadCompleted(any());
        assertEquals(1, catalog.size());
    }

    @Test
    void testCatalogFailureAfterRename_ResendOfMiddleChunkCompletes() throws IOException {
        IUploadSession session = newSession("alice");
        doThrow(new IllegalStateException("catalog unavailable"))
                .doCallRealMethod()
                .when(catalog).recordCompletedUpload(any(), any());
        for (int i = 0; i < 10; i++) {
            send(session, i);
        }

        List<ServerMessage> retry = send(session, 4);

        assertEquals(10, ((Progress) retry.get(0).getData()).getReceivedChunks());
        assertTrue(retry.get(1).isType(MessageType.UPLOAD_COMPLETE));
        IUploadSession completed = registry.lookup(session.getToken());
        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertArrayEquals(source, Files.readAllBytes(Path.of(completed.getFinalPath())));
    }

    @Test
    void testWriteWithoutStagingFile_StorageFailure() {
        IUploadSession session = newSession("alice");
        buffer.discard(session);

        UploadException ex = assertThrows(UploadException.class, () -> send(session, 2));

        assertEquals(ErrorCode.STORAGE_FAILURE, ex.getErrorCode());
        assertFalse(Files.exists(buffer.stagingPath(session)));
        assertEquals(0, registry.lookup(session.getToken()).getReceivedChunks());
    }

    @Test
    void testConcurrentChunks_CompleteExactlyOnce() throws Exception {
        IUploadSession session = newSession("alice");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<ServerMessage>>> tasks = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                int index = i;
                tasks.add(() -> send(session, index));
                tasks.add(() -> send(session, index));
            }
            int completions = 0;
            for (Future<List<ServerMessage>> future : executor.invokeAll(tasks)) {
                List<ServerMessage> replies;
                try {
                    replies = future.get();
                } catch (ExecutionException e) {
                    // a duplicate arriving after completion
                    UploadException cause = (UploadException) e.getCause();
                    assertEquals(ErrorCode.SESSION_NOT_ACTIVE, cause.getErrorCode());
                    continue;
                }
                completions += replies.stream().filter(m -> m.isType(MessageType.UPLOAD_COMPLETE)).count();
            }

            assertEquals(1, completions);
        } finally {
            executor.shutdownNow();
        }
        IUploadSession completed = registry.lookup(session.getToken());
        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertArrayEquals(source, Files.readAllBytes(Path.of(completed.getFinalPath())));
        verify(eventPort, times(1)).publishUploadCompleted(any());
    }

    @Test
    void testCancelDuringFinalize_WaitsAndLoses() throws Exception {
        IUploadSession first = newSession("alice");
        IUploadSession second = newSession("bob");
        CountDownLatch finalizing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            finalizing.countDown();
            assertTrue(release.await(10, TimeUnit.SECONDS));
            return invocation.callRealMethod();
        }).when(buffer).finalizeUpload(eq(first.getToken()));
        for (int i = 0; i < 9; i++) {
            send(first, i);
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<List<ServerMessage>> lastChunk = executor.submit(() -> send(first, 9));
            assertTrue(finalizing.await(10, TimeUnit.SECONDS));
            Future<Boolean> cancel = executor.submit(() -> service.cancel("alice", first.getToken()));

            assertThrows(TimeoutException.class, () -> cancel.get(200, TimeUnit.MILLISECONDS));
            assertEquals(SessionStatus.COMPLETING, registry.lookup(first.getToken()).getStatus());
            // the stalled session does not hold up another one
            for (int i = 0; i < 5; i++) {
                send(second, i);
            }
            assertEquals(5, registry.lookup(second.getToken()).getReceivedChunks());

            release.countDown();

            assertTrue(lastChunk.get(10, TimeUnit.SECONDS).get(1).isType(MessageType.UPLOAD_COMPLETE));
            ExecutionException ex = assertThrows(ExecutionException.class, () -> cancel.get(10, TimeUnit.SECONDS));
            assertEquals(ErrorCode.SESSION_NOT_ACTIVE, ((UploadException) ex.getCause()).getErrorCode());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        IUploadSession completed = registry.lookup(first.getToken());
        assertEquals(SessionStatus.COMPLETED, completed.getStatus());
        assertArrayEquals(source, Files.readAllBytes(Path.of(completed.getFinalPath())));
        assertEquals(SessionStatus.ACTIVE, registry.lookup(second.getToken()).getStatus());
    }

    @Test
    void testFinalizeFailure_FatalAfterAttemptLimit() {
        IUploadSession session = newSession("alice");
        doThrow(new UploadException(ErrorCode.FINALIZE_FAILED, "disk full"))
                .when(buffer).finalizeUpload(anyString());

        List<ServerMessage> replies = null;
        for (int i = 0; i < 10; i++) {
            replies = send(session, i);
        }
        assertTrue(replies.get(1).getRetryable());

        List<ServerMessage> second = send(session, 0);

        assertEquals("FINALIZE_FAILED", second.get(1).getCode());
        assertFalse(second.get(1).getRetryable());
        assertEquals(SessionStatus.ACTIVE, registry.lookup(session.getToken()).getStatus());
    }

    @Test
    void testHandle_RejectsUnknownKindsAndMalformedChunks() {
        IUploadSession session = newSession("alice");
        UploadSessionStateMachine machine = service.machineFor(session.getToken());

        ClientMessage ping = new ClientMessage();
        ping.setType("ping");
        assertEquals("UNKNOWN_MESSAGE_KIND", machine.handle(ping).get(0).getCode());

        ClientMessage badData = ClientMessage.chunk(0, "%%% not base64 %%%", null);
        assertEquals("MALFORMED_CHUNK", machine.handle(badData).get(0).getCode());

        ClientMessage noIndex = ClientMessage.chunk(0, Base64.getEncoder().encodeToString(chunk(session, 0)), null);
        noIndex.setChunkIndex(null);
        assertEquals("MALFORMED_CHUNK", machine.handle(noIndex).get(0).getCode());

        ClientMessage wrongSize = ClientMessage.chunk(0, Base64.getEncoder().encodeToString(new byte[10]), null);
        ServerMessage error = machine.handle(wrongSize).get(0);
        assertEquals("CHUNK_SIZE_MISMATCH", error.getCode());
        assertFalse(error.getRetryable());

        ClientMessage valid = ClientMessage.chunk(0, Base64.getEncoder().encodeToString(chunk(session, 0)), null);
        assertTrue(machine.handle(valid).get(0).isType(MessageType.PROGRESS));
    }

    @Test
    void testExpiredSession_RejectsChunkAndDiscardsStaging() {
        IUploadSession session = newSession("alice");
        send(session, 0);
        clock.advance(Duration.ofHours(25));

        UploadException ex = assertThrows(UploadException.class, () -> send(session, 1));

        assertEquals(ErrorCode.EXPIRED, ex.getErrorCode());
        assertEquals(SessionStatus.EXPIRED, registry.lookup(session.getToken()).getStatus());
        assertFalse(Files.exists(buffer.stagingPath(session)));
    }

    @Test
    void testSweep_ExpiresAndDiscardsStaging() {
        IUploadSession session = newSession("alice");
        send(session, 0);
        clock.advance(Duration.ofHours(25));

        assertEquals(1, service.sweepExpired());

        assertEquals(SessionStatus.EXPIRED, registry.lookup(session.getToken()).getStatus());
        assertFalse(Files.exists(buffer.stagingPath(session)));
        assertEquals(0, service.liveMachineCount());
        UploadException ex = assertThrows(UploadException.class, () -> service.activeMachine(session.getToken()));
        assertEquals(ErrorCode.EXPIRED, ex.getErrorCode());
    }

    @Test
    void testPurgeRetained_RemovesLeftoverStaging() {
        IUploadSession session = newSession("alice");
        send(session, 0);
        service.release(session.getToken());
        clock.advance(Duration.ofHours(25));
        registry.lookup(session.getToken());
        assertTrue(Files.exists(buffer.stagingPath(session)));
        clock.advance(Duration.ofDays(8));

        assertEquals(1, service.purgeRetained());

        assertFalse(Files.exists(buffer.stagingPath(session)));
        assertThrows(UploadException.class, () -> registry.lookup(session.getToken()));
    }

    @Test
    void testDescribe_ListsMissingChunks() {
        IUploadSession session = newSession("alice");
        send(session, 0);
        send(session, 5);
        send(session, 9);

        SessionInfo info = service.activeMachine(session.getToken()).describe();

        assertEquals(3, info.getUploadedChunks());
        assertEquals(List.of(1, 2, 3, 4, 6, 7, 8), info.getMissingChunks());
        assertEquals(session.getExpiresAt(), info.getExpiresAt());
    }

    @Test
    void testSessionsAreIsolated() throws IOException {
        IUploadSession first = newSession("alice");
        IUploadSession second = newSession("bob");
        for (int i = 0; i < 5; i++) {
            send(first, i);
            send(second, i);
        }

        service.cancel("alice", first.getToken());
        for (int i = 5; i < 10; i++) {
            send(second, i);
        }

        assertEquals(SessionStatus.CANCELLED, registry.lookup(first.getToken()).getStatus());
        IUploadSession done = registry.lookup(second.getToken());
        assertEquals(SessionStatus.COMPLETED, done.getStatus());
        assertArrayEquals(source, Files.readAllBytes(Path.of(done.getFinalPath())));
    }

    @Test
    void testLookup_OtherOwnerSeesNotFound() {
        IUploadSession session = newSession("alice");

        UploadException ex = assertThrows(UploadException.class, () -> service.lookup("bob", session.getToken()));
        assertEquals(ErrorCode.NOT_FOUND, ex.getErrorCode());
        assertThrows(UploadException.class, () -> service.cancel("bob", session.getToken()));
        assertEquals(SessionStatus.ACTIVE, service.lookup("alice", session.getToken()).getStatus());
    }

    @Test
    void testLayoutOfTenMegabyteFile() {
        IUploadSession session = service.createSession("alice", new CreateSessionRequest("big.mp4", 10_000_000L, null));
        ChunkLayout layout = session.layout();

        assertEquals(10, layout.totalChunks);
        assertEquals(657_616, layout.expectedLength(9));
        assertEquals(9L * 1_048_576, layout.offsetOf(9));
    }
}
