package vn.com.fecredit.videoupload.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.manager.SessionRegistry;
import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.interfaces.IUploadSession;
import vn.com.fecredit.videoupload.model.util.ChecksumUtil;
import vn.com.fecredit.videoupload.model.util.FileNameValidator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Positional storage of chunk bytes.
 *
 * <p>
 * Each session owns one staging file {@code <inprogress>/<owner>/<name>.part}, sized to
 * the declared file size when allocated. Chunks are written at their absolute offset, so
 * arrival order does not matter and a resend overwrites the same range. Completion
 * state is read from the {@link SessionRegistry}; the buffer keeps none.
 *
 * <p>
 * Not thread-safe per session: callers hold the session lock.
 */
public class ChunkBuffer {

    private static final Logger log = LoggerFactory.getLogger(ChunkBuffer.class);
    private static final String PART_SUFFIX = ".part";
    private static final int STORAGE_NAME_LENGTH = 32;

    private final SessionRegistry registry;
    private final Path inProgressDir;
    private final Path completeDir;

    public ChunkBuffer(SessionRegistry registry, String inProgressDirPath, String completeDirPath) throws IOException {
        this.registry = registry;
        this.inProgressDir = Paths.get(inProgressDirPath);
        this.completeDir = Paths.get(completeDirPath);
        Files.createDirectories(this.inProgressDir);
        Files.createDirectories(this.completeDir);
    }

    public Path stagingPath(IUploadSession session) {
        return inProgressDir.resolve(FileNameValidator.toPathSegment(session.getOwnerId()))
                .resolve(storageName(session.getToken()) + PART_SUFFIX);
    }

    public Path finalPath(IUploadSession session) {
        return completeDir.resolve(FileNameValidator.toPathSegment(session.getOwnerId()))
                .resolve(storageName(session.getToken()) + FileNameValidator.extensionOf(session.getFilename()));
    }

    /**
     * Creates the sparse staging file for a new session.
     */
    public Path allocate(String token) {
        IUploadSession session = registry.lookup(token);
        Path partPath = stagingPath(session);
        try {
            createParentDirectory(partPath);
            try (FileChannel ch = FileChannel.open(partPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                if (ch.size() < session.getFileSize()) {
                    ch.write(ByteBuffer.wrap(new byte[1]), session.getFileSize() - 1);
                }
            }
        } catch (IOException e) {
            throw new UploadException(ErrorCode.STORAGE_FAILURE, "Could not allocate staging file", e);
        }
        log.debug("Allocated staging file {} ({} bytes)", partPath, session.getFileSize());
        return partPath;
    }

    /**
     * Writes one chunk at its absolute offset.
     *
     * The staging file must exist: only {@link #allocate(String)} creates it.
     *
     * @throws UploadException CHUNK_SIZE_MISMATCH when the length is not the expected
     *                         length of that index, STORAGE_FAILURE on I/O errors or a
     *                         missing staging file
     */
    public void write(String token, int chunkIndex, byte[] data) {
        IUploadSession session = registry.lookup(token);
        ChunkLayout layout = session.layout();
        if (!layout.isValidIndex(chunkIndex)) {
            throw new UploadException(ErrorCode.INVALID_CHUNK_INDEX,
                    "Invalid chunk index: " + chunkIndex + ", totalChunks: " + layout.totalChunks);
        }
        validateChunkSize(chunkIndex, layout, data);

        Path partPath = stagingPath(session);
        long offset = layout.offsetOf(chunkIndex);
        log.debug("Writing chunk: session={}, chunkIndex={}, length={}, offset={}",
                UploadException.abbreviate(token), chunkIndex, data.length, offset);
        try {
            try (FileChannel ch = FileChannel.open(partPath, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                long position = offset;
                while (buffer.hasRemaining()) {
                    position += ch.write(buffer, position);
                }
            }
        } catch (NoSuchFileException e) {
            throw new UploadException(ErrorCode.STORAGE_FAILURE, "No staging file for chunk " + chunkIndex, e);
        } catch (IOException e) {
            throw new UploadException(ErrorCode.STORAGE_FAILURE, "Failed to write chunk " + chunkIndex, e);
        }
    }

    /**
     * @return true once the staging file was renamed to its final location
     */
    public boolean isFinalized(IUploadSession session) {
        return !Files.exists(stagingPath(session)) && Files.exists(finalPath(session));
    }

    public boolean isComplete(String token) {
        IUploadSession session = registry.lookup(token);
        return session.getReceivedChunks() >= session.getTotalChunks();
    }

    /**
     * Flushes the staging file and renames it to its final location. Calling it again
     * after success returns the same path without touching storage.
     *
     * @throws UploadException INCOMPLETE if chunks are missing, FINALIZE_FAILED on I/O errors
     */
    public Path finalizeUpload(String token) {
        IUploadSession session = registry.lookup(token);
        Path partPath = stagingPath(session);
        Path finalPath = finalPath(session);
        if (isFinalized(session)) {
            log.debug("Session {} already finalized at {}", UploadException.abbreviate(token), finalPath);
            return finalPath;
        }
        if (session.getReceivedChunks() < session.getTotalChunks()) {
            throw new UploadException(ErrorCode.INCOMPLETE, "Upload incomplete: " + session.getReceivedChunks()
                    + " of " + session.getTotalChunks() + " chunks received");
        }
        try {
            try (FileChannel ch = FileChannel.open(partPath, StandardOpenOption.WRITE)) {
                if (ch.size() != session.getFileSize()) {
                    throw new IOException("Staging file has " + ch.size() + " bytes, expected " + session.getFileSize());
                }
                ch.force(true);
            }
            createParentDirectory(finalPath);
            try {
                Files.move(partPath, finalPath, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported from {} to {}, falling back to replace", partPath, finalPath);
                Files.move(partPath, finalPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UploadException(ErrorCode.FINALIZE_FAILED, "Failed to finalize upload: " + e.getMessage(), e);
        }
        log.info("Finalized session {} to {}", UploadException.abbreviate(token), finalPath);
        return finalPath;
    }

    /**
     * Deletes the staging file if present.
     *
     * @return true if a file was deleted
     */
    public boolean discard(String token) {
        return discard(registry.lookup(token));
    }

    public boolean discard(IUploadSession session) {
        Path partPath = stagingPath(session);
        try {
            boolean deleted = Files.deleteIfExists(partPath);
            if (deleted) {
                log.debug("Discarded staging file {}", partPath);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to delete staging file {}: {}", partPath, e.getMessage());
            return false;
        }
    }

    private void validateChunkSize(int chunkIndex, ChunkLayout layout, byte[] data) {
        int actual = data != null ? data.length : -1;
        int expected = layout.expectedLength(chunkIndex);
        if (actual != expected) {
            if (layout.isLastChunk(chunkIndex)) {
                throw new UploadException(ErrorCode.CHUNK_SIZE_MISMATCH,
                        "Invalid last chunk size: expected " + expected + " bytes, got " + actual);
            }
            throw new UploadException(ErrorCode.CHUNK_SIZE_MISMATCH,
                    "Invalid chunk size for chunk " + chunkIndex + ": expected " + expected + " bytes, got " + actual);
        }
    }

    private static String storageName(String token) {
        return ChecksumUtil.generateChecksum(token).substring(0, STORAGE_NAME_LENGTH);
    }

    private void createParentDirectory(Path path) throws IOException {
        Path parentDir = path.getParent();
        if (parentDir != null && !Files.exists(parentDir)) {
            log.debug("Creating parent directory: {}", parentDir);
            Files.createDirectories(parentDir);
        }
    }
}
