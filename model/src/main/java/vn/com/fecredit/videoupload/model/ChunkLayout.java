package vn.com.fecredit.videoupload.model;

/**
 * Chunk arithmetic for a file of a given size split into fixed-size chunks.
 *
 * <p>
 * Every chunk is {@code chunkSize} bytes long except the last one, which holds the
 * remainder. For a 10,000,000 byte file and 1 MiB chunks there are 10 chunks and the
 * last one is 657,616 bytes.
 */
public class ChunkLayout {
    /** The total size of the file in bytes */
    public final long fileSize;
    /** The size of each chunk in bytes */
    public final int chunkSize;
    /** The total number of chunks, ceil(fileSize / chunkSize) */
    public final int totalChunks;

    /**
     * @param fileSize  total file size in bytes, must be positive
     * @param chunkSize chunk size in bytes, must be positive
     * @throws IllegalArgumentException if either size is not positive or the file needs
     *                                  more than {@link Integer#MAX_VALUE} chunks
     */
    public ChunkLayout(long fileSize, int chunkSize) {
        if (fileSize <= 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("File size and chunk size must be positive: fileSize="
                    + fileSize + ", chunkSize=" + chunkSize);
        }
        long chunks = (fileSize + chunkSize - 1) / chunkSize;
        if (chunks > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many chunks: " + chunks);
        }
        this.fileSize = fileSize;
        this.chunkSize = chunkSize;
        this.totalChunks = (int) chunks;
    }

    public boolean isValidIndex(int index) {
        return index >= 0 && index < totalChunks;
    }

    public boolean isLastChunk(int index) {
        return index == totalChunks - 1;
    }

    /**
     * @return absolute byte offset of the chunk inside the file
     */
    public long offsetOf(int index) {
        checkIndex(index);
        return (long) index * chunkSize;
    }

    /**
     * @return number of bytes the chunk must carry
     */
    public int expectedLength(int index) {
        checkIndex(index);
        if (isLastChunk(index)) {
            return (int) (fileSize - (long) index * chunkSize);
        }
        return chunkSize;
    }

    private void checkIndex(int index) {
        if (!isValidIndex(index)) {
            throw new IllegalArgumentException("Invalid chunk index: " + index + ", totalChunks: " + totalChunks);
        }
    }
}
