package vn.com.fecredit.videoupload.model;

/**
 * Result of recording a chunk arrival in the registry.
 */
public class ChunkReceipt {
    /** Number of distinct chunk indices received so far */
    public final int receivedChunks;
    /** Total number of chunks of the session */
    public final int totalChunks;
    /** False when the index had already been recorded */
    public final boolean firstArrival;

    public ChunkReceipt(int receivedChunks, int totalChunks, boolean firstArrival) {
        this.receivedChunks = receivedChunks;
        this.totalChunks = totalChunks;
        this.firstArrival = firstArrival;
    }

    public boolean isComplete() {
        return receivedChunks == totalChunks;
    }
}
