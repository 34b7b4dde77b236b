package vn.com.fecredit.videoupload.client;

import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.message.ClientMessage;
import vn.com.fecredit.videoupload.model.util.ChecksumUtil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Base64;

/**
 * One slice of the file being uploaded, with its SHA-256 digest.
 */
public class Chunk {
    private final byte[] data;

    private final int index;

    private final String digest;

    public Chunk(byte[] data, int index) {
        this.data = data;
        this.index = index;
        this.digest = ChecksumUtil.generateChecksum(data);
    }

    /**
     * Reads the chunk at {@code index} from an open file channel.
     *
     * @throws IOException when the file is shorter than the layout expects
     */
    public static Chunk read(FileChannel channel, ChunkLayout layout, int index) throws IOException {
        byte[] buffer = new byte[layout.expectedLength(index)];
        ByteBuffer byteBuffer = ByteBuffer.wrap(buffer);
        long position = layout.offsetOf(index);
        while (byteBuffer.hasRemaining()) {
            int read = channel.read(byteBuffer, position + byteBuffer.position());
            if (read < 0) {
                throw new IOException("Failed to read chunk " + index + ": file ended early");
            }
        }
        return new Chunk(buffer, index);
    }

    public ClientMessage toMessage() {
        return ClientMessage.chunk(index, Base64.getEncoder().encodeToString(data), digest);
    }

    public byte[] getData() {
        return data;
    }

    public int getIndex() {
        return index;
    }

    public String getDigest() {
        return digest;
    }
}
