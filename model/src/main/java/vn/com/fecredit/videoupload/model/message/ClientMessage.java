package vn.com.fecredit.videoupload.model.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Frame sent by the uploading client.
 *
 * <p>
 * {@code chunkData} is the Base64 encoding of the chunk bytes. {@code chunkDigest} is an
 * optional lowercase hex SHA-256 of the decoded bytes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClientMessage {
    private String type;
    private Integer chunkIndex;
    private String chunkData;
    private String chunkDigest;

    public ClientMessage() {
    }

    public static ClientMessage chunk(int index, String base64Data, String digest) {
        ClientMessage message = new ClientMessage();
        message.setType(MessageType.CHUNK);
        message.setChunkIndex(index);
        message.setChunkData(base64Data);
        message.setChunkDigest(digest);
        return message;
    }

    public static ClientMessage cancel() {
        ClientMessage message = new ClientMessage();
        message.setType(MessageType.CANCEL);
        return message;
    }

    public boolean isType(String expected) {
        return expected.equals(type);
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public Integer getChunkIndex() { return chunkIndex; }
    public void setChunkIndex(Integer chunkIndex) { this.chunkIndex = chunkIndex; }
    public String getChunkData() { return chunkData; }
    public void setChunkData(String chunkData) { this.chunkData = chunkData; }
    public String getChunkDigest() { return chunkDigest; }
    public void setChunkDigest(String chunkDigest) { this.chunkDigest = chunkDigest; }
}
