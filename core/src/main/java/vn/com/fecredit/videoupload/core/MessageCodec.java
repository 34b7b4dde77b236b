package vn.com.fecredit.videoupload.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.message.ClientMessage;
import vn.com.fecredit.videoupload.model.message.ServerMessage;

import java.util.Base64;

/**
 * JSON framing of duplex channel messages.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws UploadException MALFORMED_MESSAGE for invalid JSON or a missing {@code type}
     */
    public ClientMessage decode(String raw) {
        ClientMessage message;
        try {
            message = objectMapper.readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new UploadException(ErrorCode.MALFORMED_MESSAGE, "Invalid JSON message: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.getType() == null || message.getType().trim().isEmpty()) {
            throw new UploadException(ErrorCode.MALFORMED_MESSAGE, "Message has no type");
        }
        return message;
    }

    public String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.getType() + " message", e);
        }
    }

    /**
     * @throws UploadException MALFORMED_CHUNK when the payload is missing or not Base64
     */
    public static byte[] decodeChunkData(String base64) {
        if (base64 == null) {
            throw new UploadException(ErrorCode.MALFORMED_CHUNK, "Chunk message has no chunk_data");
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new UploadException(ErrorCode.MALFORMED_CHUNK, "chunk_data is not valid Base64", e);
        }
    }
}
