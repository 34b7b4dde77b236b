package vn.com.fecredit.videoupload.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.core.MessageCodec;
import vn.com.fecredit.videoupload.core.UploadSessionService;
import vn.com.fecredit.videoupload.core.UploadSessionStateMachine;
import vn.com.fecredit.videoupload.core.exception.ErrorCode;
import vn.com.fecredit.videoupload.core.exception.UploadException;
import vn.com.fecredit.videoupload.model.message.ClientMessage;
import vn.com.fecredit.videoupload.model.message.MessageType;
import vn.com.fecredit.videoupload.model.message.ServerMessage;
import vn.com.fecredit.videoupload.model.message.SessionInfo;
import vn.com.fecredit.videoupload.port.interfaces.IDuplexConnection;
import vn.com.fecredit.videoupload.port.interfaces.IDuplexConnection.CloseReason;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes frames between live connections and session state machines.
 *
 * <p>
 * At most one connection is bound to a session token. Binding a second connection
 * replaces the first, which is closed. Unbinding never cancels the session: the client
 * may reconnect and resume.
 */
public class ConnectionMultiplexer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMultiplexer.class);

    private final UploadSessionService sessionService;
    private final MessageCodec codec;
    private final int malformedMessageThreshold;
    // connection id -> binding
    private final ConcurrentHashMap<String, Binding> bindings = new ConcurrentHashMap<>();
    // session token -> live connection
    private final ConcurrentHashMap<String, IDuplexConnection> connectionsByToken = new ConcurrentHashMap<>();

    public ConnectionMultiplexer(UploadSessionService sessionService, MessageCodec codec, int malformedMessageThreshold) {
        this.sessionService = sessionService;
        this.codec = codec;
        this.malformedMessageThreshold = malformedMessageThreshold;
    }

    /**
     * Binds a connection to a session and sends {@code session_info}. When the session
     * cannot accept a connection, an {@code error} is sent and the connection closed.
     *
     * @return true when bound
     */
    public boolean bind(IDuplexConnection connection, String token) {
        SessionInfo info;
        try {
            UploadSessionStateMachine machine = sessionService.activeMachine(token);
            info = machine.describe();
        } catch (UploadException e) {
            log.info("Refused connection {} for session {}: {}", connection.getId(),
                    UploadException.abbreviate(token), e.getErrorCode());
            send(connection, UploadSessionStateMachine.toError(e));
            connection.close(CloseReason.SESSION_UNAVAILABLE);
            return false;
        }

        bindings.put(connection.getId(), new Binding(token));
        IDuplexConnection previous = connectionsByToken.put(token, connection);
        if (previous != null && !previous.getId().equals(connection.getId())) {
            bindings.remove(previous.getId());
            log.info("Connection {} replaced by {} for session {}", previous.getId(), connection.getId(),
                    UploadException.abbreviate(token));
            previous.close(CloseReason.REPLACED);
        }
        log.info("Connection {} bound to session {}", connection.getId(), UploadException.abbreviate(token));
        send(connection, ServerMessage.sessionInfo(info));
        return true;
    }

    /**
     * Handles one inbound text frame and writes every reply back to the same connection.
     */
    public void dispatch(IDuplexConnection connection, String raw) {
        Binding binding = bindings.get(connection.getId());
        if (binding == null) {
            send(connection, ServerMessage.error(ErrorCode.SESSION_NOT_ACTIVE.name(),
                    "Connection is not bound to an upload session", false));
            return;
        }

        ClientMessage message;
        try {
            message = codec.decode(raw);
        } catch (UploadException e) {
            int count = binding.malformedMessages.incrementAndGet();
            log.warn("Malformed message #{} on connection {}: {}", count, connection.getId(), e.getMessage());
            send(connection, UploadSessionStateMachine.toError(e));
            if (count > malformedMessageThreshold) {
                unbind(connection, "too many malformed messages");
                connection.close(CloseReason.POLICY_VIOLATION);
            }
            return;
        }

        List<ServerMessage> replies;
        try {
            replies = sessionService.machineFor(binding.token).handle(message);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} message for session {}", message.getType(),
                    UploadException.abbreviate(binding.token), e);
            replies = List.of(ServerMessage.error(ErrorCode.STORAGE_FAILURE.name(), "Internal server error", true));
        }

        boolean finished = false;
        for (ServerMessage reply : replies) {
            send(connection, reply);
            if (reply.isType(MessageType.UPLOAD_COMPLETE) || reply.isType(MessageType.UPLOAD_CANCELLED)) {
                finished = true;
            }
        }
        if (finished) {
            unbind(connection, "upload finished");
            sessionService.release(binding.token);
            connection.close(CloseReason.NORMAL);
        }
    }

    /**
     * Removes the binding of a connection. The session itself is left untouched.
     */
    public void unbind(IDuplexConnection connection, String reason) {
        Binding binding = bindings.remove(connection.getId());
        if (binding != null) {
            connectionsByToken.remove(binding.token, connection);
            log.info("Connection {} unbound from session {}: {}", connection.getId(),
                    UploadException.abbreviate(binding.token), reason);
        }
    }

    public boolean isBound(String token) {
        return connectionsByToken.containsKey(token);
    }

    public int boundConnectionCount() {
        return bindings.size();
    }

    private void send(IDuplexConnection connection, ServerMessage message) {
        if (!connection.isOpen()) {
            log.debug("Dropping {} message for closed connection {}", message.getType(), connection.getId());
            return;
        }
        try {
            connection.send(codec.encode(message));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send {} message on connection {}: {}", message.getType(), connection.getId(),
                    e.getMessage());
        }
    }

    private static final class Binding {
        private final String token;
        private final AtomicInteger malformedMessages = new AtomicInteger();

        private Binding(String token) {
            this.token = token;
        }
    }
}
