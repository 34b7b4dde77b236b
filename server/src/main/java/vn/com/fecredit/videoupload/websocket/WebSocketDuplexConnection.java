package vn.com.fecredit.videoupload.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import vn.com.fecredit.videoupload.port.interfaces.IDuplexConnection;

import java.io.IOException;

/**
 * {@link IDuplexConnection} over a Spring {@link WebSocketSession}. Sends are
 * serialized by a {@link ConcurrentWebSocketSessionDecorator}.
 */
public class WebSocketDuplexConnection implements IDuplexConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketDuplexConnection.class);

    static final CloseStatus REPLACED_STATUS = new CloseStatus(4000, "replaced by a newer connection");
    static final CloseStatus SESSION_UNAVAILABLE_STATUS = new CloseStatus(4004, "upload session unavailable");

    private final WebSocketSession session;

    public WebSocketDuplexConnection(WebSocketSession session, int sendTimeLimitMillis, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, sendBufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(toCloseStatus(reason));
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    static CloseStatus toCloseStatus(CloseReason reason) {
        switch (reason) {
            case REPLACED:
                return REPLACED_STATUS;
            case SESSION_UNAVAILABLE:
                return SESSION_UNAVAILABLE_STATUS;
            case POLICY_VIOLATION:
                return CloseStatus.POLICY_VIOLATION.withReason("too many malformed messages");
            default:
                return CloseStatus.NORMAL;
        }
    }
}
