package vn.com.fecredit.videoupload.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import vn.com.fecredit.videoupload.manager.ConnectionMultiplexer;

import java.net.URI;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint of the upload channel. The last path segment of the handshake URI
 * is the session token; everything else is delegated to the {@link ConnectionMultiplexer}.
 */
@Component
public class UploadWebSocketHandler extends TextWebSocketHandler {

    public static final String PATH_PREFIX = "/ws/upload/";

    private static final Logger log = LoggerFactory.getLogger(UploadWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MILLIS = 10_000;

    private final ConnectionMultiplexer multiplexer;
    private final int sendBufferSizeLimit;
    private final ConcurrentHashMap<String, WebSocketDuplexConnection> connections = new ConcurrentHashMap<>();

    public UploadWebSocketHandler(ConnectionMultiplexer multiplexer,
                                  @Value("${videoupload.max-text-message-bytes:16777216}") int sendBufferSizeLimit) {
        this.multiplexer = multiplexer;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketDuplexConnection connection =
                new WebSocketDuplexConnection(session, SEND_TIME_LIMIT_MILLIS, sendBufferSizeLimit);
        connections.put(session.getId(), connection);
        log.debug("WebSocket connection {} opened from {}", session.getId(), session.getRemoteAddress());
        multiplexer.bind(connection, tokenOf(session.getUri()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketDuplexConnection connection = connections.get(session.getId());
        if (connection == null) {
            log.debug("Message on unknown WebSocket connection {}", session.getId());
            return;
        }
        multiplexer.dispatch(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketDuplexConnection connection = connections.remove(session.getId());
        if (connection != null) {
            multiplexer.unbind(connection, "closed with " + status.getCode());
        }
    }

    static String tokenOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return "";
        }
        String path = uri.getPath();
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
