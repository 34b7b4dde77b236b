package vn.com.fecredit.videoupload.port.interfaces;

import java.io.IOException;

/**
 * A live, text-framed duplex connection (a WebSocket in the server).
 */
public interface IDuplexConnection {

    /**
     * Why the server closes a connection.
     */
    enum CloseReason {
        /** The upload finished or was cancelled */
        NORMAL,
        /** A newer connection bound the same session */
        REPLACED,
        /** The session cannot accept a binding (unknown, expired, not active) */
        SESSION_UNAVAILABLE,
        /** Too many malformed frames */
        POLICY_VIOLATION
    }

    /**
     * @return identifier unique among live connections
     */
    String getId();

    boolean isOpen();

    /**
     * Sends one text frame. Implementations must allow calls from several threads.
     */
    void send(String text) throws IOException;

    void close(CloseReason reason);
}
