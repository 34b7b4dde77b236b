package vn.com.fecredit.videoupload.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.videoupload.model.ChunkLayout;
import vn.com.fecredit.videoupload.model.CreateSessionRequest;
import vn.com.fecredit.videoupload.model.UploadSessionResponse;
import vn.com.fecredit.videoupload.model.message.MessageType;
import vn.com.fecredit.videoupload.model.message.Progress;
import vn.com.fecredit.videoupload.model.message.ServerMessage;
import vn.com.fecredit.videoupload.model.message.SessionInfo;
import vn.com.fecredit.videoupload.model.message.UploadComplete;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Client for the video upload service with resume capability.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Session creation over REST, chunk transfer over one WebSocket connection</li>
 * <li>SHA-256 digest on every chunk</li>
 * <li>Resume of an interrupted upload, sending only the chunks the server lacks</li>
 * <li>Retry of chunks the server reports as retryable</li>
 * <li>Progress tracking</li>
 * </ul>
 *
 * <p>
 * Usage:
 * <pre>
 * VideoUploadClient client = new VideoUploadClient.Builder()
 *     .baseUrl("http://server:8080")
 *     .username("user")
 *     .password("pass")
 *     .build();
 *
 * UploadResult result = client.upload(filePath);
 * </pre>
 */
public class VideoUploadClient {

    private static final Logger log = LoggerFactory.getLogger(VideoUploadClient.class);

    static final String SESSION_PATH = "/api/upload/session";
    static final String CHANNEL_PATH = "/ws/upload/";

    /**
     * Receives a call for every chunk the server acknowledged.
     */
    public interface ProgressListener {
        void onProgress(int chunkIndex, int receivedChunks, int totalChunks);
    }

    /**
     * Open duplex connection bound to one upload session.
     */
    public interface UploadChannel extends AutoCloseable {
        void send(String text) throws IOException;

        @Override
        void close();
    }

    /**
     * Inbound side of an {@link UploadChannel}. Calls arrive on the transport's threads.
     */
    public interface ChannelListener {
        void onMessage(String text);

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }

    /**
     * Pluggable transport layer for talking to the upload server.
     *
     * <p>
     * Separates the HTTP and WebSocket plumbing from the upload protocol, so tests can
     * drive the client against a scripted server.
     *
     * @see DefaultUploadTransport
     */
    public interface UploadTransport {
        /**
         * Calls {@code POST /api/upload/session}.
         *
         * @param request     filename, size and optional chunk size
         * @param baseUrl     server root URL (e.g. http://host:port)
         * @param encodedAuth Basic auth credentials encoded in Base64
         * @return the created session
         */
        UploadSessionResponse createSession(CreateSessionRequest request, String baseUrl, String encodedAuth)
                throws IOException, InterruptedException;

        /**
         * Calls {@code DELETE /api/upload/session/{token}}.
         */
        void cancelSession(String sessionToken, String baseUrl, String encodedAuth)
                throws IOException, InterruptedException;

        /**
         * Opens the WebSocket channel of a session.
         *
         * @param channelUri {@code ws://host:port/ws/upload/{token}}
         * @param listener   receives every inbound frame and the close of the channel
         */
        UploadChannel openChannel(URI channelUri, ChannelListener listener) throws IOException, InterruptedException;
    }

    public static class DefaultUploadTransport implements UploadTransport {
        private final ObjectMapper objectMapper;

        private final HttpClient httpClient;

        /**
         * @param httpClient custom HttpClient, or null for a default one
         */
        public DefaultUploadTransport(HttpClient httpClient) {
            this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
            this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
        }

        @Override
        public UploadSessionResponse createSession(CreateSessionRequest request, String baseUrl, String encodedAuth)
                throws IOException, InterruptedException {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + SESSION_PATH))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Basic " + encodedAuth)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
                    .build();
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("Failed to create upload session: HTTP " + response.statusCode() + " "
                        + response.body());
            }
            return objectMapper.readValue(response.body(), UploadSessionResponse.class);
        }

        @Override
        public void cancelSession(String sessionToken, String baseUrl, String encodedAuth)
                throws IOException, InterruptedException {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + SESSION_PATH + "/" + sessionToken))
                    .header("Authorization", "Basic " + encodedAuth)
                    .DELETE()
                    .build();
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("Failed to cancel upload session: HTTP " + response.statusCode() + " "
                        + response.body());
            }
        }

        @Override
        public UploadChannel openChannel(URI channelUri, ChannelListener listener)
                throws IOException, InterruptedException {
            try {
                WebSocket webSocket = httpClient.newWebSocketBuilder()
                        .buildAsync(channelUri, new ListenerAdapter(listener))
                        .get();
                return new WebSocketChannel(webSocket);
            } catch (ExecutionException e) {
                throw new IOException("Failed to open upload channel " + channelUri, e.getCause());
            }
        }
    }

    /**
     * Reassembles fragmented text frames before handing them on.
     */
    static class ListenerAdapter implements WebSocket.Listener {
        private final ChannelListener listener;
        private final StringBuilder partial = new StringBuilder();

        ListenerAdapter(ChannelListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                listener.onMessage(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    static class WebSocketChannel implements UploadChannel {
        private final WebSocket webSocket;

        WebSocketChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void send(String text) throws IOException {
            try {
                webSocket.sendText(text, true).get();
            } catch (ExecutionException e) {
                throw new IOException("Failed to send frame", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while sending frame");
            }
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "done").exceptionally(e -> {
                    log.debug("Closing upload channel failed: {}", e.getMessage());
                    return null;
                });
            }
        }
    }

    private final String baseUrl;
    private final String encodedAuth;
    private final Integer chunkSize;
    private final int retryTimes;
    private final Duration replyTimeout;
    private final ProgressListener progressListener;
    private final UploadTransport transport;
    private final ObjectMapper objectMapper;

    private VideoUploadClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.chunkSize = builder.chunkSize;
        this.retryTimes = builder.retryTimes;
        this.replyTimeout = builder.replyTimeout;
        this.progressListener = builder.progressListener;
        this.encodedAuth = Base64.getEncoder()
                .encodeToString((builder.username + ":" + builder.password).getBytes(StandardCharsets.UTF_8));
        this.transport = builder.transport != null ? builder.transport : new DefaultUploadTransport(builder.httpClient);
        this.objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    /**
     * Creates a session for the file and uploads every chunk.
     *
     * @param filePath path to the file to be uploaded; must exist and not be empty
     * @return the server's confirmation of the stored file
     * @throws IllegalArgumentException if the file is missing or empty
     * @throws UploadClientException    if the upload fails
     */
    public UploadResult upload(Path filePath) {
        long fileSize = checkFile(filePath);
        UploadSessionResponse session;
        try {
            session = transport.createSession(
                    new CreateSessionRequest(filePath.getFileName().toString(), fileSize, chunkSize),
                    baseUrl, encodedAuth);
        } catch (IOException e) {
            throw new UploadClientException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadClientException("Failed to create upload session: interrupted", e);
        }
        log.info("Created upload session for {} ({} bytes, {} chunks)", filePath.getFileName(), fileSize,
                session.getTotalChunks());
        return transfer(filePath, session.getSessionToken());
    }

    /**
     * Resumes an interrupted upload. The server reports which chunks it lacks and only
     * those are sent.
     *
     * @param filePath     the same file as the original upload
     * @param sessionToken token returned when the session was created
     */
    public UploadResult resume(Path filePath, String sessionToken) {
        checkFile(filePath);
        if (sessionToken == null || sessionToken.isEmpty()) {
            throw new IllegalArgumentException("sessionToken is required");
        }
        return transfer(filePath, sessionToken);
    }

    /**
     * Cancels a session. Cancelling an already cancelled session succeeds.
     */
    public void cancel(String sessionToken) {
        try {
            transport.cancelSession(sessionToken, baseUrl, encodedAuth);
        } catch (IOException e) {
            throw new UploadClientException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadClientException("Failed to cancel upload session: interrupted", e);
        }
    }

    private long checkFile(Path filePath) {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            throw new IllegalArgumentException("filePath is required and must exist");
        }
        try {
            long size = Files.size(filePath);
            if (size == 0) {
                throw new IllegalArgumentException("File is empty: " + filePath);
            }
            return size;
        } catch (IOException e) {
            throw new UploadClientException("Failed to read file size of " + filePath, e);
        }
    }

    private UploadResult transfer(Path filePath, String sessionToken) {
        ChannelEvents events = new ChannelEvents();
        try (UploadChannel channel = transport.openChannel(channelUri(sessionToken), events);
             FileChannel file = FileChannel.open(filePath, StandardOpenOption.READ)) {
            SessionInfo info = awaitSessionInfo(events);
            if (info.getFileSize() != file.size()) {
                throw new UploadClientException("Failed to resume upload: local file has " + file.size()
                        + " bytes, session expects " + info.getFileSize());
            }
            ChunkLayout layout = new ChunkLayout(info.getFileSize(), info.getChunkSize());
            List<Integer> missing = info.getMissingChunks() == null ? List.of() : info.getMissingChunks();
            log.info("Upload channel open: {} of {} chunks missing", missing.size(), layout.totalChunks);

            // with nothing missing, a resend makes the server retry finalization
            List<Integer> toSend = missing.isEmpty() ? List.of(0) : missing;
            TransferState state = new TransferState();
            for (int index : toSend) {
                sendChunk(channel, events, Chunk.read(file, layout, index), state);
            }
            if (state.complete == null) {
                throw new UploadClientException("Failed to upload: server did not confirm completion");
            }
            log.info("Upload complete: video {} ({} chunk frames sent)", state.complete.getVideoId(), state.sent);
            return new UploadResult(sessionToken, state.complete.getVideoId(), state.complete.getFilename(),
                    state.complete.getSize(), state.sent);
        } catch (IOException e) {
            throw new UploadClientException("Failed to upload: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadClientException("Failed to upload: interrupted", e);
        }
    }

    private SessionInfo awaitSessionInfo(ChannelEvents events) throws InterruptedException {
        ServerMessage first = events.next(replyTimeout);
        if (first.isType(MessageType.ERROR)) {
            throw serverError(first);
        }
        if (!first.isType(MessageType.SESSION_INFO)) {
            throw new UploadClientException("Failed to start upload: unexpected " + first.getType() + " message");
        }
        return objectMapper.convertValue(first.getData(), SessionInfo.class);
    }

    /**
     * Sends one chunk and reads replies until the server acknowledged it. A retryable
     * error, including a failed finalization after the last chunk, resends the chunk.
     */
    private void sendChunk(UploadChannel channel, ChannelEvents events, Chunk chunk, TransferState state)
            throws IOException, InterruptedException {
        String frame = objectMapper.writeValueAsString(chunk.toMessage());
        for (int attempt = 0; ; attempt++) {
            channel.send(frame);
            state.sent++;
            ServerMessage error = awaitAcknowledgement(events, chunk.getIndex(), state);
            if (error == null) {
                return;
            }
            boolean retryable = Boolean.TRUE.equals(error.getRetryable());
            if (!retryable || attempt >= retryTimes) {
                throw serverError(error);
            }
            log.warn("Chunk {} failed with {}, retrying ({}/{})", chunk.getIndex(), error.getCode(), attempt + 1,
                    retryTimes);
        }
    }

    /**
     * @return null once the chunk is acknowledged, or the error the server replied with
     */
    private ServerMessage awaitAcknowledgement(ChannelEvents events, int chunkIndex, TransferState state)
            throws InterruptedException {
        while (true) {
            ServerMessage message = events.next(replyTimeout);
            String type = message.getType() == null ? "" : message.getType();
            switch (type) {
                case MessageType.PROGRESS: {
                    Progress progress = objectMapper.convertValue(message.getData(), Progress.class);
                    if (progressListener != null) {
                        progressListener.onProgress(progress.getChunkIndex(), progress.getReceivedChunks(),
                                progress.getTotalChunks());
                    }
                    if (progress.getChunkIndex() == chunkIndex
                            && progress.getReceivedChunks() < progress.getTotalChunks()) {
                        return null;
                    }
                    // every chunk is in: upload_complete or an error follows
                    break;
                }
                case MessageType.UPLOAD_COMPLETE:
                    state.complete = objectMapper.convertValue(message.getData(), UploadComplete.class);
                    return null;
                case MessageType.ERROR:
                    return message;
                case MessageType.UPLOAD_CANCELLED:
                    throw new UploadClientException("CANCELLED", "Failed to upload: session was cancelled", null);
                default:
                    log.debug("Ignoring {} message while waiting for chunk {}", type, chunkIndex);
            }
        }
    }

    private UploadClientException serverError(ServerMessage error) {
        return new UploadClientException(error.getCode(),
                "Failed to upload: " + error.getCode() + " " + error.getMessage(), null);
    }

    URI channelUri(String sessionToken) {
        URI base = URI.create(baseUrl);
        String scheme = "https".equalsIgnoreCase(base.getScheme()) ? "wss" : "ws";
        String path = base.getRawPath() == null ? "" : base.getRawPath();
        return URI.create(scheme + "://" + base.getRawAuthority() + path + CHANNEL_PATH + sessionToken);
    }

    private static class TransferState {
        int sent;
        UploadComplete complete;
    }

    /**
     * Queues inbound frames, the close and transport errors for the uploading thread.
     */
    private class ChannelEvents implements ChannelListener {
        private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();

        @Override
        public void onMessage(String text) {
            queue.add(text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            queue.add(new Closed(statusCode, reason));
        }

        @Override
        public void onError(Throwable error) {
            queue.add(error);
        }

        ServerMessage next(Duration timeout) throws InterruptedException {
            Object event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (event == null) {
                throw new UploadClientException("Failed to upload: no reply from server within " + timeout);
            }
            if (event instanceof Closed) {
                Closed closed = (Closed) event;
                throw new UploadClientException("Failed to upload: channel closed with " + closed.statusCode
                        + " " + closed.reason);
            }
            if (event instanceof Throwable) {
                throw new UploadClientException("Failed to upload: channel error", (Throwable) event);
            }
            try {
                return objectMapper.readValue((String) event, ServerMessage.class);
            } catch (JsonProcessingException e) {
                throw new UploadClientException("Failed to upload: unreadable server message", e);
            }
        }
    }

    private static class Closed {
        final int statusCode;
        final String reason;

        Closed(int statusCode, String reason) {
            this.statusCode = statusCode;
            this.reason = reason;
        }
    }

    /**
     * Builder for VideoUploadClient instances.
     *
     * <p>
     * Required: baseUrl, username, password. Optional: chunkSize (server default when
     * unset), retryTimes (default 2), replyTimeout (default 60 s), progressListener,
     * httpClient, transport.
     */
    public static class Builder {
        private String baseUrl;
        private String username;
        private String password;
        private Integer chunkSize;
        private int retryTimes = 2;
        private Duration replyTimeout = Duration.ofSeconds(60);
        private ProgressListener progressListener;
        private HttpClient httpClient;
        private UploadTransport transport;

        /**
         * @param baseUrl server root URL (e.g. http://server:8080)
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder chunkSize(Integer chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Sets how many times a chunk is resent after a retryable error.
         */
        public Builder retryTimes(int retryTimes) {
            this.retryTimes = retryTimes;
            return this;
        }

        public Builder replyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder transport(UploadTransport transport) {
            this.transport = transport;
            return this;
        }

        public VideoUploadClient build() {
            if (baseUrl == null || username == null || password == null) {
                throw new IllegalStateException("baseUrl, username, and password are required");
            }
            return new VideoUploadClient(this);
        }
    }
}
