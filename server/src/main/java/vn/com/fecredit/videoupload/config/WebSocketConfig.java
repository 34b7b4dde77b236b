package vn.com.fecredit.videoupload.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import vn.com.fecredit.videoupload.websocket.UploadWebSocketHandler;

/**
 * Registers the upload channel at {@code /ws/upload/{sessionToken}}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    // Tomcat reads this context parameter when it creates its WebSocket container
    private static final String TEXT_BUFFER_SIZE_PARAM = "org.apache.tomcat.websocket.textBufferSize";

    private final UploadWebSocketHandler uploadWebSocketHandler;
    private final int maxTextMessageBytes;

    public WebSocketConfig(UploadWebSocketHandler uploadWebSocketHandler,
                           @Value("${videoupload.max-text-message-bytes:16777216}") int maxTextMessageBytes) {
        this.uploadWebSocketHandler = uploadWebSocketHandler;
        this.maxTextMessageBytes = maxTextMessageBytes;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(uploadWebSocketHandler, UploadWebSocketHandler.PATH_PREFIX + "*")
                .setAllowedOrigins("*");
    }

    /**
     * A Base64 chunk frame is a third larger than the chunk; Tomcat's default 8 KiB
     * message buffer would close the connection on the first chunk.
     */
    @Bean
    public WebServerFactoryCustomizer<TomcatServletWebServerFactory> webSocketBufferCustomizer() {
        return factory -> factory.addContextCustomizers(
                context -> context.addParameter(TEXT_BUFFER_SIZE_PARAM, String.valueOf(maxTextMessageBytes)));
    }
}
