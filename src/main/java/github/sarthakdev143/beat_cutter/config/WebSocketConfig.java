package github.sarthakdev143.beat_cutter.config;

import github.sarthakdev143.beat_cutter.progress.ProgressWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String PROGRESS_ENDPOINT = "/ws/progress";

    private final ProgressWebSocketHandler progressWebSocketHandler;
    private final BeatCutterProperties properties;

    public WebSocketConfig(ProgressWebSocketHandler progressWebSocketHandler, BeatCutterProperties properties) {
        this.progressWebSocketHandler = progressWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(progressWebSocketHandler, PROGRESS_ENDPOINT)
                .setAllowedOrigins(properties.allowedOrigins().toArray(String[]::new));
    }
}
