package github.sarthakdev143.beat_cutter.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.beat_cutter.dto.ChannelEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the live WebSocket connection of every progress client, keyed by a server-issued client id.
 */
@Component
public class ClientChannelRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClientChannelRegistry.class);

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ClientChannelRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String register(WebSocketSession session) {
        String clientId = UUID.randomUUID().toString();
        sessions.put(clientId, session);
        logger.info("Client connected: {}", clientId);
        return clientId;
    }

    public void unregister(String clientId) {
        if (clientId != null && sessions.remove(clientId) != null) {
            logger.info("Client disconnected: {}", clientId);
        }
    }

    public boolean isConnected(String clientId) {
        return clientId != null && sessions.containsKey(clientId);
    }

    /**
     * Handle for the pipeline. Resolves the socket on every send, so a client that disconnects
     * mid-session simply stops receiving events.
     */
    public ClientChannel channelFor(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return ClientChannel.DISCARDING;
        }
        return event -> send(clientId, event);
    }

    void send(String clientId, ChannelEvent event) {
        Optional<WebSocketSession> target = Optional.ofNullable(sessions.get(clientId))
                .filter(WebSocketSession::isOpen);
        if (target.isEmpty()) {
            return;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize {} event for client {}", event.type(), clientId, e);
            return;
        }

        WebSocketSession session = target.get();
        try {
            // WebSocketSession does not allow concurrent sends.
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException | IllegalStateException e) {
            logger.debug("Dropping {} event for client {}: {}", event.type(), clientId, e.getMessage());
        }
    }
}
