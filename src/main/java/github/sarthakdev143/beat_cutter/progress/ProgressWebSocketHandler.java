package github.sarthakdev143.beat_cutter.progress;

import github.sarthakdev143.beat_cutter.dto.ConnectedEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    static final String CLIENT_ID_ATTRIBUTE = "beatCutter.clientId";

    private final ClientChannelRegistry registry;

    public ProgressWebSocketHandler(ClientChannelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String clientId = registry.register(session);
        session.getAttributes().put(CLIENT_ID_ATTRIBUTE, clientId);
        registry.channelFor(clientId).send(ConnectedEvent.of(clientId));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.unregister((String) session.getAttributes().get(CLIENT_ID_ATTRIBUTE));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        registry.unregister((String) session.getAttributes().get(CLIENT_ID_ATTRIBUTE));
    }
}
