package github.sarthakdev143.beat_cutter.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressWebSocketHandlerTest {

    @Mock
    private WebSocketSession socket;

    private final ClientChannelRegistry registry = new ClientChannelRegistry(new ObjectMapper());
    private final ProgressWebSocketHandler handler = new ProgressWebSocketHandler(registry);
    private final Map<String, Object> attributes = new HashMap<>();

    @Test
    void connectingClientReceivesItsId() throws Exception {
        when(socket.getAttributes()).thenReturn(attributes);
        when(socket.isOpen()).thenReturn(true);

        handler.afterConnectionEstablished(socket);

        String clientId = (String) attributes.get(ProgressWebSocketHandler.CLIENT_ID_ATTRIBUTE);
        assertThat(registry.isConnected(clientId)).isTrue();
        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(message.capture());
        assertThat(message.getValue().getPayload())
                .contains("\"type\":\"connected\"")
                .contains("\"clientId\":\"" + clientId + "\"");
    }

    @Test
    void closingTheSocketUnregistersTheClient() throws Exception {
        when(socket.getAttributes()).thenReturn(attributes);
        when(socket.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(socket);
        String clientId = (String) attributes.get(ProgressWebSocketHandler.CLIENT_ID_ATTRIBUTE);

        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);

        assertThat(registry.isConnected(clientId)).isFalse();
    }
}
