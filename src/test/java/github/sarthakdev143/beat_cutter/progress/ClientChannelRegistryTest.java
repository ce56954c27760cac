package github.sarthakdev143.beat_cutter.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.beat_cutter.dto.StatusEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientChannelRegistryTest {

    @Mock
    private WebSocketSession socket;

    private final ClientChannelRegistry registry = new ClientChannelRegistry(new ObjectMapper());

    @Test
    void channelDeliversJsonToTheRegisteredSocket() throws IOException {
        when(socket.isOpen()).thenReturn(true);
        String clientId = registry.register(socket);

        registry.channelFor(clientId).send(StatusEvent.of("Merging video clips..."));

        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket).sendMessage(message.capture());
        assertThat(message.getValue().getPayload())
                .contains("\"type\":\"status\"")
                .contains("\"message\":\"Merging video clips...\"");
    }

    @Test
    void eventsForClosedSocketsAreDropped() throws IOException {
        when(socket.isOpen()).thenReturn(false);
        String clientId = registry.register(socket);

        registry.channelFor(clientId).send(StatusEvent.of("ignored"));

        verify(socket, never()).sendMessage(any());
    }

    @Test
    void eventsAfterUnregisterAreDropped() throws IOException {
        String clientId = registry.register(socket);
        registry.unregister(clientId);

        registry.channelFor(clientId).send(StatusEvent.of("ignored"));

        assertThat(registry.isConnected(clientId)).isFalse();
        verify(socket, never()).sendMessage(any());
    }

    @Test
    void sendFailuresDoNotReachThePipeline() throws IOException {
        when(socket.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(socket).sendMessage(any());
        String clientId = registry.register(socket);

        assertThatCode(() -> registry.channelFor(clientId).send(StatusEvent.of("lost")))
                .doesNotThrowAnyException();
    }

    @Test
    void blankClientIdGetsADiscardingChannel() {
        assertThat(registry.channelFor(null)).isSameAs(ClientChannel.DISCARDING);
        assertThat(registry.channelFor(" ")).isSameAs(ClientChannel.DISCARDING);
    }

    @Test
    void everyRegistrationGetsItsOwnId() {
        String first = registry.register(socket);
        String second = registry.register(socket);

        assertThat(first).isNotEqualTo(second);
        assertThat(registry.isConnected(first)).isTrue();
        assertThat(registry.isConnected(second)).isTrue();
    }
}
