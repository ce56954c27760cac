package github.sarthakdev143.beat_cutter.dto;

public record ConnectedEvent(String type, String clientId) implements ChannelEvent {

    public static ConnectedEvent of(String clientId) {
        return new ConnectedEvent("connected", clientId);
    }
}
