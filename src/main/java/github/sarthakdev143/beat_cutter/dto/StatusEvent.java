package github.sarthakdev143.beat_cutter.dto;

public record StatusEvent(String type, String message) implements ChannelEvent {

    public static StatusEvent of(String message) {
        return new StatusEvent("status", message);
    }
}
