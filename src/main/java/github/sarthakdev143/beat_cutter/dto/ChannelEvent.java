package github.sarthakdev143.beat_cutter.dto;

/**
 * Message pushed to a client's progress channel. {@link #type()} is the JSON discriminator.
 */
public interface ChannelEvent {

    String type();
}
