package github.sarthakdev143.beat_cutter.progress;

import github.sarthakdev143.beat_cutter.dto.ChannelEvent;

/**
 * Best-effort, at-most-once event channel to one client. Implementations never throw and never
 * buffer: events sent while the client is unreachable are dropped.
 */
@FunctionalInterface
public interface ClientChannel {

    ClientChannel DISCARDING = event -> {
    };

    void send(ChannelEvent event);
}
