package github.sarthakdev143.beat_cutter.exception;

import java.io.IOException;

public class MediaProbeException extends IOException {

    public MediaProbeException(String message) {
        super(message);
    }

    public MediaProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
