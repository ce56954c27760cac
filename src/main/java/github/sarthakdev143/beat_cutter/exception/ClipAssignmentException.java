package github.sarthakdev143.beat_cutter.exception;

public class ClipAssignmentException extends RuntimeException {

    public ClipAssignmentException(String message) {
        super(message);
    }
}
