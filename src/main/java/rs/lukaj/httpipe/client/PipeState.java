package rs.lukaj.httpipe.client;

/**
 * Where the response parser of a {@link Pipe} currently is. The only way back is READING_HEADER to BEGIN,
 * taken after a 100 Continue status line.
 */
public enum PipeState {
    NOT_READY(0),
    BEGIN(1),
    READING_HEADER(2),
    READING_BODY(3),
    EOF(4);

    private final int code;

    PipeState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @param other state to compare with
     * @return whether this state comes before the other one in a response
     */
    public boolean precedes(PipeState other) {
        return code < other.code;
    }
}
