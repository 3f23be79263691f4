package rs.lukaj.httpipe.connections;

import java.io.IOException;

/**
 * Thrown when the peer closes the connection in the middle of a read. Whatever was received before the close
 * is kept, as it may still be a legitimate (final) piece of data.
 */
public class ConnectionClosedException extends IOException {
    private static final byte[] NONE = new byte[0];

    private final byte[] partial;

    public ConnectionClosedException(String message) {
        this(message, NONE);
    }

    public ConnectionClosedException(String message, byte[] partial) {
        super(message);
        this.partial = partial == null ? NONE : partial;
    }

    /**
     * @return bytes received before the connection was closed; empty if there were none
     */
    public byte[] getPartial() {
        return partial;
    }
}
