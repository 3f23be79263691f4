package rs.lukaj.httpipe.connections;

import java.io.IOException;

/**
 * Reads consecutive delimiter-terminated lines from a {@link Transport}. Obtained through
 * {@link Transport#receiveUntil(String)} and reusable for as long as the connection stays open.
 */
@FunctionalInterface
public interface LineReader {
    /**
     * Read up to the next delimiter. The delimiter itself is consumed, but not returned.
     * @return line without the delimiter, possibly empty
     * @throws ConnectionClosedException if the peer closes the connection before the delimiter arrives
     * @throws IOException on any other transport error
     */
    String readLine() throws IOException;
}
