package rs.lukaj.httpipe.connections;

import java.io.IOException;
import java.time.Duration;

/**
 * Byte-stream connection to a single endpoint, as used by the protocol engine. Implementations don't know anything
 * about HTTP; they move bytes and hand the connection back to a keepalive pool when asked to.
 * <br/>
 * A transport is created unconnected. {@link #connect(Endpoint)} either reuses a pooled connection to the same
 * endpoint or opens a new one. After {@link #setKeepalive(Duration, int)} or {@link #close()} the transport is
 * unconnected again and may be connected anew.
 */
public interface Transport {

    /**
     * Connect to the endpoint, reusing an idle pooled connection if there is one. The current timeout is used as
     * the connect timeout.
     * @param endpoint where to connect
     * @throws IOException if the connection cannot be established
     */
    void connect(Endpoint endpoint) throws IOException;

    /**
     * Send all the bytes to the peer.
     * @param data bytes to send
     * @return number of bytes sent
     * @throws IOException if not connected or writing fails
     */
    int send(byte[] data) throws IOException;

    /**
     * Receive exactly {@code size} bytes, blocking until all of them arrive.
     * @param size number of bytes to receive
     * @return received bytes
     * @throws ConnectionClosedException if the peer closes the connection first; carries what was received
     * @throws IOException on any other error, including timeouts
     */
    byte[] receive(int size) throws IOException;

    /**
     * Create a reader returning consecutive chunks of input terminated by the delimiter.
     * @param delimiter line delimiter, e.g. CRLF
     * @return reusable line reader bound to this transport
     * @throws IOException if not connected
     */
    LineReader receiveUntil(String delimiter) throws IOException;

    /**
     * Set the timeout for subsequent connect, send and receive operations.
     * @param millis timeout in milliseconds; 0 means no timeout
     * @throws IOException if applying the timeout to the open connection fails
     */
    void setTimeout(int millis) throws IOException;

    /**
     * Close the connection outright. Closing an unconnected transport does nothing.
     * @throws IOException if closing fails
     */
    void close() throws IOException;

    /**
     * Hand the connection back to the keepalive pool instead of closing it.
     * @param maxIdle how long the connection may stay idle in the pool; null for the pool's default
     * @param poolSize maximum number of idle connections kept for the endpoint; non-positive for the pool's default
     * @throws IOException if not connected
     */
    void setKeepalive(Duration maxIdle, int poolSize) throws IOException;

    /**
     * @return how many times the current connection has been taken from the pool; 0 for a fresh connection
     * @throws IOException if not connected
     */
    int getReusedTimes() throws IOException;

    /**
     * @return whether the transport currently holds a connection
     */
    boolean isConnected();
}
