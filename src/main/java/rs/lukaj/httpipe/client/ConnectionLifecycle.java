package rs.lukaj.httpipe.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rs.lukaj.httpipe.connections.Transport;

import java.io.IOException;
import java.time.Duration;

/**
 * Decides what happens to a pipe's connection once a response is over. This is the only place which hands
 * connections back to the pool or closes them, and it does so at most once per request.
 */
final class ConnectionLifecycle {
    private static final Logger log = LogManager.getLogger(ConnectionLifecycle.class);

    private ConnectionLifecycle() {
    }

    /**
     * Finish the request using the pipe's keepalive parameters.
     * @see #finish(Pipe, Duration, int)
     */
    static void finish(Pipe pipe) throws IOException {
        finish(pipe, pipe.keepaliveIdle, pipe.keepalivePoolSize);
    }

    /**
     * Mark the pipe as finished, and either park the connection in the pool (if the response allowed keeping
     * it alive and has been read to its end) or close it. Finishing an already finished pipe does nothing.
     * @param pipe pipe whose request is over
     * @param maxIdle how long the connection may idle in the pool, null for the pool default
     * @param poolSize how many idle connections the pool keeps for the endpoint, non-positive for the pool default
     * @throws IllegalStateException if the pipe was never connected
     * @throws IOException if releasing or closing the connection fails
     */
    static void finish(Pipe pipe, Duration maxIdle, int poolSize) throws IOException {
        if(pipe.eof) {
            log.trace("Pipe already finished, nothing to release");
            return;
        }
        Transport transport = pipe.transport;
        if(pipe.state == PipeState.NOT_READY && !transport.isConnected())
            throw new IllegalStateException("not initialized");
        pipe.eof = true;
        if(!transport.isConnected()) return;
        if(!pipe.keepalive) {
            log.debug("Closing connection, keepalive not allowed");
            transport.close();
        } else if(!isResponseConsumed(pipe)) {
            log.debug("Closing connection, response not read to its end ({})", pipe.state);
            transport.close();
        } else {
            transport.setKeepalive(maxIdle, poolSize);
        }
    }

    //whether nothing of the response is left unread on the connection
    private static boolean isResponseConsumed(Pipe pipe) {
        if(pipe.state == PipeState.EOF) return true;
        return pipe.state == PipeState.READING_BODY
                && ("HEAD".equals(pipe.method) || (!pipe.chunked && pipe.remaining == 0));
    }

    /**
     * Close the pipe's connection unconditionally.
     * @param pipe pipe to close
     * @throws IllegalStateException if the pipe was never connected
     * @throws IOException if closing fails
     */
    static void close(Pipe pipe) throws IOException {
        if(pipe.state == PipeState.NOT_READY && !pipe.transport.isConnected())
            throw new IllegalStateException("not initialized");
        pipe.eof = true;
        pipe.transport.close();
    }

    /**
     * @param pipe pipe to query
     * @return how many times the pipe's current connection has been reused from the pool
     * @throws IllegalStateException if the pipe holds no connection
     * @throws IOException if the transport can't tell
     */
    static int reusedTimes(Pipe pipe) throws IOException {
        if(!pipe.transport.isConnected()) throw new IllegalStateException("not initialized");
        return pipe.transport.getReusedTimes();
    }
}
