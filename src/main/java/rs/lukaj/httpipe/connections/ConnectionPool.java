package rs.lukaj.httpipe.connections;

import java.io.IOException;
import java.time.Duration;

/**
 * Keeps idle {@link Connection}s around so they can be reused for later requests to the same {@link Endpoint}.
 */
public interface ConnectionPool {
    /**
     * Take an idle connection to the endpoint out of the pool. Connections handed out are no longer owned by the
     * pool; they're returned using {@link #release(Connection, Duration, int)} or closed by the caller.
     * @param endpoint endpoint to which connection should go
     * @return idle connection, or null if there are none
     */
    Connection acquire(Endpoint endpoint);

    /**
     * Park the connection in the pool.
     * @param connection connection which is no longer in use
     * @param maxIdle how long the connection may idle before being closed; null for the pool default
     * @param poolSize how many idle connections to keep for the connection's endpoint; non-positive for the pool
     *                 default. If the pool is full, the least recently used connection is closed
     * @throws IOException if closing an evicted connection fails
     */
    void release(Connection connection, Duration maxIdle, int poolSize) throws IOException;

    /**
     * @return number of idle connections currently in pool
     */
    int getPoolSize();
}
