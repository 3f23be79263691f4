package rs.lukaj.httpipe.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Connection pool which can be configured using values in {@link Config}. Idle connections are kept per endpoint,
 * most recently used first.
 * @inheritDoc
 */
public class KeepalivePool implements ConnectionPool {
    private static final Logger log = LogManager.getLogger(KeepalivePool.class);

    private final Map<Endpoint, Deque<Connection>> connections = new HashMap<>();
    private final Object lock = new Object();
    private Config config;

    public KeepalivePool(Config config) {
        this.config = config;
    }
    public KeepalivePool() {
        this.config = new Config();
    }
    public KeepalivePool(Duration maxIdleTime, int poolSize) {
        this.config = new Config(maxIdleTime, poolSize);
    }

    /**
     * Returns config for this connection pool. This method can be used to change parameters for this pool. Changes
     * apply to connections released afterwards.
     * @return config for this connection pool
     */
    public Config getConfig() {
        return config;
    }

    /**
     * Sets new config by replacing current config object.
     * @param config new config
     */
    public void setConfig(Config config) {
        this.config = config;
    }

    @Override
    public Connection acquire(Endpoint endpoint) {
        synchronized (lock) {
            Deque<Connection> idle = connections.get(endpoint);
            if(idle == null) return null;
            Connection conn;
            while((conn = idle.pollFirst()) != null) {
                if(isStale(conn)) {
                    closeQuietly(conn);
                    continue;
                }
                conn.markReused();
                log.debug("Reusing connection to {} ({} times)", endpoint, conn.getReusedTimes());
                return conn;
            }
            connections.remove(endpoint);
            return null;
        }
    }

    @Override
    public void release(Connection connection, Duration maxIdle, int poolSize) throws IOException {
        if(connection.isClosed()) return;
        Duration idleTime = maxIdle != null ? maxIdle : config.maxIdleTime;
        int size = poolSize > 0 ? poolSize : config.poolSize;
        Connection evicted = null;
        synchronized (lock) {
            cleanupConnections();
            Deque<Connection> idle = connections.computeIfAbsent(connection.getEndpoint(), e -> new ArrayDeque<>());
            connection.markIdle(idleTime);
            idle.addFirst(connection);
            if(idle.size() > size) evicted = idle.pollLast();
        }
        log.debug("Released connection to {} into pool", connection.getEndpoint());
        if(evicted != null) {
            log.debug("Pool for {} is full, closing least recently used connection", evicted.getEndpoint());
            evicted.close();
        }
    }

    @Override
    public int getPoolSize() {
        synchronized (lock) {
            cleanupConnections();
            int count = 0;
            for(Deque<Connection> idle : connections.values()) count += idle.size();
            return count;
        }
    }

    /**
     * Close all idle connections and empty the pool.
     */
    public void clear() {
        synchronized (lock) {
            for(Deque<Connection> idle : connections.values()) {
                for(Connection conn : idle) closeQuietly(conn);
            }
            connections.clear();
        }
    }

    private boolean isStale(Connection conn) {
        return conn.isClosed() || conn.isIdleExpired() || conn.getAge().compareTo(config.maxAge) > 0;
    }

    //must hold the lock
    private void cleanupConnections() {
        for(Iterator<Deque<Connection>> pools = connections.values().iterator(); pools.hasNext(); ) {
            Deque<Connection> idle = pools.next();
            for(Iterator<Connection> it = idle.iterator(); it.hasNext(); ) {
                Connection conn = it.next();
                if(isStale(conn)) {
                    closeQuietly(conn);
                    it.remove();
                }
            }
            if(idle.isEmpty()) pools.remove();
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (IOException e) {
            log.debug("Error while closing stale connection to {}", conn.getEndpoint(), e);
        }
    }


    public static class Config {
        private Duration maxIdleTime = Duration.ofSeconds(60);
        private int poolSize = 30;
        private Duration maxAge = Duration.ofHours(2);

        public Config() {
        }

        public Config(Duration maxIdleTime, int poolSize) {
            setMaxIdleTime(maxIdleTime);
            setPoolSize(poolSize);
        }

        /**
         * Sets default time a released connection can stay idle in the pool. If connection is idling for more
         * than maxIdleTime, it will be closed on the next occasion and won't be used again.
         * @param maxIdleTime maximum idling time
         */
        public void setMaxIdleTime(Duration maxIdleTime) {
            if(maxIdleTime == null || maxIdleTime.isNegative() || maxIdleTime.isZero())
                throw new InvalidConfigException("maxIdleTime must be positive!");
            this.maxIdleTime = maxIdleTime;
        }

        /**
         * Sets default maximum number of idle connections kept for a single endpoint.
         * @param poolSize maximum idle connections per endpoint
         */
        public void setPoolSize(int poolSize) {
            if(poolSize < 1) throw new InvalidConfigException("poolSize must be positive!");
            this.poolSize = poolSize;
        }

        /**
         * Sets maximum connection age. Age is calculated as a period between the time connection was opened and now.
         * If connection is older than maxAge, it won't be handed out again.
         * @param maxAge maximum age connection can live for
         */
        public void setMaxAge(Duration maxAge) {
            if(maxAge == null || maxAge.isNegative() || maxAge.isZero())
                throw new InvalidConfigException("maxAge must be positive!");
            this.maxAge = maxAge;
        }

        public Duration getMaxIdleTime() {
            return maxIdleTime;
        }
        public int getPoolSize() {
            return poolSize;
        }
        public Duration getMaxAge() {
            return maxAge;
        }
    }
}
