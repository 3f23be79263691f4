package rs.lukaj.httpipe.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * {@link Transport} over plain TCP or unix domain sockets, drawing connections from a {@link ConnectionPool}.
 * A transport is meant to be driven by one caller at a time.
 */
public class SocketTransport implements Transport {
    private static final Logger log = LogManager.getLogger(SocketTransport.class);
    public static final int DEFAULT_TIMEOUT = 60_000;

    private static final ConnectionPool DEFAULT_POOL = new KeepalivePool();

    private final ConnectionPool pool;
    private Connection connection;
    private int timeout = DEFAULT_TIMEOUT;

    /**
     * Create a transport using the process-wide default pool.
     */
    public SocketTransport() {
        this(DEFAULT_POOL);
    }

    /**
     * @param pool pool used for reusing connections and parking them after use
     */
    public SocketTransport(ConnectionPool pool) {
        if(pool == null) throw new NullPointerException("Pool can't be null!");
        this.pool = pool;
    }

    /**
     * @return process-wide pool used by transports created without an explicit one
     */
    public static ConnectionPool getDefaultPool() {
        return DEFAULT_POOL;
    }

    @Override
    public void connect(Endpoint endpoint) throws IOException {
        if(connection != null) {
            log.debug("Transport already connected to {}, closing before connecting to {}",
                    connection.getEndpoint(), endpoint);
            close();
        }
        Connection conn = pool.acquire(endpoint);
        if(conn == null) conn = Connection.open(endpoint, timeout);
        conn.setReadTimeout(timeout);
        connection = conn;
    }

    private Connection ensureConnected() throws IOException {
        if(connection == null) throw new IOException("closed");
        return connection;
    }

    @Override
    public int send(byte[] data) throws IOException {
        ensureConnected().write(data);
        return data.length;
    }

    @Override
    public byte[] receive(int size) throws IOException {
        Connection conn = ensureConnected();
        byte[] buf = new byte[size];
        int read = 0;
        while(read < size) {
            int n = conn.read(buf, read, size - read);
            if(n < 0) {
                dropConnection();
                throw new ConnectionClosedException("closed", Arrays.copyOf(buf, read));
            }
            read += n;
        }
        return buf;
    }

    @Override
    public LineReader receiveUntil(String delimiter) throws IOException {
        ensureConnected();
        byte[] delim = delimiter.getBytes(ISO_8859_1);
        if(delim.length == 0) throw new IllegalArgumentException("Empty delimiter");
        return () -> readUntil(delim);
    }

    //input is buffered by the connection, so reading byte by byte is fine
    private String readUntil(byte[] delim) throws IOException {
        Connection conn = ensureConnected();
        ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        int matched = 0;
        while(matched < delim.length) {
            int b = conn.read();
            if(b < 0) {
                byte[] partial = out.toByteArray();
                dropConnection();
                throw new ConnectionClosedException("closed", partial);
            }
            out.write(b);
            if(b == (delim[matched] & 0xff)) matched++;
            else matched = b == (delim[0] & 0xff) ? 1 : 0;
        }
        byte[] line = out.toByteArray();
        return new String(line, 0, line.length - delim.length, ISO_8859_1);
    }

    @Override
    public void setTimeout(int millis) throws IOException {
        if(millis < 0) throw new IllegalArgumentException("Timeout can't be negative: " + millis);
        timeout = millis;
        if(connection != null) connection.setReadTimeout(millis);
    }

    @Override
    public void close() throws IOException {
        if(connection == null) return;
        Connection conn = connection;
        connection = null;
        conn.close();
    }

    @Override
    public void setKeepalive(Duration maxIdle, int poolSize) throws IOException {
        Connection conn = ensureConnected();
        connection = null;
        pool.release(conn, maxIdle, poolSize);
    }

    @Override
    public int getReusedTimes() throws IOException {
        return ensureConnected().getReusedTimes();
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    private void dropConnection() {
        try {
            close();
        } catch (IOException e) {
            log.debug("Error while closing connection after peer closed it", e);
        }
    }
}
