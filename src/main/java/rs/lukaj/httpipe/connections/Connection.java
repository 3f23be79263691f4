package rs.lukaj.httpipe.connections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.time.Duration;

/**
 * Represents an open connection to an {@link Endpoint}: either a TCP socket or a unix domain socket.
 * Doesn't implement any HTTP. Connections are owned by a {@link Transport} while in use and by a
 * {@link ConnectionPool} while idle.
 */
public class Connection implements Closeable {
    private static final Logger log = LogManager.getLogger(Connection.class);

    private final Endpoint endpoint;
    private final Socket socket;
    private final SocketChannel channel;
    private final InputStream input;
    private final OutputStream output;

    private final long openedAt;
    private volatile long lastUsedAt;
    private volatile long idleDeadline = Long.MAX_VALUE;
    private int reusedTimes = 0;

    private Connection(Endpoint endpoint, Socket socket, SocketChannel channel, InputStream input, OutputStream output) {
        this.endpoint = endpoint;
        this.socket = socket;
        this.channel = channel;
        this.input = new BufferedInputStream(input);
        this.output = new BufferedOutputStream(output);
        this.openedAt = System.currentTimeMillis();
        this.lastUsedAt = openedAt;
    }

    /**
     * Open a new connection to the given endpoint.
     * @param endpoint endpoint for the connection
     * @param connectTimeout connect timeout in milliseconds, 0 for none
     * @return newly opened connection
     * @throws IOException if connecting fails or times out
     */
    public static Connection open(Endpoint endpoint, int connectTimeout) throws IOException {
        if(endpoint.isUnix()) {
            SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            try {
                channel.connect(UnixDomainSocketAddress.of(endpoint.getSocketPath()));
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            log.debug("Connected to {}", endpoint);
            return new Connection(endpoint, null, channel, Channels.newInputStream(channel), Channels.newOutputStream(channel));
        }
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), connectTimeout);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        log.debug("Connected to {}", endpoint);
        return new Connection(endpoint, socket, null, socket.getInputStream(), socket.getOutputStream());
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Set timeout for blocking reads. Unix domain sockets are read through a channel, which doesn't support read
     * timeouts, so there this is ignored.
     * @param millis timeout in milliseconds, 0 for none
     * @throws IOException
     */
    public void setReadTimeout(int millis) throws IOException {
        if(socket != null) socket.setSoTimeout(millis);
        else log.trace("Read timeout {}ms not applied to unix socket {}", millis, endpoint);
    }

    /**
     * Read a single byte. This method is blocking.
     * @return next byte, or -1 if end of stream has been reached.
     * @throws IOException
     */
    public int read() throws IOException {
        int b = input.read();
        lastUsedAt = System.currentTimeMillis();
        return b;
    }

    /**
     * Read at most len bytes into the buffer, starting at offset.
     * @param buf buffer used for storing read data
     * @param offset data is stored starting on this index
     * @param len maximum number of bytes to read
     * @return number of bytes read, or -1 if end of stream has been reached
     * @throws IOException
     */
    public int read(byte[] buf, int offset, int len) throws IOException {
        int ret = input.read(buf, offset, len);
        lastUsedAt = System.currentTimeMillis();
        return ret;
    }

    /**
     * Write raw bytes and flush the connection.
     * @param bytes data to be sent
     * @throws IOException
     */
    public void write(byte[] bytes) throws IOException {
        output.write(bytes);
        output.flush();
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Get how long is this connection idling, measured from the last read or write.
     * @return idling duration
     */
    public Duration getIdlingTime() {
        return Duration.ofMillis(System.currentTimeMillis() - lastUsedAt);
    }

    /**
     * Get how old is this connection. Age is calculated as duration between the time it was opened and this moment.
     * @return connection age
     */
    public Duration getAge() {
        return Duration.ofMillis(System.currentTimeMillis() - openedAt);
    }

    /**
     * Mark the connection as parked in a pool, allowed to idle for at most maxIdle.
     * @param maxIdle maximum idling time
     */
    void markIdle(Duration maxIdle) {
        lastUsedAt = System.currentTimeMillis();
        idleDeadline = lastUsedAt + maxIdle.toMillis();
    }

    /**
     * @return whether the connection has been idling for longer than allowed when it was parked
     */
    boolean isIdleExpired() {
        return System.currentTimeMillis() > idleDeadline;
    }

    /**
     * Mark the connection as taken out of the pool for another use.
     */
    void markReused() {
        reusedTimes++;
        idleDeadline = Long.MAX_VALUE;
    }

    /**
     * @return number of times this connection has been handed out by a pool
     */
    public int getReusedTimes() {
        return reusedTimes;
    }

    /**
     * Returns whether the underlying socket is closed. You cannot write to nor read from closed connections.
     * @return true if closed, false otherwise
     */
    public boolean isClosed() {
        return socket != null ? socket.isClosed() : !channel.isOpen();
    }

    /**
     * Close the connection. No more data can be read from or written to it.
     * @throws IOException
     */
    @Override
    public void close() throws IOException {
        log.debug("Closing connection to {}", endpoint);
        if(socket != null) socket.close();
        else channel.close();
    }
}
