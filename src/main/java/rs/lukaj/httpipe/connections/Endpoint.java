package rs.lukaj.httpipe.connections;

import java.util.Objects;

/**
 * Endpoint to which connections are connected. Consists of host and port, or of a path to a unix domain socket.
 * No name resolution happens here; that's left for the moment the connection is actually opened.
 */
public class Endpoint {
    public static final String UNIX_PREFIX = "unix:";

    private final String host;
    private final int port;
    private final String socketPath;

    private Endpoint(String host, int port, String socketPath) {
        this.host = host;
        this.port = port;
        this.socketPath = socketPath;
    }

    /**
     * Create a new TCP endpoint
     * @param host hostname or address of the server
     * @param port port on which to connect (e.g. 80 for HTTP)
     * @return new endpoint
     */
    public static Endpoint of(String host, int port) {
        if(host == null) throw new NullPointerException("Host can't be null!");
        if(port < 1 || port > 65535) throw new IllegalArgumentException("Port out of range: " + port);
        return new Endpoint(host, port, null);
    }

    /**
     * Create a new endpoint pointing to a unix domain socket.
     * @param target socket path, with or without the leading "unix:"
     * @return new endpoint
     */
    public static Endpoint unix(String target) {
        if(target == null) throw new NullPointerException("Socket path can't be null!");
        String path = target.startsWith(UNIX_PREFIX) ? target.substring(UNIX_PREFIX.length()) : target;
        if(path.isEmpty()) throw new IllegalArgumentException("Empty unix socket path");
        return new Endpoint(null, -1, path);
    }

    /**
     * @param target connect target
     * @return whether the target names a unix domain socket
     */
    public static boolean isUnixTarget(String target) {
        return target != null && target.startsWith(UNIX_PREFIX);
    }

    public boolean isUnix() {
        return socketPath != null;
    }
    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public String getSocketPath() {
        return socketPath;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Endpoint)) return false;
        Endpoint other = (Endpoint)obj;
        return port == other.port && Objects.equals(host, other.host) && Objects.equals(socketPath, other.socketPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, socketPath);
    }

    @Override
    public String toString() {
        return isUnix() ? UNIX_PREFIX + socketPath : host + ":" + port;
    }
}
