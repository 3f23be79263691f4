package rs.lukaj.httpipe.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rs.lukaj.httpipe.Utils;
import rs.lukaj.httpipe.connections.Endpoint;
import rs.lukaj.httpipe.connections.InvalidConfigException;
import rs.lukaj.httpipe.connections.LineReader;
import rs.lukaj.httpipe.connections.SocketTransport;
import rs.lukaj.httpipe.connections.Transport;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Drives HTTP/1.x requests and responses over a single {@link Transport}. Simplest use:
 * <pre>
 *     Pipe pipe = new Pipe();
 *     HttpResponse response = pipe.request("example.org", 80, new RequestOptions().setPath("/index.html"));
 * </pre>
 * The response can also be pulled event by event using {@link #read()}, or its body piece by piece using
 * {@link #readBody()}, if the request was made with {@link Http.StreamMode#FULL} or {@link Http.StreamMode#BODY}.
 * <br/>
 * Once a response has been read to its end the connection goes back to the transport's keepalive pool, unless
 * the server asked for it to be closed. The same pipe can then be used for another request.
 * <br/>
 * Pipes are not thread-safe; one pipe is meant to be driven by one caller at a time.
 */
public class Pipe {
    private static final Logger log = LogManager.getLogger(Pipe.class);
    public static final int DEFAULT_CHUNK_SIZE = 8192;

    //state below is shared with ResponseReader and ConnectionLifecycle
    final Transport transport;
    final int chunkSize;
    PipeState state = PipeState.NOT_READY;
    LineReader lineReader;
    Integer readTimeout;
    long remaining;
    boolean chunked;
    boolean keepalive = true;
    String method;
    boolean eof;
    Duration keepaliveIdle;
    int keepalivePoolSize;

    /**
     * Create a pipe over a new {@link SocketTransport} using the default pool, reading the body in pieces of
     * at most {@value #DEFAULT_CHUNK_SIZE} bytes.
     */
    public Pipe() {
        this(new SocketTransport(), DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize maximum size of a single body piece returned by {@link #read()}
     */
    public Pipe(int chunkSize) {
        this(new SocketTransport(), chunkSize);
    }

    /**
     * @param transport transport used for all requests made through this pipe
     */
    public Pipe(Transport transport) {
        this(transport, DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param transport transport used for all requests made through this pipe
     * @param chunkSize maximum size of a single body piece returned by {@link #read()}
     */
    public Pipe(Transport transport, int chunkSize) {
        if(transport == null) throw new NullPointerException("Transport can't be null!");
        if(chunkSize < 1) throw new InvalidConfigException("chunkSize must be positive!");
        this.transport = transport;
        this.chunkSize = chunkSize;
    }

    /**
     * Set the parameters used when the connection is handed back to the pool at the end of a response.
     * @param maxIdle how long the connection may idle in the pool, null for the pool default
     * @param poolSize how many idle connections to keep for the endpoint, non-positive for the pool default
     * @return this, to allow chaining
     */
    public Pipe configureKeepalive(Duration maxIdle, int poolSize) {
        this.keepaliveIdle = maxIdle;
        this.keepalivePoolSize = poolSize;
        return this;
    }

    /**
     * Set timeout for the following transport operations.
     * @param millis timeout in milliseconds
     * @throws IOException if the transport can't apply it
     */
    public void setTimeout(int millis) throws IOException {
        transport.setTimeout(millis);
    }

    /**
     * Make a request to host:port.
     * @param host server host, also used as the default Host header
     * @param port server port
     * @param options request options; null for a plain GET /
     * @return response, read according to the stream mode in options
     * @throws IOException if connecting, sending or reading fails
     * @throws InvalidRequestException if the HTTP version is invalid or the body doesn't match its length
     */
    public HttpResponse request(String host, int port, RequestOptions options) throws IOException {
        return request(Endpoint.of(host, port), host, options);
    }

    /**
     * Make a plain GET / request to host:port.
     * @see #request(String, int, RequestOptions)
     */
    public HttpResponse request(String host, int port) throws IOException {
        return request(host, port, null);
    }

    /**
     * Make a request over a unix domain socket.
     * @param target socket path in the form "unix:/path/to/socket"
     * @param options request options; null for a plain GET /
     * @return response, read according to the stream mode in options
     * @throws IOException if connecting, sending or reading fails
     * @throws InvalidRequestException if target isn't a unix socket path, the HTTP version is invalid or the body
     *                                 doesn't match its length
     */
    public HttpResponse request(String target, RequestOptions options) throws IOException {
        if(!Endpoint.isUnixTarget(target))
            throw new InvalidRequestException("expecting a port or a unix: socket path, but seen " + target);
        return request(Endpoint.unix(target), "localhost", options);
    }

    /**
     * Make a plain GET / request over a unix domain socket.
     * @see #request(String, RequestOptions)
     */
    public HttpResponse request(String target) throws IOException {
        return request(target, null);
    }

    private HttpResponse request(Endpoint endpoint, String host, RequestOptions options) throws IOException {
        if(options == null) options = new RequestOptions();
        Http.Version.fromSelector(options.getVersion());

        transport.setTimeout(options.getTimeout());
        transport.connect(endpoint);
        if(options.getSendTimeout() != null) transport.setTimeout(options.getSendTimeout());
        readTimeout = options.getReadTimeout();

        RequestEncoder.EncodedRequest request = RequestEncoder.encode(options, host);
        method = request.getMethod();
        eof = false;
        chunked = false;
        remaining = 0;
        keepalive = true;
        lineReader = null;
        log.debug("{} {} on {}", method, options.getPath(), endpoint);

        transport.send(request.getHead());
        if(options.getBody() != null) {
            transport.send(options.getBody().getBytes(UTF_8));
        } else if(options.getBodyProducer() != null) {
            sendBody(options.getBodyProducer(), request.getContentLength());
        }

        state = PipeState.BEGIN;
        if(options.getStream() == Http.StreamMode.FULL) return HttpResponse.empty();
        if(options.getStream() == Http.StreamMode.BODY) return response((status, headers) -> true, null);
        return response();
    }

    //pulls exactly length bytes from the producer
    private void sendBody(BodyProducer producer, long length) throws IOException {
        if(length == 0) log.warn("Request body producer set, but Content-Length is 0; body not sent");
        long left = length;
        while(left > 0) {
            byte[] chunk = producer.next();
            if(chunk == null) break;
            if(chunk.length > left) {
                close();
                throw new InvalidRequestException("Request body is longer than Content-Length " + length);
            }
            left -= chunk.length;
            transport.send(chunk);
        }
        if(left > 0) {
            close();
            throw new InvalidRequestException("Request body ended " + left + " bytes short of Content-Length " + length);
        }
    }

    /**
     * Read the next part of the response.
     * @return next event
     * @throws IllegalStateException if no request has been made yet
     * @throws IOException if the transport fails, the peer closes the connection in the middle of a body, or the
     *                     response framing is invalid ({@link java.net.ProtocolException})
     */
    public ResponseEvent read() throws IOException {
        if(state == PipeState.NOT_READY) throw new IllegalStateException("not ready");
        if(readTimeout != null) transport.setTimeout(readTimeout);

        ResponseReader.StateHandler handler = ResponseReader.handlerFor(state);
        if(handler == null) throw new IllegalStateException("bad state: " + state);
        ResponseEvent event = handler.handle(this);
        log.trace("Read {}, now in {}", event, state);
        return event;
    }

    /**
     * Read the next piece of the body. Once the body is over, the connection is released and null is returned.
     * @return next piece of the body, or null if there is no more
     * @throws IllegalStateException if headers haven't been read yet
     * @throws IOException if reading fails
     */
    public byte[] readBody() throws IOException {
        if(state.precedes(PipeState.READING_BODY)) throw new IllegalStateException("not ready for reading body");

        ResponseEvent event = read();
        if(event.getType() == ResponseEvent.Type.BODY) return event.getBody();
        if(event.getType() == ResponseEvent.Type.BODY_END) setKeepalive();
        return null;
    }

    /**
     * Read the whole response, collecting the body.
     * @see #response(HeaderFilter, BodyFilter)
     */
    public HttpResponse response() throws IOException {
        return response(null, null);
    }

    /**
     * Read the response until its end, or until one of the filters says to stop.
     * @param headerFilter called once all headers are read; returning true stops reading, leaving the body to
     *                     the caller. May be null
     * @param bodyFilter called for each piece of body instead of collecting it; returning true stops reading.
     *                   May be null
     * @return response read so far
     * @throws IOException if reading fails
     */
    public HttpResponse response(HeaderFilter headerFilter, BodyFilter bodyFilter) throws IOException {
        int status = 0;
        Headers headers = new Headers();
        List<byte[]> chunks = new ArrayList<>();

        while(!eof) {
            ResponseEvent event = read();
            ResponseEvent.Type type = event.getType();
            if(type == ResponseEvent.Type.STATUS_LINE) {
                status = event.getStatus();
            } else if(type == ResponseEvent.Type.MALFORMED_STATUS_LINE) {
                return HttpResponse.malformed(event.getRawLine());
            } else if(type == ResponseEvent.Type.HEADER) {
                HeaderLine header = event.getHeader();
                if(header.isWellFormed()) headers.addHeader(header.getName(), header.getValue());
            } else if(type == ResponseEvent.Type.HEADER_END) {
                if(headerFilter != null && headerFilter.filter(status, headers)) break;
            } else if(type == ResponseEvent.Type.BODY) {
                if(bodyFilter != null) {
                    if(bodyFilter.filter(event.getBody())) break;
                } else {
                    chunks.add(event.getBody());
                }
            } else if(type == ResponseEvent.Type.EOF) {
                break;
            }
        }
        return new HttpResponse(status, headers, Utils.concat(chunks), eof);
    }

    /**
     * Finish the request: release the connection into the pool if the response allows it, close it otherwise.
     * Does nothing if the request is already finished.
     * @throws IllegalStateException if no request has ever been made
     * @throws IOException if releasing or closing fails
     */
    public void setKeepalive() throws IOException {
        ConnectionLifecycle.finish(this);
    }

    /**
     * Finish the request, using the given pool parameters.
     * @param maxIdle how long the connection may idle in the pool, null for the pool default
     * @param poolSize how many idle connections to keep for the endpoint, non-positive for the pool default
     * @see #setKeepalive()
     */
    public void setKeepalive(Duration maxIdle, int poolSize) throws IOException {
        ConnectionLifecycle.finish(this, maxIdle, poolSize);
    }

    /**
     * Close the connection, whatever the state of the response.
     * @throws IOException if closing fails
     */
    public void close() throws IOException {
        ConnectionLifecycle.close(this);
    }

    /**
     * @return how many times the current connection has been taken from the pool; 0 for a new connection
     * @throws IllegalStateException if the pipe holds no connection
     * @throws IOException if the transport fails
     */
    public int getReusedTimes() throws IOException {
        return ConnectionLifecycle.reusedTimes(this);
    }

    public PipeState getState() {
        return state;
    }

    /**
     * @return whether the current request is over and its connection released or closed
     */
    public boolean isEof() {
        return eof;
    }

    /**
     * @return whether the connection may be reused once the response is over, as far as known so far
     */
    public boolean isKeepalive() {
        return keepalive;
    }

    /**
     * @return uppercase method of the last request, or null if none has been made
     */
    public String getMethod() {
        return method;
    }

    public Transport getTransport() {
        return transport;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Called by {@link #response(HeaderFilter, BodyFilter)} once all headers are read.
     */
    @FunctionalInterface
    public interface HeaderFilter {
        /**
         * @param status response status code
         * @param headers response headers
         * @return true to stop reading the response
         */
        boolean filter(int status, Headers headers);
    }

    /**
     * Called by {@link #response(HeaderFilter, BodyFilter)} for each piece of body.
     */
    @FunctionalInterface
    public interface BodyFilter {
        /**
         * @param chunk piece of the body
         * @return true to stop reading the response
         * @throws IOException if handling the data fails
         */
        boolean filter(byte[] chunk) throws IOException;
    }
}
