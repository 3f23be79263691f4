package rs.lukaj.httpipe.client;

import org.junit.jupiter.api.Test;
import rs.lukaj.httpipe.connections.ConnectionClosedException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ProtocolException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class PipeTest {

    private static final String HELLO = "HTTP/1.1 200 OK\r\nContent-Length: 5\r\n\r\nhello";

    private static BodyProducer producerOf(String... parts) {
        Iterator<String> it = Arrays.asList(parts).iterator();
        return () -> it.hasNext() ? it.next().getBytes(UTF_8) : null;
    }

    private static List<ResponseEvent.Type> readAll(Pipe pipe) throws IOException {
        List<ResponseEvent.Type> types = new ArrayList<>();
        ResponseEvent event;
        do {
            event = pipe.read();
            types.add(event.getType());
        } while(event.getType() != ResponseEvent.Type.EOF);
        return types;
    }

    /**
     * The whole round trip: what goes out, what comes back, and where the connection ends up.
     */
    @Test
    public void simpleGet() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80, new RequestOptions().setPath("/foo").addQueryArg("x", 1));

        assertEquals("GET /foo?x=1 HTTP/1.1\r\n" +
                "Host: example.org\r\n" +
                "User-Agent: Java-HTTPipe/0.4\r\n" +
                "Accept: */*\r\n" +
                "\r\n", transport.getSent());
        assertEquals(200, response.getStatus());
        assertEquals("5", response.getHeaders().getHeader("content-length"));
        assertEquals("hello", response.getBodyString());
        assertTrue(response.isEof());
        assertEquals(1, transport.getKeepalives()); //went back to the pool...
        assertEquals(0, transport.getCloses()); //...instead of being closed
        assertEquals(PipeState.EOF, pipe.getState());
        assertEquals("GET", pipe.getMethod());
        assertEquals(5000, transport.getTimeouts().get(0)); //default connect timeout
    }

    @Test
    public void chunkedBody() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n" +
                "4\r\nWiki\r\n5;name=value\r\npedia\r\n0\r\nX-Trailer: yes\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80);
        assertEquals("Wikipedia", response.getBodyString());
        assertEquals(1, transport.getKeepalives());
    }

    /**
     * Driving the state machine by hand, event by event.
     */
    @Test
    public void eventsInWireOrder() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n" +
                "4\r\ntest\r\n0\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        assertEquals(0, response.getStatus());
        assertEquals(PipeState.BEGIN, pipe.getState());

        ResponseEvent status = pipe.read();
        assertEquals(ResponseEvent.Type.STATUS_LINE, status.getType());
        assertEquals(200, status.getStatus());
        ResponseEvent header = pipe.read();
        assertEquals(ResponseEvent.Type.HEADER, header.getType());
        assertEquals("Transfer-Encoding", header.getHeader().getName());
        assertEquals("chunked", header.getHeader().getValue());
        assertEquals(ResponseEvent.Type.HEADER_END, pipe.read().getType());
        ResponseEvent body = pipe.read();
        assertEquals(ResponseEvent.Type.BODY, body.getType());
        assertArrayEquals("test".getBytes(UTF_8), body.getBody());
        assertEquals(ResponseEvent.Type.BODY_END, pipe.read().getType());
        assertFalse(pipe.isEof());
        assertEquals(ResponseEvent.Type.EOF, pipe.read().getType());
        assertTrue(pipe.isEof());
        assertEquals(ResponseEvent.Type.EOF, pipe.read().getType()); //stays there
        assertEquals(1, transport.getKeepalives());
    }

    @Test
    public void headerWithoutColon() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nweird line\r\ncontent-length: 0\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        pipe.read();
        ResponseEvent weird = pipe.read();
        assertEquals(ResponseEvent.Type.HEADER, weird.getType());
        assertFalse(weird.getHeader().isWellFormed());
        assertEquals("weird line", weird.getHeader().getValue());
        ResponseEvent length = pipe.read();
        assertEquals("Content-Length", length.getHeader().getName());
        assertEquals("content-length: 0", length.getRawLine());
        assertEquals(Arrays.asList(ResponseEvent.Type.HEADER_END, ResponseEvent.Type.BODY_END, ResponseEvent.Type.EOF),
                readAll(pipe));
    }

    @Test
    public void emptyBody() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 204 No Content\r\nContent-Length: 0\r\n\r\n");
        HttpResponse response = new Pipe(transport).request("example.org", 80);
        assertEquals(204, response.getStatus());
        assertEquals(0, response.getBody().length);
        assertEquals(1, transport.getKeepalives());
    }

    /**
     * HEAD responses announce a length, but never carry a body.
     */
    @Test
    public void headRequest() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: 100\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80, new RequestOptions().setMethod("head"));
        assertTrue(transport.getSent().startsWith("HEAD / HTTP/1.1\r\n"));
        assertEquals(200, response.getStatus());
        assertEquals(0, response.getBody().length);
        assertEquals(1, transport.getKeepalives());
    }

    @Test
    public void continueIsSkipped() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 100 Continue\r\n\r\n" +
                "HTTP/1.1 200 OK\r\nContent-Length: 2\r\n\r\nok");
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        assertEquals(100, pipe.read().getStatus());
        assertEquals(PipeState.BEGIN, pipe.getState());
        assertEquals(200, pipe.read().getStatus());
        assertEquals(PipeState.READING_HEADER, pipe.getState());

        transport.respondWith("HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 201 Created\r\nContent-Length: 2\r\n\r\nok");
        HttpResponse response = pipe.request("example.org", 80);
        assertEquals(201, response.getStatus());
        assertEquals("ok", response.getBodyString());
    }

    @Test
    public void connectionCloseIsNotPooled() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nConnection: close\r\nContent-Length: 2\r\n\r\nok");
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80);
        assertFalse(pipe.isKeepalive());
        assertEquals(0, transport.getKeepalives());
        assertEquals(1, transport.getCloses());
    }

    @Test
    public void http10ClosesUnlessKeptAlive() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.0 200 OK\r\nContent-Length: 2\r\n\r\nok");
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80);
        assertEquals(1, transport.getCloses());
        assertEquals(0, transport.getKeepalives());

        transport.respondWith("HTTP/1.0 200 OK\r\nConnection: keep-alive\r\nContent-Length: 2\r\n\r\nok");
        pipe.request("example.org", 80);
        assertEquals(1, transport.getCloses());
        assertEquals(1, transport.getKeepalives());
    }

    @Test
    public void malformedStatusLine() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("garbage\r\n");
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80);
        assertTrue(response.isMalformed());
        assertEquals("garbage", response.getRawStatusLine());
        assertEquals(0, response.getStatus());
        assertFalse(pipe.isEof());
        pipe.close();
        assertEquals(1, transport.getCloses());
    }

    /**
     * Peer closing mid-body is an error, not a shorter body.
     */
    @Test
    public void prematureClose() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\nabc");
        Pipe pipe = new Pipe(transport);
        ConnectionClosedException e = assertThrows(ConnectionClosedException.class,
                () -> pipe.request("example.org", 80));
        assertArrayEquals("abc".getBytes(UTF_8), e.getPartial());
        assertEquals(PipeState.EOF, pipe.getState());
        assertFalse(pipe.isKeepalive());
        assertEquals(0, transport.getKeepalives());
    }

    @Test
    public void prematureCloseInChunk() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n" +
                "a\r\nabc");
        assertThrows(ConnectionClosedException.class, () -> new Pipe(transport).request("example.org", 80));
    }

    /**
     * Close reported together with exactly the missing bytes still makes a complete body.
     */
    @Test
    public void closeAfterLastByte() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        transport.closeWithLastBytes();
        Pipe pipe = new Pipe(transport);
        HttpResponse response = pipe.request("example.org", 80);
        assertEquals("hello", response.getBodyString());
        assertTrue(response.isEof());
        assertFalse(pipe.isKeepalive());
        assertEquals(0, transport.getKeepalives());
    }

    /**
     * Close with nothing received ends the body.
     */
    @Test
    public void closeWithoutData() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: 5\r\n\r\n");
        HttpResponse response = new Pipe(transport).request("example.org", 80);
        assertEquals(200, response.getStatus());
        assertEquals(0, response.getBody().length);
        assertTrue(response.isEof());
        assertEquals(0, transport.getKeepalives());
    }

    @Test
    public void invalidContentLength() {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: lots\r\n\r\n");
        assertThrows(ProtocolException.class, () -> new Pipe(transport).request("example.org", 80));
    }

    @Test
    public void readBeforeRequest() {
        Pipe pipe = new Pipe(new ScriptedTransport(HELLO));
        IllegalStateException e = assertThrows(IllegalStateException.class, pipe::read);
        assertEquals("not ready", e.getMessage());
        assertThrows(IllegalStateException.class, pipe::readBody);
    }

    @Test
    public void readBodyBeforeHeaders() throws IOException {
        Pipe pipe = new Pipe(new ScriptedTransport(HELLO));
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        assertThrows(IllegalStateException.class, pipe::readBody);
    }

    /**
     * Headers are read by the request; the body is pulled piece by piece.
     */
    @Test
    public void bodyStreaming() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport, 2);
        HttpResponse response = pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.BODY));
        assertEquals(200, response.getStatus());
        assertEquals("5", response.getHeaders().getHeader(HeaderNames.CONTENT_LENGTH));
        assertFalse(response.isEof());
        assertEquals(0, response.getBody().length);

        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] chunk;
        int pieces = 0;
        while((chunk = pipe.readBody()) != null) {
            assertTrue(chunk.length <= 2);
            body.write(chunk);
            pieces++;
        }
        assertEquals("hello", body.toString(UTF_8));
        assertEquals(3, pieces);
        assertTrue(pipe.isEof());
        assertEquals(1, transport.getKeepalives());
    }

    @Test
    public void bodyFilter() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport, 2);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        List<String> seen = new ArrayList<>();
        HttpResponse response = pipe.response(null, chunk -> {
            seen.add(new String(chunk, UTF_8));
            return false;
        });
        assertEquals(Arrays.asList("he", "ll", "o"), seen);
        assertEquals(0, response.getBody().length);
        assertTrue(response.isEof());
    }

    @Test
    public void multiValuedResponseHeaders() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nset-cookie: a=1\r\nSet-Cookie: b=2\r\n" +
                "Content-Length: 0\r\n\r\n");
        HttpResponse response = new Pipe(transport).request("example.org", 80);
        assertEquals(Arrays.asList("a=1", "b=2"), response.getHeaders().getAll("Set-Cookie"));
        assertEquals("a=1", response.getHeaders().getHeader("set-cookie"));
    }

    @Test
    public void producedBody() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        new Pipe(transport).request("example.org", 80, new RequestOptions()
                .setMethod("put")
                .setHeader("Content-Length", "6")
                .setBody(producerOf("abc", "def", "never sent")));
        assertTrue(transport.getSent().startsWith("PUT / HTTP/1.1\r\n"));
        assertTrue(transport.getSent().endsWith("\r\n\r\nabcdef"));
    }

    @Test
    public void producedBodyTooShort() {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport);
        assertThrows(InvalidRequestException.class, () -> pipe.request("example.org", 80, new RequestOptions()
                .setMethod("POST")
                .setHeader("Content-Length", "6")
                .setBody(producerOf("abc"))));
        assertEquals(1, transport.getCloses());
        assertTrue(pipe.isEof());
    }

    @Test
    public void producedBodyTooLong() {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        assertThrows(InvalidRequestException.class, () -> new Pipe(transport).request("example.org", 80,
                new RequestOptions().setMethod("POST").setHeader("Content-Length", "2").setBody(producerOf("abc"))));
        assertEquals(1, transport.getCloses());
    }

    @Test
    public void stringBody() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        new Pipe(transport).request("example.org", 80, new RequestOptions().setMethod("POST").setBody("čaj"));
        assertTrue(transport.getSent().contains("Content-Length: 4\r\n"));
        assertTrue(transport.getSent().endsWith("\r\n\r\nčaj"));
    }

    @Test
    public void invalidVersionFailsBeforeConnecting() {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        assertThrows(InvalidRequestException.class,
                () -> new Pipe(transport).request("example.org", 80, new RequestOptions().setVersion(2)));
        assertEquals(0, transport.getConnects());
    }

    @Test
    public void unixSocketTarget() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport);
        pipe.request("unix:/var/run/app.sock", new RequestOptions());
        assertTrue(transport.getEndpoint().isUnix());
        assertEquals("/var/run/app.sock", transport.getEndpoint().getSocketPath());
        assertTrue(transport.getSent().contains("Host: localhost\r\n"));

        assertThrows(InvalidRequestException.class, () -> pipe.request("example.org"));
    }

    /**
     * Finishing twice must not hand the connection to the pool twice.
     */
    @Test
    public void doubleFinishIsNoop() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80);
        pipe.setKeepalive();
        pipe.close();
        assertEquals(1, transport.getKeepalives());
        assertEquals(0, transport.getCloses());
    }

    @Test
    public void lifecycleOnUnusedPipe() {
        Pipe pipe = new Pipe(new ScriptedTransport(HELLO));
        IllegalStateException e = assertThrows(IllegalStateException.class, pipe::setKeepalive);
        assertEquals("not initialized", e.getMessage());
        assertThrows(IllegalStateException.class, pipe::getReusedTimes);
        e = assertThrows(IllegalStateException.class, pipe::close);
        assertEquals("not initialized", e.getMessage());
        assertFalse(pipe.isEof());
    }

    /**
     * Finishing before the body is read closes the connection instead of pooling it.
     */
    @Test
    public void unreadBodyIsNotPooled() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.BODY));
        assertEquals(PipeState.READING_BODY, pipe.getState());
        pipe.setKeepalive();
        assertTrue(pipe.isEof());
        assertEquals(0, transport.getKeepalives());
        assertEquals(1, transport.getCloses());
    }

    @Test
    public void stoppedBodyFilterIsNotPooled() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport, 2);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        HttpResponse response = pipe.response(null, chunk -> true);
        assertFalse(response.isEof());
        pipe.setKeepalive();
        assertEquals(0, transport.getKeepalives());
        assertEquals(1, transport.getCloses());
    }

    /**
     * Nothing left on the wire once headers say the body is empty, so the connection can be pooled.
     */
    @Test
    public void emptyBodyPooledAfterHeaders() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.BODY));
        pipe.setKeepalive();
        assertEquals(1, transport.getKeepalives());
        assertEquals(0, transport.getCloses());
    }

    @Test
    public void chunkedWinsOverContentLength() throws IOException {
        ScriptedTransport transport = new ScriptedTransport("HTTP/1.1 200 OK\r\nContent-Length: 9\r\n" +
                "Transfer-Encoding: chunked\r\n\r\n4\r\ntest\r\n0\r\n\r\n");
        Pipe pipe = new Pipe(transport);
        assertEquals("test", pipe.request("example.org", 80).getBodyString());
        assertEquals(1, transport.getKeepalives());

        transport.respondWith("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\nContent-Length: 9\r\n\r\n" +
                "4\r\ntest\r\n0\r\n\r\n");
        assertEquals("test", pipe.request("example.org", 80).getBodyString());
        assertEquals(2, transport.getKeepalives());
    }

    @Test
    public void reusingPipe() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        Pipe pipe = new Pipe(transport).configureKeepalive(Duration.ofSeconds(5), 3);
        pipe.request("example.org", 80);
        assertEquals(Duration.ofSeconds(5), transport.getKeepaliveIdle());
        assertEquals(3, transport.getKeepalivePoolSize());

        transport.respondWith(HELLO);
        pipe.request("example.org", 80, new RequestOptions().setStream(Http.StreamMode.FULL));
        assertFalse(pipe.isEof());
        assertEquals(1, pipe.getReusedTimes());
        assertEquals("hello", pipe.response().getBodyString());
        assertEquals(2, transport.getKeepalives());
    }

    @Test
    public void timeouts() throws IOException {
        ScriptedTransport transport = new ScriptedTransport(HELLO);
        new Pipe(transport).request("example.org", 80, new RequestOptions()
                .setTimeout(100)
                .setSendTimeout(200)
                .setReadTimeout(300));
        List<Integer> timeouts = transport.getTimeouts();
        assertEquals(Arrays.asList(100, 200), timeouts.subList(0, 2));
        assertEquals(300, timeouts.get(timeouts.size() - 1));
    }

    @Test
    public void invalidChunkSize() {
        assertThrows(rs.lukaj.httpipe.connections.InvalidConfigException.class,
                () -> new Pipe(new ScriptedTransport(HELLO), 0));
    }
}
