package rs.lukaj.httpipe.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import rs.lukaj.httpipe.connections.ConnectionClosedException;

import java.io.IOException;
import java.net.ProtocolException;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The response parser: one handler per {@link PipeState}, each reading as much as it needs from the pipe's
 * transport to produce a single {@link ResponseEvent} and moving the pipe to its next state.
 */
final class ResponseReader {
    private static final Logger log = LogManager.getLogger(ResponseReader.class);

    private static final Pattern STATUS_LINE = Pattern.compile("HTTP/(\\d*)\\.(\\d*) (\\d{3})");
    private static final int CONTINUE = 100;

    /**
     * Reads the part of the response belonging to the pipe's current state.
     */
    @FunctionalInterface
    interface StateHandler {
        ResponseEvent handle(Pipe pipe) throws IOException;
    }

    private static final Map<PipeState, StateHandler> HANDLERS = new EnumMap<>(PipeState.class);
    static {
        HANDLERS.put(PipeState.BEGIN, ResponseReader::readStatusLine);
        HANDLERS.put(PipeState.READING_HEADER, ResponseReader::readHeaderPart);
        HANDLERS.put(PipeState.READING_BODY, ResponseReader::readBodyPart);
        HANDLERS.put(PipeState.EOF, ResponseReader::finish);
    }

    private ResponseReader() {
    }

    /**
     * @param state pipe state
     * @return handler for the state, or null if there is none
     */
    static StateHandler handlerFor(PipeState state) {
        return HANDLERS.get(state);
    }

    static ResponseEvent readStatusLine(Pipe pipe) throws IOException {
        if(pipe.lineReader == null) pipe.lineReader = pipe.transport.receiveUntil(Http.CRLF);

        String line = pipe.lineReader.readLine();
        Matcher matcher = STATUS_LINE.matcher(line);
        if(!matcher.find()) {
            log.warn("Malformed status line: {}", line);
            return ResponseEvent.malformedStatusLine(line);
        }

        int status = Integer.parseInt(matcher.group(3));
        //HTTP/1.0 responses close the connection unless they say otherwise
        pipe.keepalive = !("1".equals(matcher.group(1)) && "0".equals(matcher.group(2)));
        if(status == CONTINUE) {
            pipe.lineReader.readLine();
            pipe.state = PipeState.BEGIN;
        } else {
            pipe.state = PipeState.READING_HEADER;
        }
        log.trace("Status line: {}", line);
        return ResponseEvent.statusLine(status, line);
    }

    static ResponseEvent readHeaderPart(Pipe pipe) throws IOException {
        String line = pipe.lineReader.readLine();
        if(line.isEmpty()) {
            pipe.state = PipeState.READING_BODY;
            return ResponseEvent.headerEnd();
        }

        int colon = line.indexOf(':');
        if(colon < 0) return ResponseEvent.header(new HeaderLine(null, line, line));

        String name = line.substring(0, colon);
        String value = line.substring(colon + 1).stripLeading();
        String canonical = HeaderNames.normalize(name);
        if(canonical.equalsIgnoreCase(HeaderNames.CONTENT_LENGTH)) {
            long length = parseContentLength(value);
            if(!pipe.chunked) pipe.remaining = length; //chunked framing wins over Content-Length
        } else if(canonical.equalsIgnoreCase(HeaderNames.TRANSFER_ENCODING)) {
            if(!"identity".equalsIgnoreCase(value.trim())) {
                pipe.chunked = true;
                pipe.remaining = 0;
            }
        } else if(canonical.equalsIgnoreCase(HeaderNames.CONNECTION)) {
            if("close".equalsIgnoreCase(value.trim())) pipe.keepalive = false;
            else if("keep-alive".equalsIgnoreCase(value.trim())) pipe.keepalive = true;
        }
        return ResponseEvent.header(new HeaderLine(canonical, value, line));
    }

    static ResponseEvent readBodyPart(Pipe pipe) throws IOException {
        if("HEAD".equals(pipe.method)) {
            pipe.state = PipeState.EOF;
            return ResponseEvent.bodyEnd();
        }

        if(pipe.chunked && pipe.remaining == 0) {
            String line = pipe.lineReader.readLine();
            if(line.isEmpty()) line = pipe.lineReader.readLine(); //CRLF closing the previous chunk
            long size = parseChunkSize(line);
            log.trace("Chunk of {} bytes", size);
            if(size == 0) {
                skipTrailers(pipe);
                pipe.state = PipeState.EOF;
                return ResponseEvent.bodyEnd();
            }
            pipe.remaining = size;
        }

        if(pipe.remaining == 0) {
            pipe.state = PipeState.EOF;
            return ResponseEvent.bodyEnd();
        }

        int size = (int) Math.min(pipe.remaining, pipe.chunkSize);
        try {
            byte[] data = pipe.transport.receive(size);
            pipe.remaining -= data.length;
            return ResponseEvent.body(data);
        } catch (ConnectionClosedException e) {
            return closedWhileReadingBody(pipe, e.getPartial());
        }
    }

    //peer is gone, so there's nothing more to read, and nothing to put back into the pool
    private static ResponseEvent closedWhileReadingBody(Pipe pipe, byte[] partial) throws IOException {
        pipe.keepalive = false;
        pipe.chunked = false;
        if(partial.length == 0) {
            log.debug("Connection closed by peer at the end of a body read");
            pipe.state = PipeState.EOF;
            return ResponseEvent.bodyEnd();
        }
        pipe.remaining -= partial.length;
        if(pipe.remaining != 0) {
            pipe.state = PipeState.EOF;
            throw new ConnectionClosedException("premature close: connection closed with " + pipe.remaining
                    + " body bytes outstanding", partial);
        }
        //exactly the bytes we were waiting for; next read sees nothing remaining and ends the body
        return ResponseEvent.body(partial);
    }

    static ResponseEvent finish(Pipe pipe) throws IOException {
        ConnectionLifecycle.finish(pipe);
        return ResponseEvent.eof();
    }

    private static void skipTrailers(Pipe pipe) throws IOException {
        String line;
        do {
            line = pipe.lineReader.readLine();
        } while(!line.isEmpty());
    }

    private static long parseContentLength(String value) throws ProtocolException {
        try {
            long length = Long.parseLong(value.trim());
            if(length < 0) throw new ProtocolException("Negative Content-Length: " + value);
            return length;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + value);
        }
    }

    //chunk extensions are ignored
    private static long parseChunkSize(String line) throws ProtocolException {
        int extension = line.indexOf(';');
        String size = (extension < 0 ? line : line.substring(0, extension)).trim();
        try {
            long length = Long.parseLong(size, 16);
            if(length < 0) throw new ProtocolException("Negative chunk size: " + line);
            return length;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid chunk size: " + line);
        }
    }
}
