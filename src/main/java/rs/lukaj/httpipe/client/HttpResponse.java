package rs.lukaj.httpipe.client;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Represents a HTTP response as assembled by {@link Pipe#response()}: status, headers, and the body unless it
 * was streamed elsewhere.
 */
public class HttpResponse {
    private static final byte[] NO_BODY = new byte[0];

    private final int status;
    private final Headers headers;
    private final byte[] body;
    private final boolean eof;
    private final String rawStatusLine;

    HttpResponse(int status, Headers headers, byte[] body, boolean eof) {
        this(status, headers, body, eof, null);
    }

    private HttpResponse(int status, Headers headers, byte[] body, boolean eof, String rawStatusLine) {
        this.status = status;
        this.headers = headers;
        this.body = body;
        this.eof = eof;
        this.rawStatusLine = rawStatusLine;
    }

    /**
     * Response to a request whose response wasn't read at all (see {@link Http.StreamMode#FULL}).
     */
    static HttpResponse empty() {
        return new HttpResponse(0, new Headers(), NO_BODY, false);
    }

    /**
     * Response whose status line couldn't be parsed.
     * @param rawStatusLine line received instead of a status line
     */
    static HttpResponse malformed(String rawStatusLine) {
        return new HttpResponse(0, new Headers(), NO_BODY, false, rawStatusLine);
    }

    /**
     * @return status code, or 0 if no status line has been read
     */
    public int getStatus() {
        return status;
    }

    /**
     * Get response headers received. Repeated headers keep all of their values.
     * @return received headers
     */
    public Headers getHeaders() {
        return headers;
    }

    /**
     * @return body bytes read so far; empty if the body was streamed to a filter or not read
     */
    public byte[] getBody() {
        return body;
    }

    /**
     * Returns body decoded as UTF-8.
     * @return response body, parsed as string
     */
    public String getBodyString() {
        return new String(body, UTF_8);
    }

    /**
     * @return whether the response was read to its end and the connection released or closed
     */
    public boolean isEof() {
        return eof;
    }

    /**
     * @return whether the server sent something that isn't a status line
     */
    public boolean isMalformed() {
        return rawStatusLine != null;
    }

    /**
     * @return line received instead of a status line, or null if the status line was fine
     */
    public String getRawStatusLine() {
        return rawStatusLine;
    }

    @Override
    public String toString() {
        if(isMalformed()) return "Malformed response: " + rawStatusLine;
        return status + "\n" + headers + "\n" + body.length + " bytes" + (eof ? "" : " (not finished)");
    }
}
