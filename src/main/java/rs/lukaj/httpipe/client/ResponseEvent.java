package rs.lukaj.httpipe.client;

/**
 * One step of a response, as returned by {@link Pipe#read()}. Events come in wire order: status line, headers,
 * end of headers, body pieces, end of body, eof.
 */
public class ResponseEvent {
    public enum Type {
        STATUS_LINE,
        /**
         * Status line didn't look like {@code HTTP/x.y nnn}; raw line is in {@link #getRawLine()}.
         */
        MALFORMED_STATUS_LINE,
        HEADER,
        HEADER_END,
        BODY,
        BODY_END,
        EOF
    }

    private static final ResponseEvent HEADER_END = new ResponseEvent(Type.HEADER_END, 0, null, null, null);
    private static final ResponseEvent BODY_END = new ResponseEvent(Type.BODY_END, 0, null, null, null);
    private static final ResponseEvent EOF = new ResponseEvent(Type.EOF, 0, null, null, null);

    private final Type type;
    private final int status;
    private final String rawLine;
    private final HeaderLine header;
    private final byte[] body;

    private ResponseEvent(Type type, int status, String rawLine, HeaderLine header, byte[] body) {
        this.type = type;
        this.status = status;
        this.rawLine = rawLine;
        this.header = header;
        this.body = body;
    }

    static ResponseEvent statusLine(int status, String rawLine) {
        return new ResponseEvent(Type.STATUS_LINE, status, rawLine, null, null);
    }
    static ResponseEvent malformedStatusLine(String rawLine) {
        return new ResponseEvent(Type.MALFORMED_STATUS_LINE, 0, rawLine, null, null);
    }
    static ResponseEvent header(HeaderLine header) {
        return new ResponseEvent(Type.HEADER, 0, header.getRawLine(), header, null);
    }
    static ResponseEvent headerEnd() {
        return HEADER_END;
    }
    static ResponseEvent body(byte[] data) {
        return new ResponseEvent(Type.BODY, 0, null, null, data);
    }
    static ResponseEvent bodyEnd() {
        return BODY_END;
    }
    static ResponseEvent eof() {
        return EOF;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return status code for STATUS_LINE events, 0 otherwise
     */
    public int getStatus() {
        return status;
    }

    /**
     * @return line as received, for STATUS_LINE, MALFORMED_STATUS_LINE and HEADER events
     */
    public String getRawLine() {
        return rawLine;
    }

    /**
     * @return parsed header, for HEADER events
     */
    public HeaderLine getHeader() {
        return header;
    }

    /**
     * @return body bytes, for BODY events
     */
    public byte[] getBody() {
        return body;
    }

    @Override
    public String toString() {
        switch (type) {
            case STATUS_LINE: return type + "(" + status + ")";
            case MALFORMED_STATUS_LINE:
            case HEADER: return type + "(" + rawLine + ")";
            case BODY: return type + "(" + body.length + " bytes)";
            default: return type.toString();
        }
    }
}
