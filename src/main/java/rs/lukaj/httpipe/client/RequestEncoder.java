package rs.lukaj.httpipe.client;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns {@link RequestOptions} into the request line and header block sent over the wire. Doesn't touch the
 * network.
 */
public final class RequestEncoder {

    private RequestEncoder() {
    }

    /**
     * Build the request head. Method defaults to GET, path to "/". Headers are normalized, and the following are
     * filled in: Content-Length for string bodies (always) and for PUT/POST (coerced to a number, 0 if missing),
     * Host, User-Agent and Accept if missing, and Connection: Keep-Alive for HTTP/1.0 if missing.
     * @param options request options
     * @param host value for the Host header if the caller didn't set one
     * @return encoded request
     * @throws InvalidRequestException if the version selector is neither 0 nor 1
     */
    public static EncodedRequest encode(RequestOptions options, String host) {
        String method = options.getMethod() == null ? "GET" : options.getMethod().toUpperCase(Locale.ROOT);
        Http.Version version = Http.Version.fromSelector(options.getVersion());

        StringBuilder req = new StringBuilder(256);
        req.append(method).append(' ');

        String path = options.getPath();
        if(path == null) path = "/";
        else if(!path.startsWith("/")) path = "/" + path;
        req.append(UriEscaper.escapePath(path));

        String query = options.getQueryString();
        if(options.getQueryArgs() != null && !options.getQueryArgs().isEmpty())
            query = UriEscaper.encodeArgs(options.getQueryArgs());
        if(query != null) req.append('?').append(query);

        req.append(version.requestLineSuffix());

        Headers headers = new Headers();
        for(Map.Entry<String, List<String>> header : options.getHeaders().entrySet()) {
            headers.put(HeaderNames.normalize(header.getKey()), header.getValue());
        }

        if(options.getBody() != null) {
            headers.setHeader(HeaderNames.CONTENT_LENGTH, String.valueOf(options.getBody().getBytes(UTF_8).length));
        }
        if(method.equals("PUT") || method.equals("POST")) {
            headers.setHeader(HeaderNames.CONTENT_LENGTH, String.valueOf(parseLength(headers)));
        }
        if(!headers.hasHeader(HeaderNames.HOST) && host != null) headers.setHeader(HeaderNames.HOST, host);
        if(!headers.hasHeader(HeaderNames.USER_AGENT)) headers.setHeader(HeaderNames.USER_AGENT, Http.USER_AGENT);
        if(!headers.hasHeader(HeaderNames.ACCEPT)) headers.setHeader(HeaderNames.ACCEPT, "*/*");
        if(version == Http.Version.HTTP10 && !headers.hasHeader(HeaderNames.CONNECTION))
            headers.setHeader(HeaderNames.CONNECTION, "Keep-Alive");

        req.append(headers).append(Http.CRLF);
        return new EncodedRequest(method, req.toString().getBytes(UTF_8), headers);
    }

    //0 if missing or not a number
    private static long parseLength(Headers headers) {
        String value = headers.getHeader(HeaderNames.CONTENT_LENGTH);
        if(value == null) return 0;
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Result of encoding: the method actually used, the bytes to send and the headers they contain.
     */
    public static class EncodedRequest {
        private final String method;
        private final byte[] head;
        private final Headers headers;

        EncodedRequest(String method, byte[] head, Headers headers) {
            this.method = method;
            this.head = head;
            this.headers = headers;
        }

        /**
         * @return uppercase request method
         */
        public String getMethod() {
            return method;
        }

        /**
         * @return request line and headers, including the terminating empty line
         */
        public byte[] getHead() {
            return head;
        }

        public Headers getHeaders() {
            return headers;
        }

        /**
         * @return declared Content-Length, or 0 if missing or not a number
         */
        public long getContentLength() {
            return parseLength(headers);
        }
    }
}
