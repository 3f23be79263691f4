package rs.lukaj.httpipe.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything describing a single request: method, path, query, headers, body, protocol version, how much of the
 * response is read automatically, and timeouts. Setters return this, to allow chaining:
 * <pre>
 *     RequestOptions options = new RequestOptions()
 *             .setMethod("POST")
 *             .setPath("/upload")
 *             .setHeader("Content-Type", "text/plain")
 *             .setBody("hello");
 * </pre>
 */
public class RequestOptions {
    public static final int DEFAULT_CONNECT_TIMEOUT = 5000;

    private String method;
    private String path;
    private String queryString;
    private Map<String, Object> queryArgs;
    private final Headers headers = new Headers();
    private String body;
    private BodyProducer bodyProducer;
    private int version = Http.Version.HTTP11.getSelector();
    private Http.StreamMode stream = Http.StreamMode.NONE;
    private int timeout = DEFAULT_CONNECT_TIMEOUT;
    private Integer sendTimeout;
    private Integer readTimeout;

    /**
     * @param method request method; case doesn't matter. Null means GET
     * @return this, to allow chaining
     */
    public RequestOptions setMethod(String method) {
        this.method = method;
        return this;
    }

    /**
     * @param path request path, unescaped. Null means "/"
     * @return this, to allow chaining
     */
    public RequestOptions setPath(String path) {
        this.path = path;
        return this;
    }

    /**
     * Set an already encoded query string, which is appended to the path verbatim.
     * @param query query string, without the question mark
     * @return this, to allow chaining
     */
    public RequestOptions setQuery(String query) {
        this.queryString = query;
        this.queryArgs = null;
        return this;
    }

    /**
     * Set query arguments, which are encoded using {@link UriEscaper#encodeArgs(Map)}.
     * @param args query arguments
     * @return this, to allow chaining
     */
    public RequestOptions setQuery(Map<String, ?> args) {
        this.queryArgs = args == null ? null : new LinkedHashMap<>(args);
        this.queryString = null;
        return this;
    }

    /**
     * Add a single query argument, keeping the ones set before.
     * @param key argument name
     * @param value argument value
     * @return this, to allow chaining
     */
    public RequestOptions addQueryArg(String key, Object value) {
        if(queryArgs == null) {
            queryArgs = new LinkedHashMap<>();
            queryString = null;
        }
        queryArgs.put(key, value);
        return this;
    }

    /**
     * Put a header, replacing one with the same name (ignoring case).
     * @param name header name
     * @param value header value
     * @return this, to allow chaining
     */
    public RequestOptions setHeader(String name, String value) {
        headers.setHeader(name, value);
        return this;
    }

    /**
     * Add another value to a header; each value is sent on its own header line.
     * @param name header name
     * @param value header value
     * @return this, to allow chaining
     */
    public RequestOptions addHeader(String name, String value) {
        headers.addHeader(name, value);
        return this;
    }

    /**
     * Put all the headers, replacing ones with the same names.
     * @param headers name-value pairs
     * @return this, to allow chaining
     */
    public RequestOptions setHeaders(Map<String, String> headers) {
        for(Map.Entry<String, String> header : headers.entrySet()) {
            this.headers.setHeader(header.getKey(), header.getValue());
        }
        return this;
    }

    /**
     * Send a string as the request body. Its UTF-8 length always overrides any Content-Length header.
     * @param body request body
     * @return this, to allow chaining
     */
    public RequestOptions setBody(String body) {
        this.body = body;
        this.bodyProducer = null;
        return this;
    }

    /**
     * Stream the request body from a producer. Content-Length must be set and the producer must supply exactly
     * that many bytes.
     * @param producer source of the body
     * @return this, to allow chaining
     */
    public RequestOptions setBody(BodyProducer producer) {
        this.bodyProducer = producer;
        this.body = null;
        return this;
    }

    /**
     * @param version 0 for HTTP/1.0, 1 for HTTP/1.1. Anything else makes the request fail
     * @return this, to allow chaining
     */
    public RequestOptions setVersion(int version) {
        this.version = version;
        return this;
    }

    /**
     * @param stream how much of the response is read by the request call itself
     * @return this, to allow chaining
     */
    public RequestOptions setStream(Http.StreamMode stream) {
        this.stream = stream == null ? Http.StreamMode.NONE : stream;
        return this;
    }

    /**
     * @param millis connect timeout
     * @return this, to allow chaining
     */
    public RequestOptions setTimeout(int millis) {
        this.timeout = millis;
        return this;
    }

    /**
     * @param millis timeout used after connecting, while sending the request
     * @return this, to allow chaining
     */
    public RequestOptions setSendTimeout(int millis) {
        this.sendTimeout = millis;
        return this;
    }

    /**
     * @param millis timeout applied before every read of the response
     * @return this, to allow chaining
     */
    public RequestOptions setReadTimeout(int millis) {
        this.readTimeout = millis;
        return this;
    }

    public String getMethod() {
        return method;
    }
    public String getPath() {
        return path;
    }
    public String getQueryString() {
        return queryString;
    }
    public Map<String, Object> getQueryArgs() {
        return queryArgs;
    }
    public Headers getHeaders() {
        return headers;
    }
    public String getBody() {
        return body;
    }
    public BodyProducer getBodyProducer() {
        return bodyProducer;
    }
    public int getVersion() {
        return version;
    }
    public Http.StreamMode getStream() {
        return stream;
    }
    public int getTimeout() {
        return timeout;
    }
    public Integer getSendTimeout() {
        return sendTimeout;
    }
    public Integer getReadTimeout() {
        return readTimeout;
    }
}
