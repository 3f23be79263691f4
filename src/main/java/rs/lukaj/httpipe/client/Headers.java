package rs.lukaj.httpipe.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Represents headers which are received from server or sent as a part of the request. Names are stored in their
 * canonical form (see {@link HeaderNames#normalize(String)}) and looked up case-insensitively. A header can hold
 * multiple values, each of which is sent as a separate header line. Iteration follows insertion order.
 */
public class Headers extends LinkedHashMap<String, List<String>> { //inheriting instead of wrapping, again

    public Headers() {
    }

    /**
     * Create headers from a plain name-to-value map, normalizing names on the way.
     * @param headers name-value pairs
     * @return new headers
     */
    public static Headers of(Map<String, String> headers) {
        Headers result = new Headers();
        for(Map.Entry<String, String> header : headers.entrySet()) {
            result.setHeader(header.getKey(), header.getValue());
        }
        return result;
    }

    @Override
    public List<String> put(String key, List<String> value) {
        return super.put(keyFor(key), new ArrayList<>(value));
    }

    @Override
    public void putAll(Map<? extends String, ? extends List<String>> headers) {
        for(Map.Entry<? extends String, ? extends List<String>> header : headers.entrySet()) {
            put(header.getKey(), header.getValue());
        }
    }

    //existing key if there's one equal ignoring case, canonical name otherwise
    private String keyFor(String header) {
        String canonical = HeaderNames.normalize(header);
        if(containsKey(canonical)) return canonical;
        for(String key : keySet()) {
            if(key.equalsIgnoreCase(header)) return key;
        }
        return canonical;
    }

    /**
     * Put a new header, replacing the existing one if it exists.
     * @param header name of the header
     * @param value value of the header
     * @return previous values of the header, or null if it didn't exist
     */
    public List<String> setHeader(String header, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(value);
        return super.put(keyFor(header), values);
    }

    /**
     * Add one more value to the header, or put a new header if it doesn't exist yet.
     * @param header name of the header
     * @param value value to add
     */
    public void addHeader(String header, String value) {
        String key = keyFor(header);
        List<String> values = get(key);
        if(values == null) {
            values = new ArrayList<>(1);
            super.put(key, values);
        }
        values.add(value);
    }

    /**
     * Get value of the header identified by the name passed. If the header has multiple values, the first one
     * is returned.
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        List<String> values = get(keyFor(header));
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * @param header name of the header
     * @return all values of the header, in order; empty if it doesn't exist
     */
    public List<String> getAll(String header) {
        List<String> values = get(keyFor(header));
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous values of the header, or null if it didn't exist
     */
    public List<String> removeHeader(String header) {
        return remove(keyFor(header));
    }

    /**
     * Check whether header exists.
     * @param header header name
     * @return true if it exists, false otherwise
     */
    public boolean hasHeader(String header) {
        return containsKey(keyFor(header));
    }

    /**
     * Returns headers in format appropriate for sending, one line per value, each with trailing CRLF.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size() * 32);
        for(Map.Entry<String, List<String>> header : entrySet()) {
            for(String value : header.getValue()) {
                builder.append(header.getKey()).append(": ").append(value).append(Http.CRLF);
            }
        }
        return builder.toString();
    }
}
