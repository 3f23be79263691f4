package rs.lukaj.httpipe.client;

import java.util.Collection;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Percent-encoding used when building the request line.
 */
public final class UriEscaper {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UriEscaper() {
    }

    /**
     * Percent-encode everything except unreserved characters (letters, digits and {@code -._~}). Non-ASCII
     * characters are encoded as their UTF-8 bytes.
     * @param s string to escape
     * @return escaped string
     */
    public static String escapeUri(String s) {
        byte[] bytes = s.getBytes(UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length + 16);
        for(byte b : bytes) {
            int c = b & 0xff;
            if(isUnreserved(c)) {
                sb.append((char)c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0xf]);
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    /**
     * Escape a URL path segment by segment, so the slashes keep their meaning. Empty segments are dropped,
     * a trailing slash is kept and the result always begins with a slash.
     * @param path path to escape
     * @return escaped path, "/" if there are no segments
     */
    public static String escapePath(String path) {
        StringBuilder escaped = new StringBuilder(path.length() + 16).append('/');
        boolean first = true;
        for(String segment : path.split("/")) {
            if(segment.isEmpty()) continue;
            if(!first) escaped.append('/');
            escaped.append(escapeUri(segment));
            first = false;
        }
        if(!first && path.endsWith("/")) escaped.append('/');
        return escaped.toString();
    }

    /**
     * Serialize arguments into a query string, in the map's iteration order. A {@code true} value emits only the
     * key, {@code false} and {@code null} values are skipped, and every element of a collection value is emitted
     * as a separate {@code key=value} pair.
     * @param args query arguments
     * @return query string without the leading question mark
     */
    public static String encodeArgs(Map<String, ?> args) {
        StringBuilder sb = new StringBuilder(args.size() * 16);
        for(Map.Entry<String, ?> arg : args.entrySet()) {
            String key = escapeUri(arg.getKey());
            Object value = arg.getValue();
            if(value instanceof Collection) {
                for(Object element : (Collection<?>)value) appendArg(sb, key, element);
            } else {
                appendArg(sb, key, value);
            }
        }
        return sb.toString();
    }

    private static void appendArg(StringBuilder sb, String key, Object value) {
        if(value == null || Boolean.FALSE.equals(value)) return;
        if(sb.length() > 0) sb.append('&');
        sb.append(key);
        if(!Boolean.TRUE.equals(value)) sb.append('=').append(escapeUri(String.valueOf(value)));
    }
}
