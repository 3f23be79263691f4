package rs.lukaj.httpipe.client;

import java.util.Map;
import java.util.TreeMap;

import static java.util.Collections.unmodifiableMap;

/**
 * Canonical display form of header names.
 */
public final class HeaderNames {
    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String DATE = "Date";
    public static final String ETAG = "ETag";
    public static final String EXPIRES = "Expires";
    public static final String HOST = "Host";
    public static final String LOCATION = "Location";
    public static final String USER_AGENT = "User-Agent";
    public static final String ACCEPT = "Accept";
    public static final String CONNECTION = "Connection";
    public static final String TRANSFER_ENCODING = "Transfer-Encoding";

    //keyed case-insensitively; never modified after class init
    private static final Map<String, String> COMMON;
    static {
        Map<String, String> common = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for(String name : new String[] {CACHE_CONTROL, CONTENT_LENGTH, CONTENT_TYPE, DATE, ETAG, EXPIRES, HOST,
                LOCATION, USER_AGENT}) {
            common.put(name, name);
        }
        COMMON = unmodifiableMap(common);
    }

    private HeaderNames() {
    }

    /**
     * Get canonical form of the header name. Well-known headers are looked up regardless of case (so "etag" becomes
     * "ETag"). Everything else gets its first letter and every letter following a hyphen uppercased; the rest of
     * the name is left as it is.
     * @param name header name, as given by the caller or the server
     * @return canonical header name
     */
    public static String normalize(String name) {
        String common = COMMON.get(name);
        if(common != null) return common;

        char[] chars = name.toCharArray();
        boolean upper = true;
        for(int i = 0; i < chars.length; i++) {
            if(upper) chars[i] = Character.toUpperCase(chars[i]);
            upper = chars[i] == '-';
        }
        return new String(chars);
    }
}
