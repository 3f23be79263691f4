package rs.lukaj.httpipe.client;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {
    public static final String CRLF = "\r\n";
    public static final String VERSION = "0.4";
    public static final String USER_AGENT = "Java-HTTPipe/" + VERSION;

    /**
     * HTTP version used for requests. Selected by number: 0 for HTTP/1.0 and 1 for HTTP/1.1; nothing else
     * is spoken here.
     */
    public enum Version {
        HTTP10("HTTP/1.0", 0),
        HTTP11("HTTP/1.1", 1);

        private final String text;
        private final int selector;

        Version(String text, int selector) {
            this.text = text;
            this.selector = selector;
        }

        /**
         * @param selector 0 for HTTP/1.0, 1 for HTTP/1.1
         * @return matching version
         * @throws InvalidRequestException for any other selector
         */
        public static Version fromSelector(int selector) {
            for(Version version : values()) {
                if(version.selector == selector) return version;
            }
            throw new InvalidRequestException("unknown HTTP version: " + selector);
        }

        public int getSelector() {
            return selector;
        }

        /**
         * @return tail of the request line for this version, including the leading space and trailing CRLF
         */
        public String requestLineSuffix() {
            return " " + text + CRLF;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * How much of the response {@link Pipe#request} reads on its own.
     */
    public enum StreamMode {
        /**
         * Read the whole response, body included.
         */
        NONE,
        /**
         * Don't read anything; caller drives {@link Pipe#read()} from the status line on.
         */
        FULL,
        /**
         * Read status line and headers; caller reads the body using {@link Pipe#readBody()}.
         */
        BODY
    }
}
