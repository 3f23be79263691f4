package rs.lukaj.httpipe.client;

/**
 * A single response header line. Lines without a colon are kept as they came: name is null and the value holds
 * the whole line.
 */
public class HeaderLine {
    private final String name;
    private final String value;
    private final String rawLine;

    HeaderLine(String name, String value, String rawLine) {
        this.name = name;
        this.value = value;
        this.rawLine = rawLine;
    }

    /**
     * @return canonical header name, or null if the line had no colon
     */
    public String getName() {
        return name;
    }
    public String getValue() {
        return value;
    }
    public String getRawLine() {
        return rawLine;
    }

    /**
     * @return whether the line was a proper {@code name: value} pair
     */
    public boolean isWellFormed() {
        return name != null;
    }

    @Override
    public String toString() {
        return rawLine;
    }
}
