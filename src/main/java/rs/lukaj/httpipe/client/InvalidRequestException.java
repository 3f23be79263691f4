package rs.lukaj.httpipe.client;

/**
 * Thrown when request is in invalid state (e.g. an unknown HTTP version, or a body which doesn't match
 * its declared length)
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
