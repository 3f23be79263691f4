package rs.lukaj.httpipe.client;

import java.io.IOException;

/**
 * Supplies a request body piece by piece. The pipe keeps pulling until the declared {@code Content-Length}
 * has been sent, so producers must supply exactly that many bytes.
 */
@FunctionalInterface
public interface BodyProducer {
    /**
     * @return next piece of the body, or null if there is no more data
     * @throws IOException if obtaining data fails
     */
    byte[] next() throws IOException;
}
