package rs.lukaj.httpipe.connections;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EndpointTest {

    @Test
    public void tcpEndpoint() {
        Endpoint endpoint = Endpoint.of("example.org", 8080);
        assertFalse(endpoint.isUnix());
        assertEquals("example.org:8080", endpoint.toString());
        assertEquals(Endpoint.of("example.org", 8080), endpoint);
        assertNotEquals(Endpoint.of("example.org", 80), endpoint);
        assertThrows(IllegalArgumentException.class, () -> Endpoint.of("example.org", 0));
        assertThrows(NullPointerException.class, () -> Endpoint.of(null, 80));
    }

    @Test
    public void unixEndpoint() {
        assertTrue(Endpoint.isUnixTarget("unix:/tmp/app.sock"));
        assertFalse(Endpoint.isUnixTarget("example.org"));
        assertFalse(Endpoint.isUnixTarget(null));

        Endpoint endpoint = Endpoint.unix("unix:/tmp/app.sock");
        assertTrue(endpoint.isUnix());
        assertEquals("/tmp/app.sock", endpoint.getSocketPath());
        assertEquals(endpoint, Endpoint.unix("/tmp/app.sock"));
        assertEquals("unix:/tmp/app.sock", endpoint.toString());
        assertThrows(IllegalArgumentException.class, () -> Endpoint.unix("unix:"));
    }
}
