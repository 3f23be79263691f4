/**
 * This package implements the byte-stream layer the protocol engine runs on. Nothing in here knows HTTP.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.httpipe.connections.Transport} is what the engine talks to: connect, send, receive a number of
 * bytes, receive up to a delimiter, set timeouts, and close or hand the connection back for reuse.
 * <br/>
 * {@link rs.lukaj.httpipe.connections.SocketTransport} implements it over TCP or unix domain sockets, wrapped as
 * {@link rs.lukaj.httpipe.connections.Connection}s.
 * <br/>
 * {@link rs.lukaj.httpipe.connections.ConnectionPool} (implemented as
 * {@link rs.lukaj.httpipe.connections.KeepalivePool}) keeps idle connections per
 * {@link rs.lukaj.httpipe.connections.Endpoint} so a later request can skip the connect.
 * <br/>
 * A peer closing the connection mid-read is reported as
 * {@link rs.lukaj.httpipe.connections.ConnectionClosedException}, which keeps whatever arrived before the close.
 */
package rs.lukaj.httpipe.connections;
