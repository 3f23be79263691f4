/**
 * The HTTP/1.x protocol engine: request encoding, the response state machine and connection reuse.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.httpipe.client.Pipe} is what the programmer uses. It sends a request described by
 * {@link rs.lukaj.httpipe.client.RequestOptions} and either reads the whole response on its own, or lets the caller
 * pull it step by step as {@link rs.lukaj.httpipe.client.ResponseEvent}s.
 * <br/>
 * {@link rs.lukaj.httpipe.client.RequestEncoder} turns options into bytes. It fills in the headers servers expect
 * (Host, User-Agent, Accept, Content-Length) and escapes path and query using
 * {@link rs.lukaj.httpipe.client.UriEscaper}.
 * <br/>
 * The response is parsed one state at a time ({@link rs.lukaj.httpipe.client.PipeState}): status line, headers,
 * body either by Content-Length or chunked, and finally eof, at which point the connection goes back to the pool
 * or gets closed, whichever the server allowed.
 * <br/>
 * Header names are kept in their canonical form, see {@link rs.lukaj.httpipe.client.HeaderNames}.
 */
package rs.lukaj.httpipe.client;
