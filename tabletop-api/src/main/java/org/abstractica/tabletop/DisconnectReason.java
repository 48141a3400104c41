package org.abstractica.tabletop;

import java.io.IOException;

/**
 * Reason for session disconnection.
 *
 * <p>Sealed interface enabling exhaustive handling of disconnect causes.</p>
 */
public sealed interface DisconnectReason
{
    /**
     * The peer closed the connection.
     *
     * @param message reason given by the peer, possibly empty
     */
    record ClosedByPeer(String message) implements DisconnectReason {}

    /**
     * Network-level error occurred.
     *
     * @param cause the underlying I/O exception
     */
    record NetworkError(IOException cause) implements DisconnectReason {}

    /**
     * No inbound traffic within the liveness window.
     */
    record Timeout() implements DisconnectReason {}

    /**
     * Server explicitly disconnected the client.
     *
     * @param message reason provided by server
     */
    record KickedByServer(String message) implements DisconnectReason {}

    /**
     * Protocol error (frame corruption, repeated malformed commands).
     *
     * @param details description of the protocol violation
     */
    record ProtocolError(String details) implements DisconnectReason {}

    /**
     * The outbound queue overflowed because the client did not keep up.
     */
    record Overflow() implements DisconnectReason {}

    /**
     * The same identity logged in on another connection.
     */
    record Replaced() implements DisconnectReason {}

    /**
     * Server is shutting down.
     */
    record ServerShutdown() implements DisconnectReason {}
}
