package org.abstractica.tabletop;

/**
 * Kind of transport a connection arrived on.
 */
public enum TransportKind
{
    /** Length-prefixed frames over a TCP stream. */
    STREAM,

    /** One binary web-socket message per frame. */
    WEB_SOCKET,

    /** In-process channel. */
    LOCAL
}
