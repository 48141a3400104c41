package org.abstractica.tabletop;

/**
 * The command and event payload schema shared by client and server.
 *
 * <p>The schema is derived from the sealed command and server message
 * hierarchies. Client and server must have matching hashes to communicate.</p>
 */
public interface Protocol
{
    /**
     * Returns the protocol hash for version matching.
     *
     * @return hex-encoded SHA-256 of the payload schema
     */
    String getHash();
}
