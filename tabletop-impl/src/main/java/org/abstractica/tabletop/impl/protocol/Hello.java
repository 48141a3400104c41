package org.abstractica.tabletop.impl.protocol;

import java.util.Objects;

/**
 * Client's opening frame.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x01]
 * [version: 1 byte]
 * [protocolHash: 32 bytes]
 * [userLength: 2 bytes][user: UTF-8]
 * [secretLength: 2 bytes][secret: UTF-8]
 * </pre>
 *
 * @param version      wire protocol version
 * @param protocolHash SHA-256 of the payload schema
 * @param user         login name
 * @param secret       credential, may be empty for guests
 */
public record Hello(
        int version,
        byte[] protocolHash,
        String user,
        String secret
) implements Frame
{
    public static final int HASH_LENGTH = 32;

    public Hello
    {
        Objects.requireNonNull(protocolHash, "protocolHash");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(secret, "secret");
        if (protocolHash.length != HASH_LENGTH)
        {
            throw new IllegalArgumentException("Protocol hash must be 32 bytes, got: " + protocolHash.length);
        }
        if (version < 0 || version > 0xFF)
        {
            throw new IllegalArgumentException("Version out of range: " + version);
        }
    }

    @Override
    public FrameType type()
    {
        return FrameType.HELLO;
    }
}
