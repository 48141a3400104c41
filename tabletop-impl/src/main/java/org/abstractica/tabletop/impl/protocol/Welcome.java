package org.abstractica.tabletop.impl.protocol;

import org.abstractica.tabletop.Privilege;

import java.util.Objects;

/**
 * Server's handshake acceptance.
 *
 * <p>Wire format:</p>
 * <pre>
 * [type: 1 byte = 0x02]
 * [sessionIdLength: 2 bytes][sessionId: UTF-8]
 * [identityId: 8 bytes]
 * [nameLength: 2 bytes][name: UTF-8]
 * [privilege: 1 byte]
 * [heartbeatIntervalMs: 4 bytes]
 * [livenessTimeoutMs: 4 bytes]
 * </pre>
 */
public record Welcome(
        String sessionId,
        long identityId,
        String name,
        Privilege privilege,
        int heartbeatIntervalMs,
        int livenessTimeoutMs
) implements Frame
{
    public Welcome
    {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(privilege, "privilege");
    }

    @Override
    public FrameType type()
    {
        return FrameType.WELCOME;
    }
}
