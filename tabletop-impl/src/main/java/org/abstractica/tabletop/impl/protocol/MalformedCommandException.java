package org.abstractica.tabletop.impl.protocol;

/**
 * Thrown when a command frame cannot be turned into a routable command:
 * undecodable payload, unknown scope, missing or unexpected target id,
 * a payload that does not belong to its scope, or a duplicate outstanding
 * correlation id.
 *
 * <p>Malformed commands are dropped without a response.</p>
 */
public class MalformedCommandException extends RuntimeException
{
    private final int correlationId;

    public MalformedCommandException(int correlationId, String message)
    {
        super(message);
        this.correlationId = correlationId;
    }

    public int getCorrelationId()
    {
        return correlationId;
    }
}
