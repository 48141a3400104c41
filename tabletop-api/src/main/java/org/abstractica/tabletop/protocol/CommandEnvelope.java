package org.abstractica.tabletop.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * One client request.
 *
 * @param correlationId id chosen by the client, echoed in the response
 * @param scope         target scope
 * @param targetId      room or game id for targeted scopes
 * @param payload       the command
 */
public record CommandEnvelope(int correlationId, Scope scope, Optional<Long> targetId, Command payload)
{
    public CommandEnvelope
    {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(payload, "payload");
    }

    public static CommandEnvelope untargeted(int correlationId, Scope scope, Command payload)
    {
        return new CommandEnvelope(correlationId, scope, Optional.empty(), payload);
    }

    public static CommandEnvelope targeted(int correlationId, Scope scope, long targetId, Command payload)
    {
        return new CommandEnvelope(correlationId, scope, Optional.of(targetId), payload);
    }
}
