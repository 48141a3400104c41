package org.abstractica.tabletop.protocol;

import java.util.Objects;

/**
 * The terminal reply to one command.
 *
 * @param correlationId the command's correlation id
 * @param result        success payload or error
 */
public record ResponseEnvelope(int correlationId, Result result)
{
    public ResponseEnvelope
    {
        Objects.requireNonNull(result, "result");
    }

    public static ResponseEnvelope success(int correlationId, Reply reply)
    {
        return new ResponseEnvelope(correlationId, new Success(reply));
    }

    public static ResponseEnvelope failure(int correlationId, ErrorCode code, String message)
    {
        return new ResponseEnvelope(correlationId, new Failure(code, message));
    }

    public boolean isSuccess()
    {
        return result instanceof Success;
    }

    /**
     * Outcome of a command.
     */
    public sealed interface Result permits Success, Failure {}

    public record Success(Reply reply) implements Result
    {
        public Success
        {
            Objects.requireNonNull(reply, "reply");
        }
    }

    public record Failure(ErrorCode code, String message) implements Result
    {
        public Failure
        {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
        }
    }
}
