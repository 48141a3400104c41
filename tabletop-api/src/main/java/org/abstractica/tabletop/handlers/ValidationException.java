package org.abstractica.tabletop.handlers;

import org.abstractica.tabletop.protocol.ErrorCode;

import java.util.Objects;

/**
 * A command was rejected by validation. No state was changed.
 */
public class ValidationException extends RuntimeException
{
    private final ErrorCode code;

    public ValidationException(ErrorCode code, String message)
    {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode()
    {
        return code;
    }
}
