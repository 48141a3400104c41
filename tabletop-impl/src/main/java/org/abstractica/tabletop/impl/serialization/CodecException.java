package org.abstractica.tabletop.impl.serialization;

/**
 * Thrown when bytes cannot be decoded into a message.
 */
public class CodecException extends RuntimeException
{
    public CodecException(String message)
    {
        super(message);
    }
}
