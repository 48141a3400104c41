package org.abstractica.tabletop.impl.protocol;

/**
 * Thrown when a frame is corrupt: unknown type, truncated body, bad length
 * or an invalid code.
 *
 * <p>Frame corruption is fatal to the connection.</p>
 */
public class FrameFormatException extends RuntimeException
{
    public FrameFormatException(String message)
    {
        super(message);
    }
}
