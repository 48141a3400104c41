package org.abstractica.tabletop;

/**
 * Thrown when credentials presented during the handshake are rejected.
 */
public class AuthenticationException extends Exception
{
    public AuthenticationException(String message)
    {
        super(message);
    }
}
