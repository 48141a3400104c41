package org.abstractica.tabletop;

/**
 * Verifies handshake credentials.
 *
 * <p>Account storage is external to the server; implementations adapt whatever
 * store is in use. Called from connection threads, so implementations must be
 * thread-safe.</p>
 */
@FunctionalInterface
public interface Authenticator
{
    /**
     * Authenticates a user.
     *
     * @param user   the user name presented by the client
     * @param secret the secret presented by the client
     * @return the authenticated identity
     * @throws AuthenticationException if the credentials are not accepted
     */
    Identity authenticate(String user, String secret) throws AuthenticationException;
}
