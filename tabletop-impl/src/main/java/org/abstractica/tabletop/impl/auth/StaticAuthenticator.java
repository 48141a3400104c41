package org.abstractica.tabletop.impl.auth;

import org.abstractica.tabletop.AuthenticationException;
import org.abstractica.tabletop.Authenticator;
import org.abstractica.tabletop.Identity;
import org.abstractica.tabletop.Privilege;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Authenticator backed by a fixed user table.
 *
 * <p>Names are matched ignoring case. With guests enabled, a name that is not
 * in the table is admitted as a {@link Privilege#USER} whose id is derived from
 * the name, so the same guest name always maps to the same identity.</p>
 */
public final class StaticAuthenticator implements Authenticator
{
    private static final Logger LOG = LoggerFactory.getLogger(StaticAuthenticator.class);

    /**
     * Guest ids start here, above any id an operator is expected to assign.
     */
    public static final long GUEST_ID_BASE = 1_000_000_000L;

    private static final int MAX_NAME_LENGTH = 32;

    private final Map<String, Account> accounts;
    private final boolean guests;

    private StaticAuthenticator(Map<String, Account> accounts, boolean guests)
    {
        this.accounts = Map.copyOf(accounts);
        this.guests = guests;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public Identity authenticate(String user, String secret) throws AuthenticationException
    {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(secret, "secret");

        String name = user.trim();
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH)
        {
            throw new AuthenticationException("Invalid user name");
        }

        Account account = accounts.get(key(name));
        if (account == null)
        {
            if (!guests)
            {
                LOG.debug("Unknown user: {}", name);
                throw new AuthenticationException("Unknown user");
            }
            return new Identity(guestId(name), name, Privilege.USER);
        }

        if (!MessageDigest.isEqual(account.secret(), secret.getBytes(StandardCharsets.UTF_8)))
        {
            LOG.debug("Wrong secret for {}", account.name());
            throw new AuthenticationException("Wrong secret");
        }
        return new Identity(account.id(), account.name(), account.privilege());
    }

    /**
     * Returns the identity id a guest with the given name receives.
     *
     * @param name the guest name
     * @return a positive id at or above {@link #GUEST_ID_BASE}
     */
    public static long guestId(String name)
    {
        return GUEST_ID_BASE + (key(name).hashCode() & 0x7fffffff);
    }

    public boolean allowsGuests()
    {
        return guests;
    }

    public int getUserCount()
    {
        return accounts.size();
    }

    private static String key(String name)
    {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private record Account(long id, String name, byte[] secret, Privilege privilege) {}

    public static final class Builder
    {
        private final Map<String, Account> accounts = new HashMap<>();
        private final Set<Long> ids = new HashSet<>();
        private boolean guests;

        private Builder() {}

        /**
         * Adds a registered user.
         *
         * @param name      login name, unique ignoring case
         * @param secret    the shared secret
         * @param privilege granted privilege
         * @param id        identity id, positive and below {@link #GUEST_ID_BASE}
         * @return this builder
         */
        public Builder user(String name, String secret, Privilege privilege, long id)
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(secret, "secret");
            Objects.requireNonNull(privilege, "privilege");
            String trimmed = name.trim();
            if (trimmed.isEmpty() || trimmed.length() > MAX_NAME_LENGTH)
            {
                throw new IllegalArgumentException("Invalid user name: '" + name + "'");
            }
            if (id <= 0 || id >= GUEST_ID_BASE)
            {
                throw new IllegalArgumentException("User id must be in 1.." + (GUEST_ID_BASE - 1) + ": " + id);
            }
            if (accounts.containsKey(key(trimmed)))
            {
                throw new IllegalArgumentException("Duplicate user: " + trimmed);
            }
            if (!ids.add(id))
            {
                throw new IllegalArgumentException("Duplicate user id: " + id);
            }
            accounts.put(key(trimmed), new Account(id, trimmed, secret.getBytes(StandardCharsets.UTF_8), privilege));
            return this;
        }

        public Builder guests(boolean guests)
        {
            this.guests = guests;
            return this;
        }

        public StaticAuthenticator build()
        {
            return new StaticAuthenticator(accounts, guests);
        }
    }
}
