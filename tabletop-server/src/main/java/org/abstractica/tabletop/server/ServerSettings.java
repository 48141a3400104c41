package org.abstractica.tabletop.server;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.impl.auth.StaticAuthenticator;
import org.abstractica.tabletop.impl.session.DefaultServerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Server configuration read from properties.
 *
 * <p>Defaults come from {@code tabletop.properties} on the classpath; an
 * external file overrides individual keys.</p>
 */
public final class ServerSettings
{
    static final String DEFAULTS_RESOURCE = "/tabletop.properties";

    private static final String USER_PREFIX = "auth.user.";
    private static final String ROOM_PREFIX = "room.";

    private final Properties properties;

    public ServerSettings(Properties properties)
    {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Loads the classpath defaults, then overlays the given file.
     *
     * @param overrides optional external properties file
     * @return the merged settings
     */
    public static ServerSettings load(Optional<Path> overrides)
    {
        Properties properties = new Properties();
        try (InputStream in = ServerSettings.class.getResourceAsStream(DEFAULTS_RESOURCE))
        {
            if (in == null)
            {
                throw new IllegalStateException("Missing " + DEFAULTS_RESOURCE + " on classpath");
            }
            properties.load(in);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }

        if (overrides.isPresent())
        {
            Path file = overrides.get();
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
            {
                Properties external = new Properties();
                external.load(reader);
                properties.putAll(external);
            }
            catch (IOException e)
            {
                throw new UncheckedIOException("Cannot read " + file, e);
            }
        }
        return new ServerSettings(properties);
    }

    // ========== Builder Mapping ==========

    /**
     * Copies every configured value onto a server builder.
     *
     * @param builder the builder to configure
     * @return the same builder
     */
    public DefaultServerFactory.DefaultBuilder applyTo(DefaultServerFactory.DefaultBuilder builder)
    {
        String bind = get("server.bindAddress", "");
        if (!bind.isEmpty())
        {
            builder.bindAddress(parseAddress(bind));
        }
        int streamPort = getInt("server.streamPort", -1);
        if (streamPort >= 0)
        {
            builder.streamPort(streamPort);
        }
        int webSocketPort = getInt("server.webSocketPort", -1);
        if (webSocketPort >= 0)
        {
            builder.webSocketPort(webSocketPort);
        }

        builder.maxConnections(getInt("server.maxConnections", 1024))
                .maxFrameSize(getInt("server.maxFrameSize", 4 * 1024 * 1024))
                .maxOutboundQueue(getInt("server.maxOutboundQueue", 512))
                .maxMalformedCommands(getInt("server.maxMalformedCommands", 5))
                .heartbeatInterval(getDuration("server.heartbeatInterval", Duration.ofSeconds(5)))
                .livenessTimeout(getDuration("server.livenessTimeout", Duration.ofSeconds(30)))
                .handshakeTimeout(getDuration("server.handshakeTimeout", Duration.ofSeconds(10)))
                .commandTimeout(getDuration("server.commandTimeout", Duration.ofSeconds(30)))
                .disconnectGracePeriod(getDuration("lobby.disconnectGracePeriod", Duration.ofMinutes(2)))
                .roomIdleTimeout(getDuration("lobby.roomIdleTimeout", Duration.ofMinutes(5)))
                .finishedGameRetention(getDuration("lobby.finishedGameRetention", Duration.ofMinutes(30)));

        int workers = getInt("game.workers", 0);
        if (workers > 0)
        {
            builder.gameWorkers(workers);
        }

        String replayDirectory = get("replay.directory", "");
        if (!replayDirectory.isEmpty())
        {
            builder.replayDirectory(Path.of(replayDirectory));
            builder.syncReplayWrites(Boolean.parseBoolean(get("replay.sync", "false")));
        }

        for (Map.Entry<Integer, String[]> room : rooms().entrySet())
        {
            builder.room(room.getValue()[0], room.getValue()[1]);
        }

        builder.authenticator(authenticator());
        return builder;
    }

    /**
     * Builds the authenticator from the {@code auth.*} keys.
     *
     * @return the authenticator
     */
    public StaticAuthenticator authenticator()
    {
        StaticAuthenticator.Builder auth = StaticAuthenticator.builder()
                .guests(Boolean.parseBoolean(get("auth.guests", "false")));
        for (String key : properties.stringPropertyNames())
        {
            if (!key.startsWith(USER_PREFIX))
            {
                continue;
            }
            String name = key.substring(USER_PREFIX.length());
            String[] parts = properties.getProperty(key).split(":", -1);
            if (parts.length != 3)
            {
                throw new IllegalArgumentException(key + " must be <secret>:<privilege>:<id>");
            }
            Privilege privilege;
            try
            {
                privilege = Privilege.valueOf(parts[1].trim().toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e)
            {
                throw new IllegalArgumentException(key + ": unknown privilege '" + parts[1] + "'", e);
            }
            auth.user(name, parts[0], privilege, parseLong(key, parts[2].trim()));
        }
        return auth.build();
    }

    /**
     * Returns the configured rooms keyed by index, in index order.
     *
     * @return name and description per room
     */
    Map<Integer, String[]> rooms()
    {
        Map<Integer, String[]> rooms = new TreeMap<>();
        for (String key : properties.stringPropertyNames())
        {
            if (!key.startsWith(ROOM_PREFIX) || !key.endsWith(".name"))
            {
                continue;
            }
            String index = key.substring(ROOM_PREFIX.length(), key.length() - ".name".length());
            int order = (int) parseLong(key, index);
            String name = properties.getProperty(key).trim();
            String description = get(ROOM_PREFIX + index + ".description", "");
            rooms.put(order, new String[] {name, description});
        }
        return rooms;
    }

    // ========== Parsing ==========

    String get(String key, String defaultValue)
    {
        return properties.getProperty(key, defaultValue).trim();
    }

    int getInt(String key, int defaultValue)
    {
        String value = get(key, "");
        if (value.isEmpty())
        {
            return defaultValue;
        }
        return (int) parseLong(key, value);
    }

    Duration getDuration(String key, Duration defaultValue)
    {
        String value = get(key, "");
        if (value.isEmpty())
        {
            return defaultValue;
        }
        try
        {
            return Duration.parse(value);
        }
        catch (DateTimeParseException e)
        {
            throw new IllegalArgumentException(key + " is not an ISO-8601 duration: " + value, e);
        }
    }

    private static long parseLong(String key, String value)
    {
        try
        {
            return Long.parseLong(value);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }

    private static InetAddress parseAddress(String value)
    {
        try
        {
            return InetAddress.getByName(value);
        }
        catch (UnknownHostException e)
        {
            throw new IllegalArgumentException("Unknown bind address: " + value, e);
        }
    }
}
