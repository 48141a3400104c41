package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replay store keeping one append-only file per game.
 *
 * <p>Storage layout:</p>
 * <pre>
 * dir/
 *   game-1.log
 *   game-2.log
 *   ...
 * </pre>
 *
 * <p>Each file is a sequence of records:</p>
 * <pre>
 * [length: 4 bytes]
 * [crc32: 4 bytes, over the frame]
 * [frame: event frame as sent on the wire]
 * </pre>
 *
 * <p>A record that is cut short or fails its checksum marks a torn tail left
 * by a crash; it and everything after it are truncated when the file is
 * reopened.</p>
 */
public final class FileReplayStore implements ReplayStore
{
    private static final Logger LOG = LoggerFactory.getLogger(FileReplayStore.class);

    private static final Pattern FILE_NAME = Pattern.compile("game-(\\d+)\\.log");

    private final Path dir;
    private final EnvelopeCodec codec;
    private final boolean sync;
    private final Map<Long, FileReplayLog> logs = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates a store rooted at a directory, creating the directory if needed.
     *
     * @param dir      directory holding the log files
     * @param protocol protocol used to encode events
     * @param sync     whether every append is forced to disk
     */
    public FileReplayStore(Path dir, DefaultProtocol protocol, boolean sync)
    {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.codec = new EnvelopeCodec(Objects.requireNonNull(protocol, "protocol"));
        this.sync = sync;
        try
        {
            Files.createDirectories(dir);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot create replay directory " + dir, e);
        }
        LOG.info("Replay store at {} (sync={})", dir.toAbsolutePath(), sync);
    }

    @Override
    public ReplayLog open(long gameId)
    {
        if (closed)
        {
            throw new IllegalStateException("Replay store is closed");
        }
        return logs.computeIfAbsent(gameId, id -> new FileReplayLog(id, pathOf(id), codec, sync));
    }

    @Override
    public boolean exists(long gameId)
    {
        FileReplayLog log = logs.get(gameId);
        if (log != null)
        {
            return log.lastSequence() > 0;
        }
        Path path = pathOf(gameId);
        try
        {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public OptionalLong maxGameId()
    {
        long[] ids = gameIds();
        return ids.length == 0 ? OptionalLong.empty() : OptionalLong.of(ids[ids.length - 1]);
    }

    @Override
    public long[] gameIds()
    {
        List<Long> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "game-*.log"))
        {
            for (Path file : files)
            {
                Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
                if (matcher.matches() && Files.size(file) > 0)
                {
                    ids.add(Long.parseLong(matcher.group(1)));
                }
            }
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot list replay directory " + dir, e);
        }
        return ids.stream().mapToLong(Long::longValue).sorted().toArray();
    }

    public Path getDirectory()
    {
        return dir;
    }

    @Override
    public void close()
    {
        closed = true;
        for (FileReplayLog log : logs.values())
        {
            log.close();
        }
        logs.clear();
    }

    private Path pathOf(long gameId)
    {
        return dir.resolve("game-" + gameId + ".log");
    }
}
