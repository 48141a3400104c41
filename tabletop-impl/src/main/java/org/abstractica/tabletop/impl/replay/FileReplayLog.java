package org.abstractica.tabletop.impl.replay;

import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.protocol.EventFrame;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.FrameFormatException;
import org.abstractica.tabletop.impl.serialization.CodecException;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.GameEvent;
import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.SequencedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * One game's log file. See {@link FileReplayStore} for the record layout.
 */
final class FileReplayLog implements ReplayLog
{
    private static final Logger LOG = LoggerFactory.getLogger(FileReplayLog.class);

    static final int HEADER_SIZE = 8;
    static final int MAX_RECORD_SIZE = 64 * 1024 * 1024;

    private final long gameId;
    private final Path path;
    private final EnvelopeCodec codec;
    private final boolean sync;
    private final FileChannel channel;

    // committedSize is published after lastSequence; readers bound themselves by it
    private volatile long committedSize;
    private volatile long lastSequence;

    FileReplayLog(long gameId, Path path, EnvelopeCodec codec, boolean sync)
    {
        this.gameId = gameId;
        this.path = Objects.requireNonNull(path, "path");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sync = sync;
        try
        {
            this.channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
            recover();
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot open replay log " + path, e);
        }
    }

    @Override
    public long gameId()
    {
        return gameId;
    }

    // ========== Recovery ==========

    private void recover() throws IOException
    {
        long size = channel.size();
        long position = 0;
        long sequence = 0;

        while (position < size)
        {
            RecordRead record = readRecord(position, size);
            if (record == null || record.event.sequence() != sequence + 1)
            {
                break;
            }
            sequence = record.event.sequence();
            position = record.nextPosition;
        }

        if (position < size)
        {
            LOG.warn("Game {}: truncating torn tail of {} at offset {} ({} bytes dropped)",
                    gameId, path.getFileName(), position, size - position);
            channel.truncate(position);
            channel.force(true);
        }

        lastSequence = sequence;
        committedSize = position;
        if (sequence > 0)
        {
            LOG.debug("Game {}: recovered {} events from {}", gameId, sequence, path.getFileName());
        }
    }

    /**
     * Reads the record at a position.
     *
     * @return the record, or null if it is incomplete or corrupt
     */
    private RecordRead readRecord(long position, long limit) throws IOException
    {
        if (limit - position < HEADER_SIZE)
        {
            return null;
        }
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        readFully(header, position);
        header.flip();
        int length = header.getInt();
        int crc = header.getInt();
        if (length <= 0 || length > MAX_RECORD_SIZE || limit - position - HEADER_SIZE < length)
        {
            return null;
        }

        ByteBuffer body = ByteBuffer.allocate(length);
        readFully(body, position + HEADER_SIZE);
        byte[] bytes = body.array();
        if (checksum(bytes) != crc)
        {
            return null;
        }

        SequencedEvent event = decode(bytes);
        if (event == null)
        {
            return null;
        }
        return new RecordRead(event, position + HEADER_SIZE + length);
    }

    private SequencedEvent decode(byte[] bytes)
    {
        try
        {
            Frame frame = FrameCodec.decode(bytes);
            if (!(frame instanceof EventFrame eventFrame))
            {
                return null;
            }
            EventEnvelope envelope = codec.decodeEvent(eventFrame);
            if (envelope.originKind() != OriginKind.GAME
                    || envelope.originId() != gameId
                    || !(envelope.payload() instanceof GameEvent event))
            {
                return null;
            }
            return new SequencedEvent(envelope.sequence(), event);
        }
        catch (FrameFormatException | CodecException e)
        {
            LOG.debug("Game {}: undecodable record: {}", gameId, e.getMessage());
            return null;
        }
    }

    private void readFully(ByteBuffer buffer, long position) throws IOException
    {
        while (buffer.hasRemaining())
        {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0)
            {
                throw new IOException("Unexpected end of " + path.getFileName());
            }
        }
    }

    private static int checksum(byte[] bytes)
    {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return (int) crc.getValue();
    }

    // ========== Append ==========

    @Override
    public synchronized void append(SequencedEvent event)
    {
        Objects.requireNonNull(event, "event");
        long expected = lastSequence + 1;
        if (event.sequence() != expected)
        {
            throw new IllegalArgumentException(
                    "Game " + gameId + ": expected sequence " + expected + ", got " + event.sequence());
        }

        byte[] frame = codec.eventBytes(EventEnvelope.game(gameId, event.sequence(), event.event()));
        ByteBuffer record = ByteBuffer.allocate(HEADER_SIZE + frame.length);
        record.putInt(frame.length);
        record.putInt(checksum(frame));
        record.put(frame);
        record.flip();

        long position = committedSize;
        try
        {
            while (record.hasRemaining())
            {
                position += channel.write(record, position);
            }
            if (sync)
            {
                channel.force(false);
            }
        }
        catch (IOException e)
        {
            rollback();
            throw new UncheckedIOException("Game " + gameId + ": append of sequence " + event.sequence() + " failed", e);
        }

        lastSequence = event.sequence();
        committedSize = position;
    }

    private void rollback()
    {
        try
        {
            channel.truncate(committedSize);
        }
        catch (IOException e)
        {
            LOG.error("Game {}: cannot roll back partial record in {}", gameId, path.getFileName(), e);
        }
    }

    @Override
    public long lastSequence()
    {
        return lastSequence;
    }

    // ========== Read ==========

    @Override
    public ReplayCursor read(long afterSequence)
    {
        return new FileCursor(afterSequence, committedSize);
    }

    void close()
    {
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Game {}: error closing {}", gameId, path.getFileName(), e);
        }
    }

    private record RecordRead(SequencedEvent event, long nextPosition) {}

    private final class FileCursor implements ReplayCursor
    {
        private final long afterSequence;
        private final long limit;
        private long position;
        private SequencedEvent pending;

        FileCursor(long afterSequence, long limit)
        {
            this.afterSequence = afterSequence;
            this.limit = limit;
        }

        @Override
        public boolean hasNext()
        {
            while (pending == null && position < limit)
            {
                RecordRead record;
                try
                {
                    record = readRecord(position, limit);
                }
                catch (IOException e)
                {
                    throw new UncheckedIOException("Game " + gameId + ": read failed at offset " + position, e);
                }
                if (record == null)
                {
                    throw new UncheckedIOException(new IOException(
                            "Game " + gameId + ": corrupt record at offset " + position + " in " + path.getFileName()));
                }
                position = record.nextPosition;
                if (record.event.sequence() > afterSequence)
                {
                    pending = record.event;
                }
            }
            return pending != null;
        }

        @Override
        public SequencedEvent next()
        {
            if (!hasNext())
            {
                throw new NoSuchElementException();
            }
            SequencedEvent event = pending;
            pending = null;
            return event;
        }

        @Override
        public void close()
        {
            position = limit;
            pending = null;
        }
    }
}
