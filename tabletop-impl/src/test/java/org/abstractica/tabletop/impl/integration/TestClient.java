package org.abstractica.tabletop.impl.integration;

import org.abstractica.tabletop.DisconnectReason;
import org.abstractica.tabletop.impl.protocol.CommandFrame;
import org.abstractica.tabletop.impl.protocol.Disconnect;
import org.abstractica.tabletop.impl.protocol.EnvelopeCodec;
import org.abstractica.tabletop.impl.protocol.EventFrame;
import org.abstractica.tabletop.impl.protocol.Frame;
import org.abstractica.tabletop.impl.protocol.FrameCodec;
import org.abstractica.tabletop.impl.protocol.Heartbeat;
import org.abstractica.tabletop.impl.protocol.HeartbeatAck;
import org.abstractica.tabletop.impl.protocol.Hello;
import org.abstractica.tabletop.impl.protocol.Notice;
import org.abstractica.tabletop.impl.protocol.Reject;
import org.abstractica.tabletop.impl.protocol.ResponseFrame;
import org.abstractica.tabletop.impl.protocol.Welcome;
import org.abstractica.tabletop.impl.serialization.DefaultProtocol;
import org.abstractica.tabletop.impl.transport.ChannelHandler;
import org.abstractica.tabletop.impl.transport.MessageChannel;
import org.abstractica.tabletop.protocol.Command;
import org.abstractica.tabletop.protocol.CommandEnvelope;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.Event;
import org.abstractica.tabletop.protocol.EventEnvelope;
import org.abstractica.tabletop.protocol.OriginKind;
import org.abstractica.tabletop.protocol.Reply;
import org.abstractica.tabletop.protocol.ResponseEnvelope;
import org.abstractica.tabletop.protocol.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Minimal protocol client for driving a server in tests.
 *
 * <p>Records every frame it receives and answers heartbeats unless told
 * not to. All waits give up after {@link #TIMEOUT_SECONDS}.</p>
 */
public final class TestClient implements ChannelHandler, AutoCloseable
{
    static final long TIMEOUT_SECONDS = 5;

    private static final DefaultProtocol PROTOCOL = DefaultProtocol.tabletop();
    private static final EnvelopeCodec CODEC = new EnvelopeCodec(PROTOCOL);

    private final MessageChannel channel;
    private final Object lock = new Object();
    private final Map<Integer, ResponseEnvelope> responses = new HashMap<>();
    private final List<EventEnvelope> events = new ArrayList<>();
    private final List<Notice> notices = new ArrayList<>();
    private Welcome welcome;
    private Reject reject;
    private Disconnect disconnect;
    private DisconnectReason closedReason;
    private int nextCorrelationId = 1;
    private volatile boolean answerHeartbeats = true;

    /**
     * Wraps a client channel and installs itself as its handler.
     *
     * @param channel the client end of a connection
     */
    public TestClient(MessageChannel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        channel.setHandler(this);
    }

    public static DefaultProtocol protocol()
    {
        return PROTOCOL;
    }

    // ========== Handshake ==========

    public void hello(String user, String secret)
    {
        sendFrame(new Hello(FrameCodec.VERSION, PROTOCOL.getHashBytes(), user, secret));
    }

    /**
     * Sends a hello and waits for the welcome.
     *
     * @return the welcome
     */
    public Welcome login(String user, String secret)
    {
        hello(user, secret);
        return awaitWelcome();
    }

    public Welcome awaitWelcome()
    {
        return await("welcome", () ->
        {
            if (reject != null)
            {
                fail("Rejected: " + reject.reasonCode() + " - " + reject.message());
            }
            return welcome;
        });
    }

    public Reject awaitReject()
    {
        return await("reject", () -> reject);
    }

    public void sendFrame(Frame frame)
    {
        channel.send(FrameCodec.encode(frame));
    }

    public void answerHeartbeats(boolean answer)
    {
        this.answerHeartbeats = answer;
    }

    // ========== Commands ==========

    /**
     * Sends a command without waiting for its response.
     *
     * @param target target id for room and game scopes, else null
     * @return the correlation id
     */
    public int send(Scope scope, Long target, Command command)
    {
        int correlationId;
        synchronized (lock)
        {
            correlationId = nextCorrelationId++;
        }
        CommandEnvelope envelope = new CommandEnvelope(correlationId, scope, Optional.ofNullable(target), command);
        CommandFrame frame = CODEC.encodeCommand(envelope);
        channel.send(FrameCodec.encode(frame));
        return correlationId;
    }

    public ResponseEnvelope awaitResponse(int correlationId)
    {
        return await("response to " + correlationId, () -> responses.get(correlationId));
    }

    public ResponseEnvelope call(Scope scope, Long target, Command command)
    {
        return awaitResponse(send(scope, target, command));
    }

    /**
     * Sends a command and asserts that it succeeds with a reply of the given type.
     */
    public <T extends Reply> T ok(Scope scope, Long target, Command command, Class<T> replyType)
    {
        ResponseEnvelope response = call(scope, target, command);
        if (response.result() instanceof ResponseEnvelope.Failure failure)
        {
            fail(command.getClass().getSimpleName() + " failed: " + failure.code() + " - " + failure.message());
        }
        return replyType.cast(((ResponseEnvelope.Success) response.result()).reply());
    }

    /**
     * Sends a command and asserts that it fails.
     *
     * @return the error code
     */
    public ErrorCode error(Scope scope, Long target, Command command)
    {
        ResponseEnvelope response = call(scope, target, command);
        ResponseEnvelope.Failure failure = assertInstanceOf(ResponseEnvelope.Failure.class, response.result(),
                command.getClass().getSimpleName() + " should fail");
        return failure.code();
    }

    // ========== Events ==========

    /**
     * Waits for the first event of a type matching a condition, among all
     * events received so far and later.
     */
    public <T extends Event> T awaitEvent(Class<T> type, Predicate<T> condition)
    {
        return await(type.getSimpleName(), () ->
        {
            for (EventEnvelope envelope : events)
            {
                if (type.isInstance(envelope.payload()) && condition.test(type.cast(envelope.payload())))
                {
                    return type.cast(envelope.payload());
                }
            }
            return null;
        });
    }

    public <T extends Event> T awaitEvent(Class<T> type)
    {
        return awaitEvent(type, e -> true);
    }

    public List<EventEnvelope> events()
    {
        synchronized (lock)
        {
            return List.copyOf(events);
        }
    }

    /**
     * Returns the events of one game, in arrival order.
     */
    public List<EventEnvelope> gameEvents(long gameId)
    {
        List<EventEnvelope> result = new ArrayList<>();
        for (EventEnvelope envelope : events())
        {
            if (envelope.originKind() == OriginKind.GAME && envelope.originId() == gameId)
            {
                result.add(envelope);
            }
        }
        return result;
    }

    public <T extends Event> boolean hasEvent(Class<T> type)
    {
        for (EventEnvelope envelope : events())
        {
            if (type.isInstance(envelope.payload()))
            {
                return true;
            }
        }
        return false;
    }

    public Notice awaitNotice(Predicate<Notice> condition)
    {
        return await("notice", () ->
        {
            for (Notice notice : notices)
            {
                if (condition.test(notice))
                {
                    return notice;
                }
            }
            return null;
        });
    }

    // ========== Closing ==========

    public Disconnect awaitDisconnect()
    {
        return await("disconnect", () -> disconnect);
    }

    public DisconnectReason awaitClosed()
    {
        return await("close", () -> closedReason);
    }

    public boolean isClosed()
    {
        synchronized (lock)
        {
            return closedReason != null;
        }
    }

    @Override
    public void close()
    {
        channel.close();
    }

    // ========== ChannelHandler ==========

    @Override
    public void onFrame(byte[] data)
    {
        Frame frame = FrameCodec.decode(data);
        if (frame instanceof Heartbeat heartbeat)
        {
            if (answerHeartbeats)
            {
                sendFrame(new HeartbeatAck(heartbeat.timestamp(), System.currentTimeMillis()));
            }
            return;
        }
        synchronized (lock)
        {
            if (frame instanceof Welcome w)
            {
                welcome = w;
            }
            else if (frame instanceof Reject r)
            {
                reject = r;
            }
            else if (frame instanceof ResponseFrame response)
            {
                ResponseEnvelope envelope = CODEC.decodeResponse(response);
                responses.put(envelope.correlationId(), envelope);
            }
            else if (frame instanceof EventFrame event)
            {
                events.add(CODEC.decodeEvent(event));
            }
            else if (frame instanceof Notice notice)
            {
                notices.add(notice);
            }
            else if (frame instanceof Disconnect d)
            {
                disconnect = d;
            }
            lock.notifyAll();
        }
    }

    @Override
    public void onClosed(DisconnectReason reason)
    {
        synchronized (lock)
        {
            closedReason = reason;
            lock.notifyAll();
        }
    }

    private <T> T await(String what, Supplier<T> probe)
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        synchronized (lock)
        {
            while (true)
            {
                T value = probe.get();
                if (value != null)
                {
                    return value;
                }
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0)
                {
                    return fail("Timed out waiting for " + what);
                }
                try
                {
                    lock.wait(remaining);
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    return fail("Interrupted waiting for " + what);
                }
            }
        }
    }
}
