package org.abstractica.tabletop.impl.protocol;

import org.abstractica.tabletop.Privilege;
import org.abstractica.tabletop.protocol.NoticeLevel;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FrameCodec}.
 */
class FrameCodecTest
{
    private static byte[] hash()
    {
        byte[] hash = new byte[Hello.HASH_LENGTH];
        for (int i = 0; i < hash.length; i++)
        {
            hash[i] = (byte) i;
        }
        return hash;
    }

    // ========== Handshake Frames ==========

    @Test
    void hello_roundTrip()
    {
        Hello hello = new Hello(FrameCodec.VERSION, hash(), "alice", "s3cret");

        Hello decoded = (Hello) FrameCodec.decode(FrameCodec.encode(hello));

        assertEquals(FrameCodec.VERSION, decoded.version());
        assertArrayEquals(hash(), decoded.protocolHash());
        assertEquals("alice", decoded.user());
        assertEquals("s3cret", decoded.secret());
    }

    @Test
    void welcome_roundTrip()
    {
        Welcome welcome = new Welcome("session-1", 42, "alice", Privilege.MODERATOR, 5000, 30000);

        assertEquals(welcome, FrameCodec.decode(FrameCodec.encode(welcome)));
    }

    @Test
    void reject_wireFormat()
    {
        byte[] encoded = FrameCodec.encode(new Reject(Reject.RejectReason.SERVER_FULL, "Full"));

        assertEquals(FrameType.REJECT.getId(), encoded[0]);
        assertEquals(Reject.RejectReason.SERVER_FULL.getCode(), encoded[1]);
        assertEquals(new Reject(Reject.RejectReason.SERVER_FULL, "Full"), FrameCodec.decode(encoded));
    }

    // ========== Command Frames ==========

    @Test
    void command_withTarget_wireFormat()
    {
        CommandFrame frame = new CommandFrame(7, 0x02, Optional.of(99L), new byte[] {1, 2, 3});

        byte[] encoded = FrameCodec.encode(frame);

        // type + correlation + scope + flag + target + payload
        assertEquals(1 + 4 + 1 + 1 + 8 + 3, encoded.length);
        assertEquals(FrameType.COMMAND.getId(), encoded[0]);
        assertEquals(7, encoded[4]);
        assertEquals(0x02, encoded[5]);
        assertEquals(1, encoded[6]);

        CommandFrame decoded = (CommandFrame) FrameCodec.decode(encoded);
        assertEquals(7, decoded.correlationId());
        assertEquals(Optional.of(99L), decoded.targetId());
        assertArrayEquals(new byte[] {1, 2, 3}, decoded.payload());
    }

    @Test
    void command_withoutTarget_roundTrip()
    {
        CommandFrame frame = new CommandFrame(1, 0x00, Optional.empty(), new byte[] {9});

        CommandFrame decoded = (CommandFrame) FrameCodec.decode(FrameCodec.encode(frame));

        assertEquals(Optional.empty(), decoded.targetId());
        assertArrayEquals(new byte[] {9}, decoded.payload());
    }

    @Test
    void response_successAndError()
    {
        ResponseFrame ok = (ResponseFrame) FrameCodec.decode(FrameCodec.encode(ResponseFrame.ok(3, new byte[] {4, 5})));
        ResponseFrame error = (ResponseFrame) FrameCodec.decode(FrameCodec.encode(ResponseFrame.error(4, 0x21, "Not your turn")));

        assertTrue(ok.success());
        assertArrayEquals(new byte[] {4, 5}, ok.payload());
        assertFalse(error.success());
        assertEquals(0x21, error.errorCode());
        assertEquals("Not your turn", error.message());
    }

    @Test
    void event_roundTrip()
    {
        EventFrame decoded = (EventFrame) FrameCodec.decode(FrameCodec.encode(new EventFrame(2, 11, 12, new byte[] {6})));

        assertEquals(2, decoded.originKind());
        assertEquals(11, decoded.originId());
        assertEquals(12, decoded.sequence());
        assertArrayEquals(new byte[] {6}, decoded.payload());
    }

    // ========== Control Frames ==========

    @Test
    void control_roundTrip()
    {
        assertEquals(new Heartbeat(123), FrameCodec.decode(FrameCodec.encode(new Heartbeat(123))));
        assertEquals(new HeartbeatAck(123, 456), FrameCodec.decode(FrameCodec.encode(new HeartbeatAck(123, 456))));
        assertEquals(Disconnect.shutdown(), FrameCodec.decode(FrameCodec.encode(Disconnect.shutdown())));
        assertEquals(new Notice(NoticeLevel.WARNING, "careful"),
                FrameCodec.decode(FrameCodec.encode(new Notice(NoticeLevel.WARNING, "careful"))));
    }

    @Test
    void encode_clipsOverlongText()
    {
        String text = "x".repeat(70_000);

        Notice decoded = (Notice) FrameCodec.decode(FrameCodec.encode(new Notice(NoticeLevel.INFO, text)));

        assertEquals(0xFFFF, decoded.message().length());
    }

    // ========== Malformed Frames ==========

    @Test
    void decode_empty_throws()
    {
        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(new byte[0]));
    }

    @Test
    void decode_unknownType_throws()
    {
        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(new byte[] {0x7E, 0, 0}));
    }

    @Test
    void decode_truncated_throws()
    {
        byte[] encoded = FrameCodec.encode(new Heartbeat(1));
        byte[] truncated = new byte[encoded.length - 1];
        System.arraycopy(encoded, 0, truncated, 0, truncated.length);

        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(truncated));
    }

    @Test
    void decode_trailingBytes_throws()
    {
        byte[] encoded = FrameCodec.encode(new HeartbeatAck(1, 2));
        byte[] padded = new byte[encoded.length + 3];
        System.arraycopy(encoded, 0, padded, 0, encoded.length);

        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(padded));
    }

    @Test
    void decode_badTargetFlag_throws()
    {
        byte[] encoded = FrameCodec.encode(new CommandFrame(1, 0, Optional.empty(), new byte[0]));
        encoded[6] = 5;

        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(encoded));
    }

    @Test
    void decode_unknownPrivilege_throws()
    {
        byte[] encoded = FrameCodec.encode(new Welcome("s", 1, "n", Privilege.USER, 1, 1));
        // privilege byte follows type, session id, identity id and name
        int privilegeOffset = 1 + 2 + 1 + 8 + 2 + 1;
        encoded[privilegeOffset] = 0x44;

        assertThrows(FrameFormatException.class, () -> FrameCodec.decode(encoded));
    }

    @Test
    void peekType_readsFirstByte()
    {
        assertEquals(FrameType.HEARTBEAT, FrameCodec.peekType(FrameCodec.encode(new Heartbeat(0))));
    }
}
