package org.abstractica.tabletop.impl.protocol;

/**
 * Frame type identifiers as defined in the wire protocol.
 */
public enum FrameType
{
    // Handshake frames (0x01 - 0x0F)
    HELLO(0x01),
    WELCOME(0x02),
    REJECT(0x03),

    // Command and event frames (0x10 - 0x1F)
    COMMAND(0x10),
    RESPONSE(0x11),
    EVENT(0x12),
    NOTICE(0x13),

    // Control frames (0x20 - 0x2F)
    HEARTBEAT(0x20),
    HEARTBEAT_ACK(0x21),

    // Disconnect (0x30)
    DISCONNECT(0x30);

    private final int id;

    FrameType(int id)
    {
        this.id = id;
    }

    /**
     * Returns the wire protocol identifier for this frame type.
     *
     * @return the frame type ID (1 byte)
     */
    public int getId()
    {
        return id;
    }

    /**
     * Looks up a frame type by its wire protocol ID.
     *
     * @param id the frame type ID
     * @return the frame type
     * @throws FrameFormatException if ID is unknown
     */
    public static FrameType fromId(int id)
    {
        for (FrameType type : values())
        {
            if (type.id == id)
            {
                return type;
            }
        }
        throw new FrameFormatException("Unknown frame type ID: 0x" + Integer.toHexString(id));
    }
}
