package org.abstractica.tabletop.protocol;

/**
 * Severity of an out-of-band notice sent to a connection.
 */
public enum NoticeLevel
{
    INFO(0x00),
    WARNING(0x01),
    ANNOUNCEMENT(0x02);

    private final int code;

    NoticeLevel(int code)
    {
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }

    public static NoticeLevel fromCode(int code)
    {
        for (NoticeLevel level : values())
        {
            if (level.code == code)
            {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown notice level: 0x" + Integer.toHexString(code));
    }
}
