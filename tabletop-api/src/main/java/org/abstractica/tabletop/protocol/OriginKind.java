package org.abstractica.tabletop.protocol;

/**
 * Kind of entity that emitted an event.
 */
public enum OriginKind
{
    ROOM(0x01),
    GAME(0x02);

    private final int code;

    OriginKind(int code)
    {
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }

    public static OriginKind fromCode(int code)
    {
        for (OriginKind kind : values())
        {
            if (kind.code == code)
            {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown origin kind: 0x" + Integer.toHexString(code));
    }
}
