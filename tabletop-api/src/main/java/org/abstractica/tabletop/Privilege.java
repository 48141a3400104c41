package org.abstractica.tabletop;

/**
 * Privilege level of an authenticated identity.
 */
public enum Privilege
{
    USER(0x00),
    MODERATOR(0x01),
    ADMIN(0x02);

    private final int code;

    Privilege(int code)
    {
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }

    /**
     * Returns whether this level includes the given one.
     *
     * @param required the level needed
     * @return true if this level is at least {@code required}
     */
    public boolean includes(Privilege required)
    {
        return ordinal() >= required.ordinal();
    }

    public static Privilege fromCode(int code)
    {
        for (Privilege privilege : values())
        {
            if (privilege.code == code)
            {
                return privilege;
            }
        }
        throw new IllegalArgumentException("Unknown privilege code: 0x" + Integer.toHexString(code));
    }
}
