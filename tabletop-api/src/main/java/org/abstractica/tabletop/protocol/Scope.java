package org.abstractica.tabletop.protocol;

/**
 * Target scope of a command.
 *
 * <p>ROOM and GAME commands carry the id of the targeted room or game.</p>
 */
public enum Scope
{
    SESSION(0x00, false),
    ROOM(0x01, true),
    GAME(0x02, true),
    MODERATION(0x03, false),
    ADMIN(0x04, false);

    private final int code;
    private final boolean targeted;

    Scope(int code, boolean targeted)
    {
        this.code = code;
        this.targeted = targeted;
    }

    /**
     * Returns the wire code for this scope.
     *
     * @return the scope code (1 byte)
     */
    public int getCode()
    {
        return code;
    }

    /**
     * Returns whether commands in this scope require a target id.
     *
     * @return true for ROOM and GAME
     */
    public boolean isTargeted()
    {
        return targeted;
    }

    /**
     * Looks up a scope by its wire code.
     *
     * @param code the scope code
     * @return the scope
     * @throws IllegalArgumentException if the code is unknown
     */
    public static Scope fromCode(int code)
    {
        for (Scope scope : values())
        {
            if (scope.code == code)
            {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope code: 0x" + Integer.toHexString(code));
    }
}
