package org.abstractica.tabletop.protocol;

/**
 * Reason codes carried by error responses.
 */
public enum ErrorCode
{
    INVALID_ARGUMENT(0x0001),
    PERMISSION_DENIED(0x0002),
    UNKNOWN_ROOM(0x0010),
    UNKNOWN_GAME(0x0011),
    UNKNOWN_USER(0x0012),
    NOT_A_MEMBER(0x0013),
    ALREADY_MEMBER(0x0014),
    GAME_FULL(0x0015),
    SPECTATORS_NOT_ALLOWED(0x0016),
    INVALID_DECK_LIST(0x0017),
    INVALID_STATE(0x0020),
    NOT_YOUR_TURN(0x0021),
    UNKNOWN_ZONE(0x0022),
    INVALID_INDEX(0x0023),
    ILLEGAL_MOVE(0x0024),
    TIMEOUT(0x00F0),
    INTERNAL_ERROR(0x00FF);

    private final int code;

    ErrorCode(int code)
    {
        this.code = code;
    }

    /**
     * Returns the wire code.
     *
     * @return the error code (2 bytes)
     */
    public int getCode()
    {
        return code;
    }

    /**
     * Looks up an error code by its wire value.
     *
     * @param code the wire value
     * @return the error code
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ErrorCode fromCode(int code)
    {
        for (ErrorCode errorCode : values())
        {
            if (errorCode.code == code)
            {
                return errorCode;
            }
        }
        throw new IllegalArgumentException("Unknown error code: 0x" + Integer.toHexString(code));
    }
}
