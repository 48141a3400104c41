package org.abstractica.tabletop.protocol.model;

/**
 * Why a member left a game or room.
 */
public enum LeaveReason
{
    LEFT,
    KICKED
}
