package org.abstractica.tabletop.protocol;

/**
 * A state-change notification emitted by a room or a game.
 */
public sealed interface Event extends ServerMessage permits GameEvent, RoomEvent
{
}
