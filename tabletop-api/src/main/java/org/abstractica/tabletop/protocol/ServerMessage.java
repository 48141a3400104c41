package org.abstractica.tabletop.protocol;

/**
 * Server-to-client payloads: command replies and events.
 */
public sealed interface ServerMessage permits Reply, Event
{
}
