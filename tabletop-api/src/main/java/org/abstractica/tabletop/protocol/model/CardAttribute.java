package org.abstractica.tabletop.protocol.model;

/**
 * Boolean card attributes a player can toggle.
 */
public enum CardAttribute
{
    TAPPED,
    FACE_DOWN
}
