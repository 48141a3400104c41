package org.abstractica.tabletop.protocol.model;

import java.util.Objects;

/**
 * A named counter and its value.
 *
 * @param name  counter name
 * @param value current value
 */
public record CounterView(String name, int value)
{
    public CounterView
    {
        Objects.requireNonNull(name, "name");
    }
}
