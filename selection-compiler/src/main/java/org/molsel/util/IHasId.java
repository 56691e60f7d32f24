package org.molsel.util;

/** An object with a unique numeric identifier. */
public interface IHasId {
    long getId();
}
