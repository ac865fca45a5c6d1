package org.tprobe.util;

/** An object with a numeric identity, unique within a compilation. */
public interface IHasId {
    long getId();
}
