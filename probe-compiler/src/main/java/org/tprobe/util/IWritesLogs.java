package org.tprobe.util;

/** Marker for classes whose logging is controlled by {@link Logger}. */
public interface IWritesLogs {}
