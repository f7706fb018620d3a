package com.vortex.logql;

/**
 * Order in which log lines are returned for a time range.
 */
public enum Direction {

    /** Oldest first. */
    FORWARD,

    /** Most recent first. */
    BACKWARD
}
