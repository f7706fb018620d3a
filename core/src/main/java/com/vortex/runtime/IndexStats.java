package com.vortex.runtime;

/**
 * Index statistics for a selector over a time range.
 */
public record IndexStats(long streams, long chunks, long entries, long bytes) {
}
