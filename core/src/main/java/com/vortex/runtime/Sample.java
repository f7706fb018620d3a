package com.vortex.runtime;

import java.time.Instant;

/**
 * One metric sample of a stream.
 */
public record Sample(Instant timestamp, double value, long streamHash) {
}
