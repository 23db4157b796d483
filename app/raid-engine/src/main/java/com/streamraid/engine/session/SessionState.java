package com.streamraid.engine.session;

import java.time.Instant;

/**
 * Accumulator of one session.
 *
 * @param accumulatedSeconds continuous listening time since the last reset
 * @param listening whether the previous observation saw the track playing
 * @param lastEvaluatedAt time of the previous successful observation
 */
public record SessionState(double accumulatedSeconds, boolean listening, Instant lastEvaluatedAt) {

  /** Value written to storage. Fractions are kept only in memory. */
  public int wholeSeconds() {
    return (int) Math.min(Integer.MAX_VALUE, Math.floor(accumulatedSeconds));
  }
}
