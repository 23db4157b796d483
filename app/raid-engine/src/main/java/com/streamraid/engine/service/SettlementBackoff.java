package com.streamraid.engine.service;

import com.streamraid.engine.config.SettlementProperties;
import java.time.Duration;

/** Exponential delay between settlement attempts, capped at {@code backoff-max}. */
final class SettlementBackoff {

  private SettlementBackoff() {}

  static Duration compute(SettlementProperties properties, int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2, Math.max(0, attempt - 1));
    return Duration.ofMillis((long) Math.min(exp, properties.backoffMax().toMillis()));
  }
}
