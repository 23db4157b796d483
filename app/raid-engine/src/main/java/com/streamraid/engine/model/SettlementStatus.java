package com.streamraid.engine.model;

/**
 * Reward transfer progress of a claimed participation.
 *
 * <p>NONE until claimed. PROCESSING while an instance holds the settlement lease, PENDING while
 * waiting for a retry, SETTLED once the settlement program returned a reference.
 */
public enum SettlementStatus {
  NONE,
  PROCESSING,
  PENDING,
  SETTLED
}
