package com.streamraid.engine.settlement;

import java.math.BigDecimal;
import java.util.UUID;

/** Transfers a raid reward to a participant. */
public interface SettlementProgram {

  /**
   * Settles the reward of one participation. Calls for the same participation must be idempotent.
   *
   * @return transaction reference of the transfer
   * @throws SettlementUnavailableException when the transfer could not be confirmed
   */
  String settle(String participantId, UUID raidId, BigDecimal amount);
}
