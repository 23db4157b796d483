/*
 * どこで: Raid Engine 精算
 * 何を: 報酬送金を模擬する実装
 * なぜ: 外部精算基盤なしで請求から SETTLED までの状態遷移を確認するため
 */
package com.streamraid.engine.settlement;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "raid.settlement.mode", havingValue = "local", matchIfMissing = true)
public class LocalSettlementProgram implements SettlementProgram {

  private static final Logger logger = LoggerFactory.getLogger(LocalSettlementProgram.class);

  @Override
  public String settle(String participantId, UUID raidId, BigDecimal amount) {
    // 同じ参加に対しては同じ参照を返す
    final String reference =
        "local-"
            + UUID.nameUUIDFromBytes(
                (participantId + ":" + raidId).getBytes(StandardCharsets.UTF_8));
    logger.info(
        "settlement simulated participantId={} raidId={} amount={} reference={}",
        participantId,
        raidId,
        amount,
        reference);
    return reference;
  }
}
