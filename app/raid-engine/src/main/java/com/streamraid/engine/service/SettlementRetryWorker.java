package com.streamraid.engine.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "raid.settlement.retry-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SettlementRetryWorker {

  private static final Logger logger = LoggerFactory.getLogger(SettlementRetryWorker.class);

  private final SettlementRetryService settlementRetryService;

  @Scheduled(fixedDelayString = "${raid.settlement.retry-interval}")
  public void run() {
    try {
      final int settled = settlementRetryService.processPendingBatch();
      if (settled > 0) {
        logger.info("settlement retry batch settled={}", settled);
      }
    } catch (RuntimeException ex) {
      logger.warn("settlement retry worker loop failed", ex);
    }
  }
}
