/*
 * どこで: Raid Engine サービス層
 * 何を: 精算が保留/中断された請求をリースして再送金する
 * なぜ: 請求済みの報酬を最終的に必ず SETTLED まで進めるため
 */
package com.streamraid.engine.service;

import com.google.common.annotations.VisibleForTesting;
import com.streamraid.common.HostIdentity;
import com.streamraid.engine.config.SettlementProperties;
import com.streamraid.engine.model.PendingSettlement;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.settlement.SettlementProgram;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class SettlementRetryService {

  private static final Logger logger = LoggerFactory.getLogger(SettlementRetryService.class);

  private final ParticipantRepository participantRepository;
  private final SettlementProgram settlementProgram;
  private final SettlementProperties properties;
  private final RaidEngineMetrics metrics;
  private final Clock clock;
  private final Supplier<String> leaseTokens;

  @Autowired
  public SettlementRetryService(
      ParticipantRepository participantRepository,
      SettlementProgram settlementProgram,
      SettlementProperties properties,
      RaidEngineMetrics metrics,
      Clock clock) {
    this(
        participantRepository,
        settlementProgram,
        properties,
        metrics,
        clock,
        HostIdentity::newLeaseToken);
  }

  @VisibleForTesting
  SettlementRetryService(
      ParticipantRepository participantRepository,
      SettlementProgram settlementProgram,
      SettlementProperties properties,
      RaidEngineMetrics metrics,
      Clock clock,
      Supplier<String> leaseTokens) {
    this.participantRepository = participantRepository;
    this.settlementProgram = settlementProgram;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.leaseTokens = leaseTokens;
  }

  public int processPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = leaseTokens.get();
    // claim を単一 SQL で行い、送金 IO を長期トランザクションに載せない
    final List<PendingSettlement> pending =
        participantRepository.claimPendingSettlements(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int settled = 0;
    for (PendingSettlement record : pending) {
      try {
        final String reference =
            settlementProgram.settle(record.participantId(), record.raidId(), record.rewardAmount());
        final int updated =
            participantRepository.markSettled(
                record.participantId(), record.raidId(), reference, lockedBy);
        if (updated == 0) {
          logger.warn(
              "settlement finished but lease was lost participantId={} raidId={}",
              record.participantId(),
              record.raidId());
        }
        metrics.recordSettlement("settled");
        settled++;
      } catch (RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    return settled;
  }

  private void handleFailure(
      PendingSettlement record, RuntimeException ex, Instant now, String lockedBy) {
    final int nextAttempt = record.settlementAttempts() + 1;
    final Instant nextRetryAt = now.plus(SettlementBackoff.compute(properties, nextAttempt));
    final int updated =
        participantRepository.markSettlementRetry(
            record.participantId(), record.raidId(), nextAttempt, nextRetryAt, lockedBy);
    if (updated == 0) {
      logger.warn(
          "settlement retry skipped because lease was lost participantId={} raidId={}",
          record.participantId(),
          record.raidId());
      return;
    }
    metrics.recordSettlement("deferred");
    logger.warn(
        "settlement retry scheduled participantId={} raidId={} attempt={}",
        record.participantId(),
        record.raidId(),
        nextAttempt,
        ex);
  }
}
