/*
 * どこで: Raid Engine サービス層
 * 何を: 報酬請求を一度だけ受け付け、精算プログラムへ送金を依頼する
 * なぜ: 同時請求でも条件付き UPDATE 1 文で勝者を決め、精算失敗でも請求を取り消さないため
 */
package com.streamraid.engine.service;

import com.google.common.annotations.VisibleForTesting;
import com.streamraid.common.HostIdentity;
import com.streamraid.common.MdcScope;
import com.streamraid.engine.api.AlreadyClaimedException;
import com.streamraid.engine.api.InvalidRaidRequestException;
import com.streamraid.engine.api.NotQualifiedException;
import com.streamraid.engine.api.RaidNotFoundException;
import com.streamraid.engine.config.SettlementProperties;
import com.streamraid.engine.model.ClaimResult;
import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.model.SettlementStatus;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.repository.RaidRepository;
import com.streamraid.engine.settlement.SettlementProgram;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class ClaimCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(ClaimCoordinator.class);

  private final RaidRepository raidRepository;
  private final ParticipantRepository participantRepository;
  private final SettlementProgram settlementProgram;
  private final SettlementProperties properties;
  private final RaidEngineMetrics metrics;
  private final Clock clock;
  private final Supplier<String> leaseTokens;

  @Autowired
  public ClaimCoordinator(
      RaidRepository raidRepository,
      ParticipantRepository participantRepository,
      SettlementProgram settlementProgram,
      SettlementProperties properties,
      RaidEngineMetrics metrics,
      Clock clock) {
    this(
        raidRepository,
        participantRepository,
        settlementProgram,
        properties,
        metrics,
        clock,
        HostIdentity::newLeaseToken);
  }

  @VisibleForTesting
  ClaimCoordinator(
      RaidRepository raidRepository,
      ParticipantRepository participantRepository,
      SettlementProgram settlementProgram,
      SettlementProperties properties,
      RaidEngineMetrics metrics,
      Clock clock,
      Supplier<String> leaseTokens) {
    this.raidRepository = raidRepository;
    this.participantRepository = participantRepository;
    this.settlementProgram = settlementProgram;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.leaseTokens = leaseTokens;
  }

  public ClaimResult claim(String participantId, UUID raidId) {
    if (participantId == null || participantId.isBlank()) {
      throw new InvalidRaidRequestException("participantId is required");
    }
    try (MdcScope ignored =
        MdcScope.open(Map.of("participant_id", participantId, "raid_id", raidId.toString()))) {
      final RaidRecord raid =
          raidRepository
              .findById(raidId)
              .orElseThrow(() -> new RaidNotFoundException("raid not found"));
      final Instant now = Instant.now(clock);
      final String lockedBy = leaseTokens.get();
      // 請求フラグの確定と精算リース取得を 1 文で行う。外部送金はトランザクションに載せない
      final Optional<ParticipantRecord> claimed =
          participantRepository.claimReward(
              participantId, raidId, now, now.plus(properties.lease()), lockedBy);
      if (claimed.isEmpty()) {
        throw rejection(participantId, raidId);
      }
      metrics.recordClaim("accepted");
      logger.info("reward claim accepted participantId={} raidId={}", participantId, raidId);
      return settle(raid, participantId, now, lockedBy);
    }
  }

  private ClaimResult settle(RaidRecord raid, String participantId, Instant now, String lockedBy) {
    try {
      final String reference =
          settlementProgram.settle(participantId, raid.raidId(), raid.rewardAmount());
      final int updated =
          participantRepository.markSettled(participantId, raid.raidId(), reference, lockedBy);
      if (updated == 0) {
        logger.warn(
            "settlement finished but lease was lost participantId={} raidId={}",
            participantId,
            raid.raidId());
      }
      metrics.recordSettlement("settled");
      return new ClaimResult(
          participantId, raid.raidId(), raid.rewardAmount(), SettlementStatus.SETTLED, reference);
    } catch (RuntimeException ex) {
      // 請求は確定済み。精算だけを再試行キューへ回す
      final Instant nextRetryAt = now.plus(SettlementBackoff.compute(properties, 1));
      participantRepository.markSettlementRetry(
          participantId, raid.raidId(), 1, nextRetryAt, lockedBy);
      metrics.recordSettlement("deferred");
      logger.warn(
          "settlement deferred participantId={} raidId={} nextRetryAt={}",
          participantId,
          raid.raidId(),
          nextRetryAt,
          ex);
      return new ClaimResult(
          participantId, raid.raidId(), raid.rewardAmount(), SettlementStatus.PENDING, null);
    }
  }

  private RuntimeException rejection(String participantId, UUID raidId) {
    // claimed_reward は一度 true になると戻らないため、失敗後の読み取りで理由を確定できる
    final ParticipantRecord participant =
        participantRepository.find(participantId, raidId).orElse(null);
    if (participant != null && participant.claimedReward()) {
      metrics.recordClaim("already_claimed");
      return new AlreadyClaimedException("reward already claimed");
    }
    metrics.recordClaim("not_qualified");
    return new NotQualifiedException(
        participant == null ? "participant has not joined the raid" : "participant not qualified");
  }
}
