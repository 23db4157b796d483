/*
 * どこで: Raid Engine サービス層
 * 何を: raid への参加/離脱/進捗照会を扱う
 * なぜ: 参加条件の検証と追跡セッションの開始を一か所にまとめるため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.api.AlreadyQualifiedException;
import com.streamraid.engine.api.InvalidRaidRequestException;
import com.streamraid.engine.api.ParticipantNotFoundException;
import com.streamraid.engine.api.PremiumRequiredException;
import com.streamraid.engine.api.RaidFullException;
import com.streamraid.engine.api.RaidNotActiveException;
import com.streamraid.engine.api.RaidNotFoundException;
import com.streamraid.engine.auth.AuthorizationProvider;
import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.ParticipantProgress;
import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.model.RaidRecord;
import com.streamraid.engine.notification.NotificationDispatcher;
import com.streamraid.engine.notification.NotificationMessage;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.repository.RaidRepository;
import com.streamraid.engine.session.SessionHandle;
import com.streamraid.engine.session.SessionRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class RaidParticipationService {

  private static final Logger logger = LoggerFactory.getLogger(RaidParticipationService.class);

  private final RaidRepository raidRepository;
  private final ParticipantRepository participantRepository;
  private final AuthorizationProvider authorizationProvider;
  private final SessionRegistry sessionRegistry;
  private final NotificationDispatcher notificationDispatcher;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  /**
   * 参加を登録し、累積 0 の新しい追跡セッションを開始する。
   *
   * <p>未資格の再参加は進捗をリセットして既存セッションを置き換える。
   */
  public SessionHandle joinRaid(String participantId, UUID raidId) {
    requireParticipantId(participantId);
    final RaidRecord raid =
        raidRepository
            .findById(raidId)
            .orElseThrow(() -> new RaidNotFoundException("raid not found"));
    requireActive(raid, Instant.now(clock));
    final AccessContext context =
        authorizationProvider.getValidAccessContext(raid.platform(), participantId);
    if (raid.premiumOnly() && !context.premium()) {
      throw new PremiumRequiredException("raid requires a premium account");
    }

    // 再参加では旧セッションを先に止め、リセット後に古い評価結果が書かれないようにする
    sessionRegistry.remove(participantId, raidId);
    // 定員判定と登録を raid 行ロック下で直列化する
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Instant joinedAt =
        transactionTemplate.execute(status -> registerParticipant(participantId, raidId));

    final SessionHandle handle =
        sessionRegistry.create(
            participantId,
            raidId,
            raid.trackId(),
            raid.platform(),
            raid.requiredListenSeconds(),
            context.premium(),
            raid.expiresAt(),
            joinedAt);
    logger.info(
        "participant joined raid participantId={} raidId={} platform={}",
        participantId,
        raidId,
        raid.platform().value());
    notificationDispatcher.dispatch(
        NotificationMessage.joined(participantId, raidId, raid.requiredListenSeconds()));
    return handle;
  }

  private Instant registerParticipant(String participantId, UUID raidId) {
    final RaidRecord locked =
        raidRepository
            .lockById(raidId)
            .orElseThrow(() -> new RaidNotFoundException("raid not found"));
    final Instant now = Instant.now(clock);
    requireActive(locked, now);
    final ParticipantRecord existing =
        participantRepository.find(participantId, raidId).orElse(null);
    if (existing != null && existing.qualified()) {
      throw new AlreadyQualifiedException("participant already qualified");
    }
    if (existing == null
        && locked.maxParticipants() != null
        && raidRepository.countParticipants(raidId) >= locked.maxParticipants()) {
      throw new RaidFullException("raid is full");
    }
    participantRepository
        .upsertJoin(participantId, raidId, now)
        .orElseThrow(() -> new AlreadyQualifiedException("participant already qualified"));
    return now;
  }

  public void leaveRaid(String participantId, UUID raidId) {
    requireParticipantId(participantId);
    sessionRegistry.remove(participantId, raidId);
    final int updated = participantRepository.stopTracking(participantId, raidId, Instant.now(clock));
    if (updated == 0) {
      throw new ParticipantNotFoundException("participant not found");
    }
    logger.info("participant left raid participantId={} raidId={}", participantId, raidId);
  }

  public ParticipantProgress getProgress(String participantId, UUID raidId) {
    requireParticipantId(participantId);
    final RaidRecord raid =
        raidRepository
            .findById(raidId)
            .orElseThrow(() -> new RaidNotFoundException("raid not found"));
    final ParticipantRecord participant =
        participantRepository
            .find(participantId, raidId)
            .orElseThrow(() -> new ParticipantNotFoundException("participant not found"));
    return new ParticipantProgress(
        participantId,
        raidId,
        participant.totalListenDuration(),
        raid.requiredListenSeconds(),
        participant.listening(),
        participant.trackingActive(),
        participant.qualified(),
        participant.qualifiedAt(),
        participant.claimedReward(),
        participant.settlementStatus());
  }

  private void requireActive(RaidRecord raid, Instant now) {
    if (!raid.acceptsParticipantsAt(now)) {
      throw new RaidNotActiveException("raid is not active status=" + raid.status());
    }
  }

  private void requireParticipantId(String participantId) {
    if (participantId == null || participantId.isBlank()) {
      throw new InvalidRaidRequestException("participantId is required");
    }
  }
}
