/*
 * どこで: Raid Engine サービス層
 * 何を: 1 セッション分の再生確認→状態遷移→永続化→通知を行う
 * なぜ: 評価結果の書き込みをセッションロック内で行い、削除済みセッションの結果を捨てるため
 */
package com.streamraid.engine.service;

import com.streamraid.common.MdcScope;
import com.streamraid.engine.config.RaidEngineProperties;
import com.streamraid.engine.model.PlaybackStatus;
import com.streamraid.engine.notification.NotificationDispatcher;
import com.streamraid.engine.notification.NotificationMessage;
import com.streamraid.engine.playback.PlaybackVerificationException;
import com.streamraid.engine.playback.PlaybackVerifierRegistry;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.session.QualificationStateMachine;
import com.streamraid.engine.session.SessionHandle;
import com.streamraid.engine.session.SessionRegistry;
import com.streamraid.engine.session.SessionState;
import com.streamraid.engine.session.SessionTransition;
import com.streamraid.engine.session.TrackingSession;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(SessionEvaluator.class);

  private final SessionRegistry sessionRegistry;
  private final PlaybackVerifierRegistry verifierRegistry;
  private final QualificationStateMachine stateMachine;
  private final ParticipantRepository participantRepository;
  private final CompletionDetector completionDetector;
  private final NotificationDispatcher notificationDispatcher;
  private final RaidEngineMetrics metrics;
  private final RaidEngineProperties properties;
  private final Clock clock;

  record TickResult(SessionTransition transition, SessionState state, boolean notifyProgress) {}

  /** 例外は呼び出し元へ伝播しない。1 セッションの失敗が他のセッションに影響しないようにする。 */
  public void evaluate(SessionHandle handle) {
    try (MdcScope ignored =
        MdcScope.open(
            Map.of(
                "participant_id", handle.participantId(),
                "raid_id", handle.raidId().toString(),
                "platform", handle.platform().value()))) {
      evaluateOnce(handle);
    } catch (RuntimeException ex) {
      logger.warn(
          "session evaluation failed participantId={} raidId={}",
          handle.participantId(),
          handle.raidId(),
          ex);
      metrics.recordEvaluation("error");
    }
  }

  private void evaluateOnce(SessionHandle handle) {
    if (handle.isExpiredAt(Instant.now(clock))) {
      final boolean ended =
          sessionRegistry
              .mutate(handle, session -> retire(handle, Instant.now(clock)))
              .orElse(false);
      recordRaidEnded(handle, ended);
      return;
    }
    final PlaybackStatus status;
    try {
      status =
          verifierRegistry
              .verifierFor(handle.platform())
              .checkPlayback(handle.participantId(), handle.trackId());
    } catch (PlaybackVerificationException ex) {
      metrics.recordVerifierError(
          handle.platform().value(), ex.reason().name().toLowerCase(Locale.ROOT));
      if (ex.reason() == PlaybackVerificationException.Reason.AUTH_EXPIRED) {
        endForExpiredAuthorization(handle);
        return;
      }
      // 一時障害では累積も最終評価時刻も動かさない
      logger.info("playback check skipped reason={} detail={}", ex.reason(), ex.getMessage());
      metrics.recordEvaluation("transient_failure");
      return;
    }

    final Optional<TickResult> result =
        sessionRegistry.mutate(handle, session -> applyTick(handle, session, status));
    if (result.isEmpty()) {
      metrics.recordEvaluation("stale");
      return;
    }
    final TickResult tick = result.get();
    if (tick.transition() == SessionTransition.RAID_ENDED) {
      recordRaidEnded(handle, true);
      return;
    }
    metrics.recordEvaluation(tick.transition().name().toLowerCase(Locale.ROOT));
    if (tick.transition() == SessionTransition.QUALIFIED) {
      logger.info(
          "participant qualified participantId={} raidId={} seconds={}",
          handle.participantId(),
          handle.raidId(),
          tick.state().wholeSeconds());
      metrics.recordQualified(handle.platform().value());
      notificationDispatcher.dispatch(
          NotificationMessage.qualified(
              handle.participantId(),
              handle.raidId(),
              tick.state().wholeSeconds(),
              handle.requiredSeconds()));
      completionDetector.tryComplete(handle.raidId());
      return;
    }
    if (tick.notifyProgress()) {
      notificationDispatcher.dispatch(
          NotificationMessage.progress(
              handle.participantId(),
              handle.raidId(),
              tick.state().wholeSeconds(),
              handle.requiredSeconds(),
              tick.state().listening()));
    }
  }

  private TickResult applyTick(
      SessionHandle handle, TrackingSession session, PlaybackStatus status) {
    final Instant now = Instant.now(clock);
    if (handle.isExpiredAt(now)) {
      retire(handle, now);
      return new TickResult(SessionTransition.RAID_ENDED, session.state(), false);
    }
    final QualificationStateMachine.Advance advance =
        stateMachine.advance(session.state(), session.requiredSeconds(), status.playing(), now);
    final SessionState next = advance.next();
    if (advance.transition() == SessionTransition.QUALIFIED) {
      final int updated =
          participantRepository.markQualified(
              handle.participantId(), handle.raidId(), next.wholeSeconds(), now);
      if (updated == 0) {
        // raid が評価中に終了した。資格は付与しない
        retire(handle, now);
        return new TickResult(SessionTransition.RAID_ENDED, session.state(), false);
      }
      session.commit(next);
      sessionRegistry.remove(handle);
      return new TickResult(SessionTransition.QUALIFIED, next, false);
    }
    participantRepository.updateProgress(
        handle.participantId(), handle.raidId(), next.listening(), next.wholeSeconds(), now);
    session.commit(next);
    final boolean notify =
        session.claimProgressNotification(now, properties.progressNotifyInterval());
    return new TickResult(advance.transition(), next, notify);
  }

  /** セッションロック内で呼ぶ。 */
  private boolean retire(SessionHandle handle, Instant now) {
    participantRepository.stopTracking(handle.participantId(), handle.raidId(), now);
    return sessionRegistry.remove(handle);
  }

  private void recordRaidEnded(SessionHandle handle, boolean ended) {
    if (!ended) {
      metrics.recordEvaluation("stale");
      return;
    }
    logger.info(
        "tracking ended because raid is no longer active participantId={} raidId={}",
        handle.participantId(),
        handle.raidId());
    metrics.recordEvaluation("raid_ended");
  }

  private void endForExpiredAuthorization(SessionHandle handle) {
    final boolean ended =
        sessionRegistry
            .mutate(handle, session -> retire(handle, Instant.now(clock)))
            .orElse(false);
    if (!ended) {
      metrics.recordEvaluation("stale");
      return;
    }
    logger.info(
        "tracking ended because platform authorization expired participantId={} raidId={}",
        handle.participantId(),
        handle.raidId());
    metrics.recordEvaluation("auth_expired");
    notificationDispatcher.dispatch(
        NotificationMessage.reauthorize(handle.participantId(), handle.raidId()));
  }
}
