/*
 * どこで: Raid Engine サービス層
 * 何を: 起動時に追跡中だった参加者のセッションを復元する
 * なぜ: 再起動で追跡が止まったまま放置されないようにするため
 */
package com.streamraid.engine.service;

import com.streamraid.engine.auth.AuthorizationProvider;
import com.streamraid.engine.auth.UnauthenticatedException;
import com.streamraid.engine.config.RaidEngineProperties;
import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.RecoverableSession;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.session.SessionRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionRecoveryService {

  private static final Logger logger = LoggerFactory.getLogger(SessionRecoveryService.class);

  private final ParticipantRepository participantRepository;
  private final AuthorizationProvider authorizationProvider;
  private final SessionRegistry sessionRegistry;
  private final RaidEngineProperties properties;
  private final Clock clock;

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.recoverOnStartup()) {
      return;
    }
    recover();
  }

  /**
   * 再生中だった参加者は保存済みの累積から再開し、それ以外は 0 から始める。
   *
   * <p>停止中の時間は加算しない。
   */
  public int recover() {
    final Instant now = Instant.now(clock);
    int restored = 0;
    for (RecoverableSession candidate : participantRepository.findRecoverable(now)) {
      try {
        final AccessContext context =
            authorizationProvider.getValidAccessContext(
                candidate.platform(), candidate.participantId());
        sessionRegistry.restore(
            candidate.participantId(),
            candidate.raidId(),
            candidate.trackId(),
            candidate.platform(),
            candidate.requiredListenSeconds(),
            context.premium(),
            candidate.expiresAt(),
            candidate.listening() ? candidate.totalListenDuration() : 0d,
            candidate.listening(),
            now);
        restored++;
      } catch (UnauthenticatedException ex) {
        participantRepository.stopTracking(candidate.participantId(), candidate.raidId(), now);
        logger.info(
            "session not recovered because authorization is invalid participantId={} raidId={}",
            candidate.participantId(),
            candidate.raidId());
      } catch (RuntimeException ex) {
        // 追跡フラグは残し、次回起動時に再度復元を試みる
        logger.warn(
            "session recovery failed participantId={} raidId={}",
            candidate.participantId(),
            candidate.raidId(),
            ex);
      }
    }
    logger.info("tracking sessions recovered count={}", restored);
    return restored;
  }
}
