/*
 * どこで: Raid Engine 通知
 * 何を: 参加者ごとに 1 つの状態メッセージを送信/更新し、その参照を保存する
 * なぜ: 通知失敗で追跡や請求を止めず、古い参照は新規送信で置き換えるため
 */
package com.streamraid.engine.notification;

import com.streamraid.engine.model.ParticipantRecord;
import com.streamraid.engine.repository.ParticipantRepository;
import com.streamraid.engine.service.RaidEngineMetrics;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationChannel channel;
  private final ParticipantRepository participantRepository;
  private final RaidEngineMetrics metrics;
  private final Clock clock;

  /** 失敗はログとメトリクスに残し、呼び出し元へは伝播しない。 */
  public void dispatch(NotificationMessage message) {
    try {
      final String priorRef =
          participantRepository
              .find(message.participantId(), message.raidId())
              .map(ParticipantRecord::lastNotificationMessageRef)
              .orElse(null);
      final String ref = deliver(message, priorRef);
      participantRepository.updateNotification(
          message.participantId(), message.raidId(), ref, Instant.now(clock));
      metrics.recordNotification("sent");
    } catch (RuntimeException ex) {
      logger.warn(
          "notification failed kind={} participantId={} raidId={}",
          message.kind(),
          message.participantId(),
          message.raidId(),
          ex);
      metrics.recordNotification("failed");
    }
  }

  private String deliver(NotificationMessage message, String priorRef) {
    if (priorRef == null) {
      return channel.sendOrUpdate(message.participantId(), message, null);
    }
    try {
      return channel.sendOrUpdate(message.participantId(), message, priorRef);
    } catch (StaleMessageReferenceException ex) {
      logger.info(
          "notification reference stale, sending new message participantId={} raidId={}",
          message.participantId(),
          message.raidId());
      metrics.recordNotification("stale_ref");
      return channel.sendOrUpdate(message.participantId(), message, null);
    }
  }
}
