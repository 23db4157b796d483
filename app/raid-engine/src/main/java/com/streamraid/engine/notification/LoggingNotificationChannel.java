/*
 * どこで: Raid Engine 通知
 * 何を: メッセージ送信/更新を模擬する実装
 * なぜ: 外部チャット連携なしで進捗通知の流れを確認するため
 */
package com.streamraid.engine.notification;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationChannel.class);

  @Override
  public String sendOrUpdate(String participantId, NotificationMessage message, String priorRef) {
    // 実送信は行わず、ログに残すだけとする
    final String ref = priorRef == null ? "local-" + UUID.randomUUID() : priorRef;
    logger.info(
        "notification simulated {} kind={} participantId={} raidId={} percent={} ref={}",
        priorRef == null ? "send" : "update",
        message.kind(),
        participantId,
        message.raidId(),
        message.percent(),
        ref);
    return ref;
  }
}
