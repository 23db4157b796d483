/*
 * どこで: Raid Engine 通知
 * 何を: 参加者向けメッセージの送信/更新の抽象化インターフェース
 * なぜ: 実チャネル/テスト差し替えを容易にするため
 */
package com.streamraid.engine.notification;

public interface NotificationChannel {

  /**
   * priorRef があればそのメッセージを更新し、無ければ新規送信する。
   *
   * @return 次回更新に使うメッセージ参照
   * @throws StaleMessageReferenceException priorRef のメッセージが既に存在しない場合
   */
  String sendOrUpdate(String participantId, NotificationMessage message, String priorRef);
}
