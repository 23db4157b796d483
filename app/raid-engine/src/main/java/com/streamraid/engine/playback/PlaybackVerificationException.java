/*
 * どこで: Raid Engine 再生確認
 * 何を: プラットフォーム問い合わせ失敗を理由付きで表現する
 * なぜ: 認可切れ(セッション終了)と一時障害(進捗維持)を評価側で分けて扱うため
 */
package com.streamraid.engine.playback;

public class PlaybackVerificationException extends RuntimeException {

  public enum Reason {
    AUTH_EXPIRED,
    RATE_LIMITED,
    PLATFORM_UNAVAILABLE;

    public boolean isTransient() {
      return this != AUTH_EXPIRED;
    }
  }

  private final Reason reason;

  public PlaybackVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PlaybackVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
