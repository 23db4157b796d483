/*
 * どこで: Raid Engine セッション
 * 何を: 1 回の再生観測から次の累積状態と遷移を計算する
 * なぜ: 連続再生のみを数え、途切れたら 0 に戻す規則を副作用なしで検証できるようにするため
 */
package com.streamraid.engine.session;

import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class QualificationStateMachine {

  public record Advance(SessionState next, SessionTransition transition) {}

  /**
   * 経過時間は前回評価時刻との差。時計が巻き戻っても加算は 0 で止める。
   *
   * <p>再生していない観測は累積を 0 に戻す。必要秒数に達した時点で QUALIFIED を返す。
   */
  public Advance advance(
      SessionState current, int requiredSeconds, boolean playing, Instant now) {
    if (!playing) {
      final SessionState idle = new SessionState(0d, false, now);
      return new Advance(
          idle, current.listening() ? SessionTransition.RESET : SessionTransition.STAYED_IDLE);
    }
    final double elapsed = elapsedSeconds(current.lastEvaluatedAt(), now);
    final double total = current.accumulatedSeconds() + elapsed;
    final SessionState listening = new SessionState(total, true, now);
    if (total >= requiredSeconds) {
      return new Advance(listening, SessionTransition.QUALIFIED);
    }
    return new Advance(
        listening,
        current.listening()
            ? SessionTransition.CONTINUED_LISTENING
            : SessionTransition.STARTED_LISTENING);
  }

  private double elapsedSeconds(Instant from, Instant to) {
    if (from == null || !to.isAfter(from)) {
      return 0d;
    }
    return Duration.between(from, to).toNanos() / 1_000_000_000d;
  }
}
