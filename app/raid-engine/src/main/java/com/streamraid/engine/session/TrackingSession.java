/*
 * どこで: Raid Engine セッション
 * 何を: 1 参加者 x 1 raid の追跡中状態とロックを保持する
 * なぜ: 評価と削除を同じロックで直列化し、削除後の評価結果が書き込まれないようにするため
 */
package com.streamraid.engine.session;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

public final class TrackingSession {

  private final SessionHandle handle;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicBoolean evaluating = new AtomicBoolean(false);
  private SessionState state;
  private Instant lastProgressNotifiedAt;
  private boolean removed;

  TrackingSession(SessionHandle handle, SessionState initialState) {
    this.handle = handle;
    this.state = initialState;
  }

  public SessionHandle handle() {
    return handle;
  }

  public int requiredSeconds() {
    return handle.requiredSeconds();
  }

  public SessionState state() {
    requireLocked();
    return state;
  }

  public void commit(SessionState next) {
    requireLocked();
    this.state = next;
  }

  /** 前回の進捗通知から interval 以上経っていれば記録して true を返す。 */
  public boolean claimProgressNotification(Instant now, Duration interval) {
    requireLocked();
    if (lastProgressNotifiedAt != null
        && Duration.between(lastProgressNotifiedAt, now).compareTo(interval) < 0) {
      return false;
    }
    lastProgressNotifiedAt = now;
    return true;
  }

  ReentrantLock lock() {
    return lock;
  }

  boolean isRemoved() {
    return removed;
  }

  void markRemoved() {
    requireLocked();
    removed = true;
  }

  boolean tryBeginEvaluation() {
    return evaluating.compareAndSet(false, true);
  }

  void endEvaluation() {
    evaluating.set(false);
  }

  private void requireLocked() {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("session lock is not held key=" + handle.key());
    }
  }
}
