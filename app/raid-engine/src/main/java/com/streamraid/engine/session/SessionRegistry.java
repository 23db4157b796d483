/*
 * どこで: Raid Engine セッション
 * 何を: 追跡中セッションの作成/削除/列挙/排他更新を提供する
 * なぜ: 参加 API・ポーリング・完了処理が並行に触れても、削除済みセッションを評価しないため
 */
package com.streamraid.engine.session;

import com.streamraid.engine.model.Platform;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SessionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

  private final ConcurrentMap<SessionKey, TrackingSession> sessions = new ConcurrentHashMap<>();
  private final AtomicLong generations = new AtomicLong();

  /** 新しいセッションを登録する。同じキーの既存セッションは削除扱いにして置き換える。 */
  public SessionHandle create(
      String participantId,
      UUID raidId,
      String trackId,
      Platform platform,
      int requiredSeconds,
      boolean premiumTier,
      Instant expiresAt,
      Instant startedAt) {
    return register(
        participantId,
        raidId,
        trackId,
        platform,
        requiredSeconds,
        premiumTier,
        expiresAt,
        new SessionState(0d, false, startedAt),
        startedAt);
  }

  /** 永続化済みの累積値から再開する。再起動後の復元で使う。 */
  public SessionHandle restore(
      String participantId,
      UUID raidId,
      String trackId,
      Platform platform,
      int requiredSeconds,
      boolean premiumTier,
      Instant expiresAt,
      double accumulatedSeconds,
      boolean listening,
      Instant now) {
    return register(
        participantId,
        raidId,
        trackId,
        platform,
        requiredSeconds,
        premiumTier,
        expiresAt,
        new SessionState(accumulatedSeconds, listening, now),
        now);
  }

  private SessionHandle register(
      String participantId,
      UUID raidId,
      String trackId,
      Platform platform,
      int requiredSeconds,
      boolean premiumTier,
      Instant expiresAt,
      SessionState initialState,
      Instant startedAt) {
    if (requiredSeconds <= 0) {
      throw new IllegalArgumentException("requiredSeconds must be positive");
    }
    final SessionKey key = new SessionKey(participantId, raidId);
    final SessionHandle handle =
        new SessionHandle(
            key,
            generations.incrementAndGet(),
            trackId,
            platform,
            requiredSeconds,
            premiumTier,
            expiresAt,
            startedAt);
    final TrackingSession replaced = sessions.put(key, new TrackingSession(handle, initialState));
    if (replaced != null) {
      retire(replaced);
      logger.info(
          "tracking session replaced participantId={} raidId={}", participantId, raidId);
    }
    return handle;
  }

  public boolean remove(String participantId, UUID raidId) {
    final TrackingSession session = sessions.remove(new SessionKey(participantId, raidId));
    if (session == null) {
      return false;
    }
    retire(session);
    return true;
  }

  /** handle と同じ世代のセッションだけを削除する。置き換え後の新セッションには触れない。 */
  public boolean remove(SessionHandle handle) {
    final TrackingSession session = sessions.get(handle.key());
    if (session == null || session.handle().generation() != handle.generation()) {
      return false;
    }
    if (!sessions.remove(handle.key(), session)) {
      return false;
    }
    retire(session);
    return true;
  }

  public int removeRaid(UUID raidId) {
    int removed = 0;
    for (TrackingSession session : new ArrayList<>(sessions.values())) {
      if (session.handle().raidId().equals(raidId) && remove(session.handle())) {
        removed++;
      }
    }
    return removed;
  }

  /** 呼び出し時点のスナップショット。以後の作成/削除は反映されない。 */
  public List<SessionHandle> listActive() {
    final List<SessionHandle> handles = new ArrayList<>(sessions.size());
    for (TrackingSession session : sessions.values()) {
      handles.add(session.handle());
    }
    return List.copyOf(handles);
  }

  public Optional<SessionHandle> find(String participantId, UUID raidId) {
    return Optional.ofNullable(sessions.get(new SessionKey(participantId, raidId)))
        .map(TrackingSession::handle);
  }

  public int size() {
    return sessions.size();
  }

  /**
   * セッションロックを取った状態で mutation を実行する。
   *
   * @return セッションが削除済み/置き換え済みなら empty
   */
  public <R> Optional<R> mutate(SessionHandle handle, Function<TrackingSession, R> mutation) {
    final TrackingSession session = sessions.get(handle.key());
    if (session == null || session.handle().generation() != handle.generation()) {
      return Optional.empty();
    }
    session.lock().lock();
    try {
      if (session.isRemoved()) {
        return Optional.empty();
      }
      return Optional.ofNullable(mutation.apply(session));
    } finally {
      session.lock().unlock();
    }
  }

  /** 同じセッションの評価が重ならないよう印を付ける。false なら前回評価が実行中。 */
  public boolean tryBeginEvaluation(SessionHandle handle) {
    final TrackingSession session = sessions.get(handle.key());
    if (session == null || session.handle().generation() != handle.generation()) {
      return false;
    }
    return session.tryBeginEvaluation();
  }

  public void endEvaluation(SessionHandle handle) {
    final TrackingSession session = sessions.get(handle.key());
    if (session != null && session.handle().generation() == handle.generation()) {
      session.endEvaluation();
    }
  }

  private void retire(TrackingSession session) {
    // 実行中の評価が終わるまで待ち、以後の mutate を無効にする
    session.lock().lock();
    try {
      session.markRemoved();
    } finally {
      session.lock().unlock();
    }
  }
}
