/*
 * どこで: Raid Engine 認可
 * 何を: 保存済みのプラットフォーム連携からアクセスコンテキストを組み立てる
 * なぜ: 期限切れ/未連携を参加時と再生確認時に同じ基準で判定するため
 */
package com.streamraid.engine.auth;

import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.PlatformAuthorizationRecord;
import com.streamraid.engine.repository.PlatformAuthorizationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StoredAuthorizationProvider implements AuthorizationProvider {

  // 期限直前のトークンで外部 API を呼ぶと途中で 401 になるため余裕を持たせる
  static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

  private final PlatformAuthorizationRepository authorizationRepository;
  private final Clock clock;

  @Override
  public AccessContext getValidAccessContext(Platform platform, String participantId) {
    final PlatformAuthorizationRecord record =
        authorizationRepository
            .find(participantId, platform)
            .orElseThrow(
                () ->
                    new UnauthenticatedException(
                        platform, platform.value() + " account is not linked"));
    if (platform.requiresAccessToken()) {
      if (record.accessToken() == null || record.accessToken().isBlank()) {
        throw new UnauthenticatedException(platform, platform.value() + " access token missing");
      }
      final Instant threshold = Instant.now(clock).plus(EXPIRY_SKEW);
      if (record.expiresAt() == null || !record.expiresAt().isAfter(threshold)) {
        throw new UnauthenticatedException(platform, platform.value() + " access token expired");
      }
    }
    return new AccessContext(
        participantId, platform, record.platformUserId(), record.accessToken(), record.premium());
  }
}
