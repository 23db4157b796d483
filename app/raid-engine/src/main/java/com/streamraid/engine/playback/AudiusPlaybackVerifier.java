/*
 * どこで: Raid Engine 再生確認
 * 何を: Audius の now-playing API から対象トラックの再生有無を判定する
 * なぜ: アクセストークン不要のプラットフォームでも同じ評価ループで扱うため
 */
package com.streamraid.engine.playback;

import com.streamraid.engine.auth.AuthorizationProvider;
import com.streamraid.engine.auth.UnauthenticatedException;
import com.streamraid.engine.config.AudiusClientProperties;
import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.PlaybackStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class AudiusPlaybackVerifier implements PlaybackVerifier {

  private static final Logger logger = LoggerFactory.getLogger(AudiusPlaybackVerifier.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient audiusRestClient;

  private final AudiusClientProperties properties;
  private final AuthorizationProvider authorizationProvider;
  private final Clock clock;

  public AudiusPlaybackVerifier(
      @Qualifier("audiusRestClient") RestClient audiusRestClient,
      AudiusClientProperties properties,
      AuthorizationProvider authorizationProvider,
      Clock clock) {
    this.audiusRestClient = audiusRestClient;
    this.properties = properties;
    this.authorizationProvider = authorizationProvider;
    this.clock = clock;
  }

  @Override
  public Platform platform() {
    return Platform.AUDIUS;
  }

  @Override
  public PlaybackStatus checkPlayback(String participantId, String trackId) {
    final AccessContext context;
    try {
      context = authorizationProvider.getValidAccessContext(Platform.AUDIUS, participantId);
    } catch (UnauthenticatedException ex) {
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.AUTH_EXPIRED, ex.getMessage(), ex);
    }
    try {
      final AudiusNowPlayingResponse response =
          audiusRestClient
              .get()
              .uri(properties.nowPlayingPath(), context.platformUserId())
              .retrieve()
              .body(AudiusNowPlayingResponse.class);
      final boolean playing =
          response != null && response.data() != null && trackId.equals(response.data().id());
      return new PlaybackStatus(playing, null, Instant.now(clock), null);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        // 再生中の曲が無いユーザーは 404 を返す
        return PlaybackStatus.notPlaying(Instant.now(clock));
      }
      logger.warn("audius now-playing failed with http status={}", ex.getStatusCode().value());
      throw PlatformFailures.fromResponse("audius", ex);
    } catch (ResourceAccessException ex) {
      logger.warn("audius now-playing unreachable timeout={}", PlatformFailures.isTimeout(ex));
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
          PlatformFailures.isTimeout(ex) ? "audius request timeout" : "audius connection failed",
          ex);
    } catch (RuntimeException ex) {
      logger.warn("audius now-playing response parse failed", ex);
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
          "audius response parse failed",
          ex);
    }
  }
}
