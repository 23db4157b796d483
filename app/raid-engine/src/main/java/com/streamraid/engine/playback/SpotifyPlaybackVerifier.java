/*
 * どこで: Raid Engine 再生確認
 * 何を: Spotify の再生状態 API から対象トラックの再生有無を判定する
 * なぜ: 参加者が実際に聴いている時間だけを累積するため
 */
package com.streamraid.engine.playback;

import com.streamraid.engine.auth.AuthorizationProvider;
import com.streamraid.engine.auth.UnauthenticatedException;
import com.streamraid.engine.config.SpotifyClientProperties;
import com.streamraid.engine.model.AccessContext;
import com.streamraid.engine.model.Platform;
import com.streamraid.engine.model.PlaybackStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
public class SpotifyPlaybackVerifier implements PlaybackVerifier {

  private static final Logger logger = LoggerFactory.getLogger(SpotifyPlaybackVerifier.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient spotifyRestClient;

  private final SpotifyClientProperties properties;
  private final AuthorizationProvider authorizationProvider;
  private final Clock clock;

  public SpotifyPlaybackVerifier(
      @Qualifier("spotifyRestClient") RestClient spotifyRestClient,
      SpotifyClientProperties properties,
      AuthorizationProvider authorizationProvider,
      Clock clock) {
    this.spotifyRestClient = spotifyRestClient;
    this.properties = properties;
    this.authorizationProvider = authorizationProvider;
    this.clock = clock;
  }

  @Override
  public Platform platform() {
    return Platform.SPOTIFY;
  }

  @Override
  public PlaybackStatus checkPlayback(String participantId, String trackId) {
    final AccessContext context = resolveContext(participantId);
    try {
      final ResponseEntity<SpotifyPlaybackStateResponse> response =
          spotifyRestClient
              .get()
              .uri(properties.playbackStatePath())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + context.accessToken())
              .retrieve()
              .toEntity(SpotifyPlaybackStateResponse.class);
      return toStatus(response, trackId);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "spotify playback check failed with http status={}", ex.getStatusCode().value());
      throw PlatformFailures.fromResponse("spotify", ex);
    } catch (ResourceAccessException ex) {
      if (PlatformFailures.isTimeout(ex)) {
        logger.warn("spotify playback check timed out");
        throw new PlaybackVerificationException(
            PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
            "spotify request timeout",
            ex);
      }
      logger.warn("spotify playback check connection failed", ex);
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
          "spotify connection failed",
          ex);
    } catch (RuntimeException ex) {
      logger.warn("spotify playback response parse failed", ex);
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.PLATFORM_UNAVAILABLE,
          "spotify response parse failed",
          ex);
    }
  }

  private AccessContext resolveContext(String participantId) {
    try {
      return authorizationProvider.getValidAccessContext(Platform.SPOTIFY, participantId);
    } catch (UnauthenticatedException ex) {
      throw new PlaybackVerificationException(
          PlaybackVerificationException.Reason.AUTH_EXPIRED, ex.getMessage(), ex);
    }
  }

  private PlaybackStatus toStatus(
      ResponseEntity<SpotifyPlaybackStateResponse> response, String trackId) {
    final Instant now = Instant.now(clock);
    final SpotifyPlaybackStateResponse body = response.getBody();
    // 204 はアクティブなデバイスが無い状態
    if (response.getStatusCode().isSameCodeAs(HttpStatus.NO_CONTENT) || body == null) {
      return PlaybackStatus.notPlaying(now);
    }
    final boolean playing =
        Boolean.TRUE.equals(body.isPlaying())
            && body.item() != null
            && trackId.equals(body.item().id());
    final String deviceRef = body.device() == null ? null : body.device().id();
    return new PlaybackStatus(playing, body.progressMs(), now, deviceRef);
  }
}
