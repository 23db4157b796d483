/*
 * どこで: Raid Engine 設定
 * 何を: Spotify Web API 呼び出し設定を保持する
 * なぜ: 再生状態取得の URL とタイムアウトを外部化するため
 */
package com.streamraid.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "raid.spotify")
public record SpotifyClientProperties(
    String baseUrl, String playbackStatePath, Duration connectTimeout, Duration readTimeout) {

  public SpotifyClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.spotify.com" : baseUrl;
    playbackStatePath =
        playbackStatePath == null || playbackStatePath.isBlank()
            ? "/v1/me/player"
            : playbackStatePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(2) : readTimeout;
  }
}
