/*
 * どこで: Raid Engine 設定
 * 何を: Audius API 呼び出し設定を保持する
 * なぜ: now-playing 取得の URL とタイムアウトを外部化するため
 */
package com.streamraid.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "raid.audius")
public record AudiusClientProperties(
    String baseUrl, String nowPlayingPath, Duration connectTimeout, Duration readTimeout) {

  public AudiusClientProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "https://discoveryprovider.audius.co" : baseUrl;
    nowPlayingPath =
        nowPlayingPath == null || nowPlayingPath.isBlank()
            ? "/v1/users/{userId}/now-playing"
            : nowPlayingPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(2) : readTimeout;
  }
}
