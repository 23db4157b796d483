/*
 * どこで: Raid Engine 設定
 * 何を: 報酬精算の接続先/リース/リトライ設定を保持する
 * なぜ: 精算プログラムの切替とバックオフを運用で調整するため
 */
package com.streamraid.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "raid.settlement")
public record SettlementProperties(
    String mode,
    String baseUrl,
    String settlePath,
    Duration timeout,
    Duration lease,
    boolean retryEnabled,
    Duration retryInterval,
    int batchSize,
    Duration backoffBase,
    Duration backoffMax) {

  public SettlementProperties {
    mode = mode == null || mode.isBlank() ? "local" : mode;
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://settlement:80" : baseUrl;
    settlePath = settlePath == null || settlePath.isBlank() ? "/v1/settlements" : settlePath;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    // リースは精算呼び出しのタイムアウトより長くし、二重精算を避ける
    lease = lease == null ? Duration.ofMinutes(2) : lease;
    retryInterval = retryInterval == null ? Duration.ofSeconds(30) : retryInterval;
    batchSize = batchSize <= 0 ? 20 : batchSize;
    backoffBase = backoffBase == null ? Duration.ofSeconds(30) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofMinutes(30) : backoffMax;
  }
}
