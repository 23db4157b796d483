/*
 * どこで: Raid Engine 設定
 * 何を: 外部プラットフォーム/精算呼び出し専用の RestClient を提供する
 * なぜ: 接続先ごとに baseUrl とタイムアウトを分離し、遅い応答がポーリングを止めないようにするため
 */
package com.streamraid.engine.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PlatformClientConfig {

  @Bean
  RestClient spotifyRestClient(RestClient.Builder builder, SpotifyClientProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient audiusRestClient(RestClient.Builder builder, AudiusClientProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient settlementRestClient(RestClient.Builder builder, SettlementProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.timeout(), properties.timeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connect);
    factory.setReadTimeout(read);
    return factory;
  }
}
