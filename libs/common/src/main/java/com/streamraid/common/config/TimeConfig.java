/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を DI 可能にする
 * なぜ: 累積時間や期限判定をテストで固定時刻に差し替えるため
 */
package com.streamraid.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
