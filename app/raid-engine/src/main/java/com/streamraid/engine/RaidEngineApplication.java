/*
 * どこで: Raid Engine アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: 参加 API と再生ポーリング/精算ワーカーを単一アプリとして起動するため
 */
package com.streamraid.engine;

import com.streamraid.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class RaidEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RaidEngineApplication.class, args);
  }
}
