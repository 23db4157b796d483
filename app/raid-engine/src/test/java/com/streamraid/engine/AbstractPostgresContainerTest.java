/*
 * どこで: Raid Engine テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: 条件付き UPDATE や SKIP LOCKED を本番と同じ DB で検証するため
 */
package com.streamraid.engine;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresContainerTest {

  // テストクラス間で共通のコンテナを使い回す
  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "raid");

    // Flyway は本番同等の migration を使う
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "raid");
    registry.add("spring.flyway.schemas", () -> "raid");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_raid");
  }
}
