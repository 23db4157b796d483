package com.streamraid.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "raid.cleanup")
public record CleanupProperties(boolean enabled, Duration staleJoinerAge, Duration interval) {

  public CleanupProperties {
    staleJoinerAge = staleJoinerAge == null ? Duration.ofSeconds(60) : staleJoinerAge;
    interval = interval == null ? Duration.ofSeconds(60) : interval;
  }
}
