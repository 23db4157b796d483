package com.streamraid.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcScopeTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void putsValuesAndRemovesThemOnClose() {
    try (MdcScope ignored = MdcScope.open(Map.of("raid_id", "r-1", "participant_id", "p-1"))) {
      assertThat(MDC.get("raid_id")).isEqualTo("r-1");
      assertThat(MDC.get("participant_id")).isEqualTo("p-1");
    }

    assertThat(MDC.get("raid_id")).isNull();
    assertThat(MDC.get("participant_id")).isNull();
  }

  @Test
  void restoresOuterValuesOnClose() {
    MDC.put("raid_id", "outer");

    try (MdcScope ignored = MdcScope.open("raid_id", "inner")) {
      assertThat(MDC.get("raid_id")).isEqualTo("inner");
    }

    assertThat(MDC.get("raid_id")).isEqualTo("outer");
  }

  @Test
  void nullValueHidesOuterValueInsideScope() {
    MDC.put("platform", "SPOTIFY");
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("platform", null);

    try (MdcScope ignored = MdcScope.open(values)) {
      assertThat(MDC.get("platform")).isNull();
    }

    assertThat(MDC.get("platform")).isEqualTo("SPOTIFY");
  }
}
