package com.streamraid.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HostIdentityTest {

  @Test
  void prefersHostnameEnvironmentValue() {
    assertThat(HostIdentity.resolve("engine-0")).isEqualTo("engine-0");
  }

  @Test
  void fallsBackToLocalHostWhenEnvironmentIsBlank() {
    assertThat(HostIdentity.resolve("  ")).isNotBlank();
  }

  @Test
  void leaseTokensAreUnique() {
    assertThat(HostIdentity.newLeaseToken()).isNotEqualTo(HostIdentity.newLeaseToken());
  }
}
