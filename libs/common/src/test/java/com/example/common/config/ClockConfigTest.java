package com.example.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class ClockConfigTest {

  @Test
  void clockUsesConfiguredZone() {
    assertThat(new ClockConfig().clock("Asia/Shanghai").getZone())
        .isEqualTo(ZoneId.of("Asia/Shanghai"));
  }
}
