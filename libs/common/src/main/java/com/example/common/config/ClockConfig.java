/*
 * どこで: Common 共通設定
 * 何を: 業務タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 「今日」の判定 (日次チェックインなど) を各アプリで同じ基準にするため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock clock(@Value("${common.clock.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
