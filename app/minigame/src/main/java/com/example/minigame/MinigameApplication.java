/*
 * どこで: Minigame アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 共通の Clock 設定と minigame.* のプロパティをまとめて有効化するため
 */
package com.example.minigame;

import com.example.common.config.ClockConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(ClockConfig.class)
public class MinigameApplication {

  public static void main(String[] args) {
    SpringApplication.run(MinigameApplication.class, args);
  }
}
