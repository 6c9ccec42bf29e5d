/*
 * どこで: Minigame エンジン層
 * 何を: game_type 文字列からエンジン実装を引き当てる
 * なぜ: ゲーム種別の追加を Bean 登録だけで済ませるため
 */
package com.example.minigame.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GameEngineRegistry {

  private static final Logger logger = LoggerFactory.getLogger(GameEngineRegistry.class);

  private final Map<String, GameEngine> engines = new LinkedHashMap<>();

  public GameEngineRegistry(List<GameEngine> discovered) {
    discovered.forEach(this::register);
  }

  /**
   * 役割: エンジンを登録する。
   * 動作: 同じ game_type の二重登録は設定ミスとして IllegalStateException を送出する。
   */
  public synchronized void register(GameEngine engine) {
    final GameEngine existing = engines.putIfAbsent(engine.gameType(), engine);
    if (existing != null && existing != engine) {
      throw new IllegalStateException("duplicate game engine: " + engine.gameType());
    }
    logger.info(
        "game engine registered game_type={} name={}", engine.gameType(), engine.displayName());
  }

  public synchronized Optional<GameEngine> find(String gameType) {
    return Optional.ofNullable(engines.get(gameType));
  }

  public synchronized Collection<GameEngine> all() {
    return Collections.unmodifiableList(List.copyOf(engines.values()));
  }
}
