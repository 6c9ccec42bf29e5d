package com.example.minigame.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class GameRoomMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> roomEventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> actionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DistributionSummary> payoutSummaries =
      new ConcurrentHashMap<>();

  public GameRoomMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  /** event: created / joined / started / finished / cancelled */
  public void recordRoomEvent(String event) {
    roomEventCounters.computeIfAbsent(event, this::registerRoomEventCounter).increment();
  }

  public void recordAction(String gameType, String result) {
    actionCounters
        .computeIfAbsent(gameType + "|" + result, key -> registerActionCounter(gameType, result))
        .increment();
  }

  public void recordPayout(String gameType, long coins) {
    if (coins < 0) {
      return;
    }
    payoutSummaries.computeIfAbsent(gameType, this::registerPayoutSummary).record(coins);
  }

  private Counter registerRoomEventCounter(String event) {
    return Counter.builder("minigame.room.total")
        .tags(Tags.of("event", event))
        .register(meterRegistry);
  }

  private Counter registerActionCounter(String gameType, String result) {
    return Counter.builder("minigame.action.total")
        .tags(Tags.of("game_type", gameType, "result", result))
        .register(meterRegistry);
  }

  private DistributionSummary registerPayoutSummary(String gameType) {
    return DistributionSummary.builder("minigame.payout.coins")
        .description("Pot paid out when a room finishes")
        .tags(Tags.of("game_type", gameType))
        .register(meterRegistry);
  }
}
