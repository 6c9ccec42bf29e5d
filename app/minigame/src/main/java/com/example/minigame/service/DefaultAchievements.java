package com.example.minigame.service;

import com.example.minigame.model.AchievementRecord;
import java.util.List;

/** 起動時に登録する標準の実績カタログ。 */
final class DefaultAchievements {

  static final List<AchievementRecord> ALL =
      List.of(
          AchievementRecord.of(
              "first_hundred", "小富即安", "拥有100金币", "金币", "current_coins", 100, 50, "小康"),
          AchievementRecord.of(
              "first_thousand", "财源广进", "拥有1000金币", "金币", "current_coins", 1000, 200, "富足"),
          AchievementRecord.of(
              "first_ten_thousand",
              "财富自由",
              "拥有10000金币",
              "金币",
              "current_coins",
              10000,
              1000,
              "富豪"),
          AchievementRecord.of(
              "millionaire",
              "百万富翁",
              "拥有100万金币",
              "金币",
              "current_coins",
              1000000,
              50000,
              "百万富翁"),
          AchievementRecord.of(
              "earn_thousand", "积少成多", "累计获得1000金币", "金币", "total_earned", 1000, 100, null),
          AchievementRecord.of(
              "earn_hundred_thousand",
              "财富积累",
              "累计获得10万金币",
              "金币",
              "total_earned",
              100000,
              5000,
              null),
          AchievementRecord.of(
              "single_gain_1000", "一夜暴富", "单次获得1000金币", "金币", "single_gain", 1000, 500, null),
          AchievementRecord.of(
              "check_in_7", "每日一签", "连续签到7天", "签到", "consecutive_days", 7, 300, "守时"),
          AchievementRecord.of(
              "check_in_30", "守约之人", "连续签到30天", "签到", "consecutive_days", 30, 1500, "守约之人"),
          AchievementRecord.of(
              "check_in_100",
              "坚持不懈",
              "连续签到100天",
              "签到",
              "consecutive_days",
              100,
              8000,
              "坚持不懈"),
          AchievementRecord.of(
              "check_in_365",
              "签到达人",
              "连续签到365天",
              "签到",
              "consecutive_days",
              365,
              50000,
              "签到达人"),
          AchievementRecord.of(
              "total_check_in_50", "签到爱好者", "累计签到50次", "签到", "total_check_ins", 50, 1000, null),
          AchievementRecord.of(
              "total_check_in_200",
              "打卡专家",
              "累计签到200次",
              "签到",
              "total_check_ins",
              200,
              5000,
              null),
          AchievementRecord.of("level_5", "初出茅庐", "达到5级", "等级", "level", 5, 200, null),
          AchievementRecord.of("level_10", "小有成就", "达到10级", "等级", "level", 10, 500, "小有成就"),
          AchievementRecord.of("level_20", "经验丰富", "达到20级", "等级", "level", 20, 1500, "老手"),
          AchievementRecord.of("level_50", "资深玩家", "达到50级", "等级", "level", 50, 10000, "资深玩家"),
          AchievementRecord.of(
              "roulette_first_win", "初战告捷", "俄罗斯轮盘首次获胜", "游戏", "roulette_win", 1, 100, null),
          AchievementRecord.of(
              "roulette_win_10", "幸运之星", "俄罗斯轮盘获胜10次", "游戏", "roulette_win", 10, 500, "幸运儿"),
          AchievementRecord.of(
              "roulette_survivor",
              "死里逃生",
              "俄罗斯轮盘生存100次",
              "游戏",
              "roulette_survive",
              100,
              2000,
              "幸存者"));

  private DefaultAchievements() {}
}
