/*
 * どこで: Minigame データアクセス
 * 何を: TEXT 列に保存された JSON (players/game_data/settings/details) を Jackson ツリーと相互変換する
 * なぜ: 壊れた JSON を含む旧データでもルーム一覧が読めるよう、読み取り側で空値へ倒すため
 */
package com.example.minigame.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JsonColumns {

  private static final Logger logger = LoggerFactory.getLogger(JsonColumns.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public JsonColumns(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String write(JsonNode node) {
    if (node == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize json column", ex);
    }
  }

  public ArrayNode readArray(String json) {
    final JsonNode node = readTree(json);
    if (node instanceof ArrayNode array) {
      return array;
    }
    return objectMapper.createArrayNode();
  }

  public ObjectNode readObject(String json) {
    final JsonNode node = readTree(json);
    if (node instanceof ObjectNode object) {
      return object;
    }
    return objectMapper.createObjectNode();
  }

  /** details 列向け。空・壊れた値は null として扱う。 */
  public JsonNode readNullable(String json) {
    final JsonNode node = readTree(json);
    return node == null || node.isMissingNode() || node.isNull() ? null : node;
  }

  private JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      logger.warn("ignoring unreadable json column value length={}", json.length());
      return null;
    }
  }
}
