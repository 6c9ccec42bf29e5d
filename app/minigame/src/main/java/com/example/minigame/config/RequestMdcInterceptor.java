/*
 * どこで: Minigame Web 層
 * 何を: リクエスト単位の運用キー (request_id/user_id/room_id など) を MDC に出し入れする
 * なぜ: JSON ログからボットの 1 コマンド分の処理を追えるようにするため
 */
package com.example.minigame.config;

import com.example.common.Ids;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_USER_ID = "X-User-Id";

  // ルートのパス変数名がそのまま MDC キーになる
  private static final List<String> ROUTE_KEYS =
      List.of("room_id", "channel_id", "game_type", "achievement_id");

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<?, ?> routeVariables = routeVariables(request);
    final List<String> pushed = new ArrayList<>();
    push(
        pushed,
        "request_id",
        firstNonBlank(request.getHeader(HEADER_REQUEST_ID), Ids.newRequestId()));
    push(pushed, "http_method", request.getMethod());
    push(pushed, "http_path", request.getRequestURI());
    push(pushed, "client_ip", clientIp(request));
    push(
        pushed,
        "user_id",
        firstNonBlank(request.getHeader(HEADER_USER_ID), routeVariables.get("user_id")));
    for (String key : ROUTE_KEYS) {
      push(pushed, key, firstNonBlank(routeVariables.get(key), null));
    }
    request.setAttribute(ATTRIBUTE_KEYS, pushed);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> pushed) {
      pushed.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private Map<?, ?> routeVariables(HttpServletRequest request) {
    final Object attribute =
        request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> variables ? variables : Map.of();
  }

  // プロキシ経由では X-Forwarded-For の先頭が呼び出し元
  private String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private String firstNonBlank(@Nullable Object first, @Nullable Object second) {
    for (Object candidate : new Object[] {first, second}) {
      if (candidate instanceof String value && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private void push(List<String> pushed, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      pushed.add(key);
    }
  }
}
