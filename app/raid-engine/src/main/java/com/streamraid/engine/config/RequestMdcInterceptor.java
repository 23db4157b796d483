/*
 * どこで: Raid Engine Web 層
 * 何を: リクエスト ID/メソッド/パス/参加者 ID を MDC に積み、完了時に取り除く
 * なぜ: 参加や請求のログを呼び出し単位で追跡できるようにするため
 */
package com.streamraid.engine.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_USER_ID = "X-User-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    put(keys, "participant_id", request.getHeader(HEADER_USER_ID));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    response.setHeader(HEADER_REQUEST_ID, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    return commaIndex < 0 ? xForwardedFor.trim() : xForwardedFor.substring(0, commaIndex).trim();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
