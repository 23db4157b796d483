package com.streamraid.engine.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/raids/raid-1/claims");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.addHeader("X-User-Id", "p-1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/raids/raid-1/claims");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("participant_id")).isEqualTo("p-1");
    assertThat(response.getHeader("X-Request-Id")).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("participant_id")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/raids/r/x");
    request.setRemoteAddr("192.0.2.10");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isNotBlank().isEqualTo(response.getHeader("X-Request-Id"));
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.10");
    assertThat(MDC.get("participant_id")).isNull();
  }
}
