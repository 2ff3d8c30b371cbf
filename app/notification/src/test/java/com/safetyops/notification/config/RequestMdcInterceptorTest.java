/*
 * Where: Notification web configuration test
 * What: Verifies MDC population, request id echo and cleanup
 * Why: Leaked MDC keys would tag unrelated cron log lines with a stale request id
 */
package com.safetyops.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void preHandleUsesIncomingRequestIdAndActor() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/admin/schedules/tbm-reminder:reload");
    request.addHeader(RequestMdcInterceptor.HEADER_REQUEST_ID, "req-1");
    request.addHeader(RequestMdcInterceptor.HEADER_ACTOR_USER_ID, "admin-7");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("actor_id")).isEqualTo("admin-7");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/admin/schedules/tbm-reminder:reload");
    assertThat(response.getHeader(RequestMdcInterceptor.HEADER_REQUEST_ID)).isEqualTo("req-1");
  }

  @Test
  void preHandleTagsScheduleAndRecipientPathVariables() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/admin/schedules/tbm-reminder:stop");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("id", "tbm-reminder"));

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("schedule_id")).isEqualTo("tbm-reminder");
    assertThat(MDC.get("recipient_id")).isNull();
  }

  @Test
  void preHandleGeneratesRequestIdWhenMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/status/transport");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    final String requestId = MDC.get("request_id");
    assertThat(requestId).isNotBlank();
    assertThat(response.getHeader(RequestMdcInterceptor.HEADER_REQUEST_ID)).isEqualTo(requestId);
    assertThat(MDC.get("actor_id")).isNull();
  }

  @Test
  void afterCompletionRemovesOnlyKeysItAdded() {
    MDC.put("job_name", "schedule:tbm-reminder");
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/admin/ledger/stats");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());
    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_path")).isNull();
    assertThat(MDC.get("job_name")).isEqualTo("schedule:tbm-reminder");
  }
}
