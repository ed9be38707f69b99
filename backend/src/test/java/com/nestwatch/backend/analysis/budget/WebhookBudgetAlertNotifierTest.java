package com.nestwatch.backend.analysis.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

class WebhookBudgetAlertNotifierTest {

  private static final String WEBHOOK = "https://hooks.example.test/services/T000/B000";

  private MockRestServiceServer server;
  private List<BudgetAlert> fallbackAlerts;
  private WebhookBudgetAlertNotifier notifier;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    fallbackAlerts = new ArrayList<>();
    RetryTemplate retryTemplate =
        RetryTemplate.builder().maxAttempts(2).noBackoff().retryOn(RestClientException.class).build();
    notifier =
        new WebhookBudgetAlertNotifier(
            builder.build(), WEBHOOK, "SRE Dashboard", retryTemplate, fallbackAlerts::add);
  }

  @Test
  void postsSlackPayload() {
    server
        .expect(requestTo(WEBHOOK))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.username").value("SRE Dashboard"))
        .andExpect(jsonPath("$.icon_emoji").value(":rotating_light:"))
        .andExpect(jsonPath("$.text").value("LLM budget exhausted: daily tokens at 100.0% (1000/1000 tokens)"))
        .andRespond(withSuccess());

    notifier.notify(alert(100));

    server.verify();
    assertThat(fallbackAlerts).isEmpty();
  }

  @Test
  void fallsBackToLogAfterRetriesFail() {
    server.expect(ExpectedCount.times(2), requestTo(WEBHOOK)).andRespond(withServerError());

    notifier.notify(alert(90));

    server.verify();
    assertThat(fallbackAlerts).hasSize(1);
  }

  private static BudgetAlert alert(int threshold) {
    BigDecimal used = threshold >= 100 ? BigDecimal.valueOf(1_000) : BigDecimal.valueOf(900);
    return new BudgetAlert(
        BudgetMetric.DAILY_TOKENS,
        threshold,
        used,
        BigDecimal.valueOf(1_000),
        Instant.parse("2025-03-01T00:00:00Z"),
        Instant.parse("2025-03-01T10:00:00Z"));
  }
}
