package com.nestwatch.backend.analysis.budget;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Posts alerts to a Slack-compatible incoming webhook, falling back to the log on failure. */
public class WebhookBudgetAlertNotifier implements BudgetAlertNotifier {

  private static final Logger log = LoggerFactory.getLogger(WebhookBudgetAlertNotifier.class);

  private final RestClient restClient;
  private final String webhookUrl;
  private final String username;
  private final RetryTemplate retryTemplate;
  private final BudgetAlertNotifier fallback;

  public WebhookBudgetAlertNotifier(
      RestClient restClient,
      String webhookUrl,
      String username,
      RetryTemplate retryTemplate,
      BudgetAlertNotifier fallback) {
    this.restClient = restClient;
    this.webhookUrl = webhookUrl;
    this.username = username;
    this.retryTemplate = retryTemplate;
    this.fallback = fallback;
  }

  @Override
  public void notify(BudgetAlert alert) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("text", alert.message());
    payload.put("username", username);
    payload.put("icon_emoji", alert.exhausted() ? ":rotating_light:" : ":warning:");
    try {
      retryTemplate.execute(
          context -> {
            restClient
                .post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .toBodilessEntity();
            return null;
          });
      log.debug("Delivered budget alert {} {}%", alert.metric(), alert.thresholdPercent());
    } catch (RestClientException ex) {
      log.warn("Failed to deliver budget alert to webhook: {}", ex.getMessage());
      fallback.notify(alert);
    }
  }
}
