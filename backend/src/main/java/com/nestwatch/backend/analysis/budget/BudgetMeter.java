package com.nestwatch.backend.analysis.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hourly and daily token and cost accounting. Windows align to UTC wall-clock hour and day
 * boundaries. A charge is validated against every window before any counter moves, so it is
 * applied in full or not at all.
 */
public class BudgetMeter {

  private static final Logger log = LoggerFactory.getLogger(BudgetMeter.class);
  private static final int[] ALERT_THRESHOLDS = {90, 100};
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final long hourlyTokenLimit;
  private final long dailyTokenLimit;
  private final BigDecimal dailyCostLimit;
  private final Clock clock;
  private final BudgetAlertNotifier notifier;
  private final Executor alertExecutor;

  private Instant hourStart;
  private Instant dayStart;
  private long hourlyTokens;
  private long dailyTokens;
  private BigDecimal hourlyCost = BigDecimal.ZERO;
  private BigDecimal dailyCost = BigDecimal.ZERO;
  private long hourlyRequests;
  private long dailyRequests;
  private boolean hourExhausted;
  private boolean dayExhausted;
  private final Map<BudgetMetric, Set<Integer>> sentAlerts = new EnumMap<>(BudgetMetric.class);

  public BudgetMeter(
      long hourlyTokenLimit,
      long dailyTokenLimit,
      BigDecimal dailyCostLimit,
      Clock clock,
      BudgetAlertNotifier notifier,
      Executor alertExecutor) {
    if (hourlyTokenLimit <= 0 || dailyTokenLimit <= 0) {
      throw new IllegalArgumentException("Token budgets must be positive");
    }
    if (dailyCostLimit != null && dailyCostLimit.signum() < 0) {
      throw new IllegalArgumentException("Daily cost budget must not be negative");
    }
    this.hourlyTokenLimit = hourlyTokenLimit;
    this.dailyTokenLimit = dailyTokenLimit;
    this.dailyCostLimit = dailyCostLimit != null ? dailyCostLimit : BigDecimal.ZERO;
    this.clock = clock;
    this.notifier = notifier;
    this.alertExecutor = alertExecutor;
    Instant now = clock.instant();
    this.hourStart = hourStart(now);
    this.dayStart = dayStart(now);
    for (BudgetMetric metric : BudgetMetric.values()) {
      sentAlerts.put(metric, new HashSet<>());
    }
  }

  public ChargeResult charge(long tokens, BigDecimal costUsd) {
    if (tokens < 0) {
      throw new IllegalArgumentException("tokens must not be negative");
    }
    BigDecimal cost = costUsd != null ? costUsd : BigDecimal.ZERO;
    if (cost.signum() < 0) {
      throw new IllegalArgumentException("costUsd must not be negative");
    }
    List<BudgetAlert> alerts = new ArrayList<>(2);
    ChargeResult result;
    synchronized (this) {
      Instant now = clock.instant();
      rollover(now);
      long nextHourly = hourlyTokens + tokens;
      long nextDaily = dailyTokens + tokens;
      BigDecimal nextDailyCost = dailyCost.add(cost);

      BudgetMetric violated = null;
      if (nextHourly > hourlyTokenLimit) {
        violated = BudgetMetric.HOURLY_TOKENS;
        hourExhausted = true;
      } else if (nextDaily > dailyTokenLimit) {
        violated = BudgetMetric.DAILY_TOKENS;
        dayExhausted = true;
      } else if (costEnforced() && nextDailyCost.compareTo(dailyCostLimit) > 0) {
        violated = BudgetMetric.DAILY_COST;
        dayExhausted = true;
      }

      if (violated != null) {
        log.warn(
            "Rejected LLM charge of {} tokens / {} USD: {} budget would be exceeded",
            tokens,
            cost.toPlainString(),
            violated.label());
        collectAlert(violated, 100, currentUsage(violated), now, alerts);
        result = ChargeResult.rejected(percentUsed(), violated);
      } else {
        hourlyTokens = nextHourly;
        dailyTokens = nextDaily;
        hourlyCost = hourlyCost.add(cost);
        dailyCost = nextDailyCost;
        hourlyRequests++;
        dailyRequests++;
        for (BudgetMetric metric : BudgetMetric.values()) {
          if (metric == BudgetMetric.DAILY_COST && !costEnforced()) {
            continue;
          }
          BigDecimal used = currentUsage(metric);
          double pct = percent(used, limit(metric));
          for (int threshold : ALERT_THRESHOLDS) {
            if (pct >= threshold) {
              collectAlert(metric, threshold, used, now, alerts);
            }
          }
        }
        result = ChargeResult.accepted(percentUsed());
      }
    }
    dispatch(alerts);
    return result;
  }

  /** True once any window reached its budget or rejected a charge, until that window rolls over. */
  public synchronized boolean isExhausted() {
    rollover(clock.instant());
    return exhausted();
  }

  public synchronized BudgetUsageSnapshot usage() {
    rollover(clock.instant());
    return new BudgetUsageSnapshot(
        hourlyTokens,
        hourlyTokenLimit,
        dailyTokens,
        dailyTokenLimit,
        hourlyCost,
        dailyCost,
        costEnforced() ? dailyCostLimit : null,
        hourlyRequests,
        dailyRequests,
        hourStart,
        dayStart,
        percentUsed(),
        exhausted());
  }

  private boolean exhausted() {
    return hourExhausted
        || dayExhausted
        || hourlyTokens >= hourlyTokenLimit
        || dailyTokens >= dailyTokenLimit
        || (costEnforced() && dailyCost.compareTo(dailyCostLimit) >= 0);
  }

  private void rollover(Instant now) {
    Instant currentHour = hourStart(now);
    if (!currentHour.equals(hourStart)) {
      hourStart = currentHour;
      hourlyTokens = 0;
      hourlyCost = BigDecimal.ZERO;
      hourlyRequests = 0;
      hourExhausted = false;
      resetAlerts(false);
    }
    Instant currentDay = dayStart(now);
    if (!currentDay.equals(dayStart)) {
      dayStart = currentDay;
      dailyTokens = 0;
      dailyCost = BigDecimal.ZERO;
      dailyRequests = 0;
      dayExhausted = false;
      resetAlerts(true);
      log.info("LLM budget day window reset at {}", dayStart);
    }
  }

  private void resetAlerts(boolean daily) {
    EnumSet.allOf(BudgetMetric.class).stream()
        .filter(metric -> metric.daily() == daily)
        .forEach(metric -> sentAlerts.get(metric).clear());
  }

  private void collectAlert(
      BudgetMetric metric, int threshold, BigDecimal used, Instant now, List<BudgetAlert> alerts) {
    if (!sentAlerts.get(metric).add(threshold)) {
      return;
    }
    Instant windowStart = metric.daily() ? dayStart : hourStart;
    alerts.add(new BudgetAlert(metric, threshold, used, limit(metric), windowStart, now));
  }

  private void dispatch(List<BudgetAlert> alerts) {
    for (BudgetAlert alert : alerts) {
      try {
        alertExecutor.execute(() -> notifier.notify(alert));
      } catch (RuntimeException ex) {
        log.warn("Failed to schedule budget alert {}", alert.message(), ex);
      }
    }
  }

  private double percentUsed() {
    double pct =
        Math.max(
            percent(BigDecimal.valueOf(hourlyTokens), BigDecimal.valueOf(hourlyTokenLimit)),
            percent(BigDecimal.valueOf(dailyTokens), BigDecimal.valueOf(dailyTokenLimit)));
    if (costEnforced()) {
      pct = Math.max(pct, percent(dailyCost, dailyCostLimit));
    }
    return pct;
  }

  private BigDecimal currentUsage(BudgetMetric metric) {
    return switch (metric) {
      case HOURLY_TOKENS -> BigDecimal.valueOf(hourlyTokens);
      case DAILY_TOKENS -> BigDecimal.valueOf(dailyTokens);
      case DAILY_COST -> dailyCost;
    };
  }

  private BigDecimal limit(BudgetMetric metric) {
    return switch (metric) {
      case HOURLY_TOKENS -> BigDecimal.valueOf(hourlyTokenLimit);
      case DAILY_TOKENS -> BigDecimal.valueOf(dailyTokenLimit);
      case DAILY_COST -> dailyCostLimit;
    };
  }

  private boolean costEnforced() {
    return dailyCostLimit.signum() > 0;
  }

  private static double percent(BigDecimal used, BigDecimal limit) {
    if (limit.signum() == 0) {
      return 0;
    }
    return used.multiply(HUNDRED).divide(limit, 2, RoundingMode.HALF_UP).doubleValue();
  }

  private static Instant hourStart(Instant now) {
    return now.truncatedTo(ChronoUnit.HOURS);
  }

  private static Instant dayStart(Instant now) {
    return now.atZone(ZoneOffset.UTC).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  public record ChargeResult(boolean withinLimits, double pctUsed, BudgetMetric limitingMetric) {

    static ChargeResult accepted(double pctUsed) {
      return new ChargeResult(true, pctUsed, null);
    }

    static ChargeResult rejected(double pctUsed, BudgetMetric metric) {
      return new ChargeResult(false, pctUsed, metric);
    }
  }
}
