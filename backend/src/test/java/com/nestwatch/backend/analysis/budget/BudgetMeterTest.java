package com.nestwatch.backend.analysis.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.nestwatch.backend.analysis.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BudgetMeterTest {

  private MutableClock clock;
  private List<BudgetAlert> alerts;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2025-03-01T10:15:00Z"));
    alerts = new CopyOnWriteArrayList<>();
  }

  @Test
  void rejectsChargeThatWouldExceedDailyBudgetInFull() {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);

    BudgetMeter.ChargeResult result = meter.charge(1_200, BigDecimal.ZERO);

    assertThat(result.withinLimits()).isFalse();
    assertThat(result.limitingMetric()).isEqualTo(BudgetMetric.DAILY_TOKENS);
    BudgetUsageSnapshot usage = meter.usage();
    assertThat(usage.dailyTokens()).isZero();
    assertThat(usage.hourlyTokens()).isZero();
    assertThat(usage.dailyRequests()).isZero();
    assertThat(meter.isExhausted()).isTrue();
    assertThat(alerts).singleElement().satisfies(alert -> {
      assertThat(alert.metric()).isEqualTo(BudgetMetric.DAILY_TOKENS);
      assertThat(alert.exhausted()).isTrue();
    });
  }

  @Test
  void acceptsChargesWithinLimits() {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);

    BudgetMeter.ChargeResult result = meter.charge(400, new BigDecimal("0.01"));

    assertThat(result.withinLimits()).isTrue();
    assertThat(result.pctUsed()).isEqualTo(40.0);
    assertThat(meter.isExhausted()).isFalse();
    BudgetUsageSnapshot usage = meter.usage();
    assertThat(usage.dailyTokens()).isEqualTo(400);
    assertThat(usage.hourlyTokens()).isEqualTo(400);
    assertThat(usage.dailyCostUsd()).isEqualByComparingTo("0.01");
    assertThat(usage.dailyCostLimitUsd()).isNull();
    assertThat(usage.hourWindowStart()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
    assertThat(usage.dayWindowStart()).isEqualTo(Instant.parse("2025-03-01T00:00:00Z"));
    assertThat(alerts).isEmpty();
  }

  @Test
  void raisesEachThresholdAlertOncePerWindow() {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);

    meter.charge(900, BigDecimal.ZERO);
    meter.charge(50, BigDecimal.ZERO);
    meter.charge(50, BigDecimal.ZERO);

    assertThat(alerts)
        .extracting(BudgetAlert::metric, BudgetAlert::thresholdPercent)
        .containsExactly(
            tuple(BudgetMetric.DAILY_TOKENS, 90),
            tuple(BudgetMetric.DAILY_TOKENS, 100));
    assertThat(meter.isExhausted()).isTrue();
  }

  @Test
  void hourlyWindowRollsOverIndependently() {
    BudgetMeter meter = meter(500, 10_000, BigDecimal.ZERO);
    meter.charge(500, BigDecimal.ZERO);
    assertThat(meter.isExhausted()).isTrue();

    clock.advance(Duration.ofHours(1));

    assertThat(meter.isExhausted()).isFalse();
    BudgetUsageSnapshot usage = meter.usage();
    assertThat(usage.hourlyTokens()).isZero();
    assertThat(usage.dailyTokens()).isEqualTo(500);
  }

  @Test
  void dailyWindowRollsOverAtUtcMidnight() {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);
    meter.charge(1_200, BigDecimal.ZERO);
    assertThat(meter.isExhausted()).isTrue();

    clock.set(Instant.parse("2025-03-02T00:00:01Z"));

    assertThat(meter.isExhausted()).isFalse();
    assertThat(meter.charge(600, BigDecimal.ZERO).withinLimits()).isTrue();
  }

  @Test
  void enforcesCostBudgetWhenConfigured() {
    BudgetMeter meter = meter(40_000, 100_000, new BigDecimal("1.00"));

    assertThat(meter.charge(100, new BigDecimal("0.80")).withinLimits()).isTrue();
    BudgetMeter.ChargeResult rejected = meter.charge(100, new BigDecimal("0.30"));

    assertThat(rejected.withinLimits()).isFalse();
    assertThat(rejected.limitingMetric()).isEqualTo(BudgetMetric.DAILY_COST);
    assertThat(meter.usage().dailyCostUsd()).isEqualByComparingTo("0.80");
    assertThat(meter.usage().dailyCostLimitUsd()).isEqualByComparingTo("1.00");
  }

  @Test
  void concurrentChargesNeverOvershootLimit() throws Exception {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int i = 0; i < 40; i++) {
        executor.submit(
            () -> {
              start.await();
              return meter.charge(70, BigDecimal.ZERO);
            });
      }
      start.countDown();
      executor.shutdown();
      assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }

    assertThat(meter.usage().dailyTokens()).isEqualTo(980);
    assertThat(meter.usage().dailyRequests()).isEqualTo(14);
  }

  @Test
  void rejectsNegativeCharges() {
    BudgetMeter meter = meter(40_000, 1_000, BigDecimal.ZERO);

    assertThatThrownBy(() -> meter.charge(-1, BigDecimal.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> meter.charge(1, new BigDecimal("-0.01")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void alertMessageDescribesUsage() {
    BudgetAlert alert =
        new BudgetAlert(
            BudgetMetric.HOURLY_TOKENS,
            90,
            BigDecimal.valueOf(36_000),
            BigDecimal.valueOf(40_000),
            Instant.parse("2025-03-01T10:00:00Z"),
            Instant.parse("2025-03-01T10:20:00Z"));

    assertThat(alert.message()).isEqualTo("LLM budget warning: hourly tokens at 90.0% (36000/40000 tokens)");
  }

  private BudgetMeter meter(long hourly, long daily, BigDecimal dailyCost) {
    return new BudgetMeter(hourly, daily, dailyCost, clock, alerts::add, Runnable::run);
  }
}
