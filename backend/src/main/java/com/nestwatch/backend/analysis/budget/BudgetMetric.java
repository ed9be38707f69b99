package com.nestwatch.backend.analysis.budget;

public enum BudgetMetric {
  HOURLY_TOKENS("hourly tokens", false),
  DAILY_TOKENS("daily tokens", true),
  DAILY_COST("daily cost", true);

  private final String label;
  private final boolean daily;

  BudgetMetric(String label, boolean daily) {
    this.label = label;
    this.daily = daily;
  }

  public String label() {
    return label;
  }

  public boolean daily() {
    return daily;
  }
}
