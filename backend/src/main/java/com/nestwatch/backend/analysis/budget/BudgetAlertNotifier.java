package com.nestwatch.backend.analysis.budget;

public interface BudgetAlertNotifier {

  /** Delivers an alert. Implementations must not throw; delivery problems are logged. */
  void notify(BudgetAlert alert);
}
