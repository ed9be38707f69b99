package com.nestwatch.backend.analysis.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingBudgetAlertNotifier implements BudgetAlertNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingBudgetAlertNotifier.class);

  @Override
  public void notify(BudgetAlert alert) {
    log.warn("{} [window started {}]", alert.message(), alert.windowStart());
  }
}
