package com.nestwatch.backend.analysis.policy;

import com.nestwatch.backend.analysis.api.EventSnippet;
import java.util.Collection;

public record PriorityMix(int p1, int p2, int p3) {

  public PriorityMix {
    if (p1 < 0 || p2 < 0 || p3 < 0) {
      throw new IllegalArgumentException("Priority counts must not be negative");
    }
  }

  /** Counts events per priority; events without a priority are ignored. */
  public static PriorityMix of(Collection<EventSnippet> events) {
    int p1 = 0;
    int p2 = 0;
    int p3 = 0;
    if (events != null) {
      for (EventSnippet event : events) {
        if (event == null || event.priority() == null) {
          continue;
        }
        switch (event.priority()) {
          case P1 -> p1++;
          case P2 -> p2++;
          case P3 -> p3++;
        }
      }
    }
    return new PriorityMix(p1, p2, p3);
  }

  public int total() {
    return p1 + p2 + p3;
  }
}
