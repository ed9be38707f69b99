package com.nestwatch.backend.analysis.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nestwatch.backend.analysis.api.EventPriority;
import com.nestwatch.backend.analysis.api.EventSnippet;
import com.nestwatch.backend.analysis.support.AnalysisFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AnalysisPolicyEngineTest {

  private final AnalysisPolicyEngine engine = new AnalysisPolicyEngine(true, 2);

  @ParameterizedTest
  @CsvSource({
    "0, 2, 50, true",
    "1, 2, 50, false",
    "0, 3, 0, false",
    "0, 0, 0, true",
    "0, 0, 500, true"
  })
  void skipsOnlyQuietMixes(int p1, int p2, int p3, boolean skip) {
    assertThat(engine.shouldSkipLlm(new PriorityMix(p1, p2, p3))).isEqualTo(skip);
  }

  @Test
  void disabledPolicyNeverSkips() {
    AnalysisPolicyEngine disabled = new AnalysisPolicyEngine(false, 2);

    assertThat(disabled.shouldSkipLlm(new PriorityMix(0, 0, 10))).isFalse();
  }

  @Test
  void countsPrioritiesAndIgnoresIncompleteEvents() {
    List<EventSnippet> events = new ArrayList<>(AnalysisFixtures.mix(1, 2, 3));
    events.add(null);
    events.add(AnalysisFixtures.event("X-1", "jira", null, "no priority"));

    PriorityMix mix = PriorityMix.of(events);

    assertThat(mix).isEqualTo(new PriorityMix(1, 2, 3));
    assertThat(mix.total()).isEqualTo(6);
  }

  @Test
  void rejectsNegativeCounts() {
    assertThatThrownBy(() -> new PriorityMix(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new AnalysisPolicyEngine(true, -1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parsesPriorityLeniently() {
    assertThat(EventPriority.from(" p2 ")).isEqualTo(EventPriority.P2);
    assertThat(EventPriority.from("")).isNull();
  }
}
