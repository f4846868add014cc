package com.consullo.orchestrator.capture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the default churn suppression policy.
 *
 * @since 1.0
 */
public class DefaultChurnFilterPolicyTest {

  private final DefaultChurnFilterPolicy policy = new DefaultChurnFilterPolicy();

  @Test
  @DisplayName("Should suppress minimal spinner tokens")
  void shouldSuppressRow_SpinnerTokens_Suppresses() {
    assertThat(policy.shouldSuppressRow("|")).isTrue();
    assertThat(policy.shouldSuppressRow("/")).isTrue();
    assertThat(policy.shouldSuppressRow("-")).isTrue();
    assertThat(policy.shouldSuppressRow("\\")).isTrue();
    assertThat(policy.shouldSuppressRow("...")).isTrue();
    assertThat(policy.shouldSuppressRow("⠋")).isTrue();
    assertThat(policy.shouldSuppressRow("Working |")).isTrue();
  }

  @Test
  @DisplayName("Should suppress simple progress-like lines")
  void shouldSuppressRow_ProgressLike_Suppresses() {
    assertThat(policy.shouldSuppressRow("[==========     ] 50%")).isTrue();
    assertThat(policy.shouldSuppressRow("Thinking...")).isTrue();
    assertThat(policy.shouldSuppressRow("Loading…")).isTrue();
  }

  @Test
  @DisplayName("Should suppress prompt box borders, status hints and animated status rows")
  void shouldSuppressRow_AgentChrome_Suppresses() {
    assertThat(policy.shouldSuppressRow("╭────────────────╮")).isTrue();
    assertThat(policy.shouldSuppressRow("  ? for shortcuts")).isTrue();
    assertThat(policy.shouldSuppressRow("✻ Pondering… (3s · esc to interrupt)")).isTrue();
    assertThat(policy.shouldSuppressRow("· Reticulating…")).isTrue();
  }

  @Test
  @DisplayName("Should not suppress ordinary content lines")
  void shouldSuppressRow_NormalText_DoesNotSuppress() {
    assertThat(policy.shouldSuppressRow("Hello world")).isFalse();
    assertThat(policy.shouldSuppressRow("There are 3 files - all tracked.")).isFalse();
    assertThat(policy.shouldSuppressRow("* item one")).isFalse();
    assertThat(policy.shouldSuppressRow("")).isFalse();
  }

  @Test
  @DisplayName("Should suppress a missing row")
  void shouldSuppressRow_Null_Suppresses() {
    assertThat(policy.shouldSuppressRow(null)).isTrue();
  }
}
