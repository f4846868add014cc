package com.consullo.orchestrator.exec;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CliArguments} and {@link ModelSpec}.
 *
 * @since 1.0
 */
public class CliArgumentsTest {

  @Test
  @DisplayName("Should accept canonical UUIDs in either case")
  void isUuid_Canonical_Accepts() {
    assertThat(CliArguments.isUuid("3f2a9c1e-5b7d-4e8f-9a0b-1c2d3e4f5a6b")).isTrue();
    assertThat(CliArguments.isUuid("3F2A9C1E-5B7D-4E8F-9A0B-1C2D3E4F5A6B")).isTrue();
  }

  @Test
  @DisplayName("Should reject malformed UUID text")
  void isUuid_Malformed_Rejects() {
    assertThat(CliArguments.isUuid(null)).isFalse();
    assertThat(CliArguments.isUuid("3f2a9c1e5b7d4e8f9a0b1c2d3e4f5a6b")).isFalse();
    assertThat(CliArguments.isUuid("3f2a9c1e-5b7d-4e8f-9a0b-1c2d3e4f5a6g")).isFalse();
    assertThat(CliArguments.isUuid("3f2a9c1e-5b7d-4e8f-9a0b-1c2d3e4f5a6b ")).isFalse();
  }

  @Test
  @DisplayName("Should accept opaque ids and reject injection attempts")
  void isOpaqueId_Samples_ValidatesCharacters() {
    assertThat(CliArguments.isOpaqueId("0199a213-81c0-7800-8aa1-bbab2a035a53")).isTrue();
    assertThat(CliArguments.isOpaqueId("thread_1.a:b")).isTrue();
    assertThat(CliArguments.isOpaqueId("-rf")).isFalse();
    assertThat(CliArguments.isOpaqueId("a b")).isFalse();
    assertThat(CliArguments.isOpaqueId("a;rm")).isFalse();
    assertThat(CliArguments.isOpaqueId("")).isFalse();
    assertThat(CliArguments.isOpaqueId("a".repeat(129))).isFalse();
    assertThat(CliArguments.isOpaqueId("a".repeat(128))).isTrue();
  }

  @Test
  @DisplayName("Should fall back for values outside the allow-list")
  void allowedOrDefault_Values_ResolvesAgainstList() {
    final List<String> allowed = List.of("plan", "default");

    assertThat(CliArguments.allowedOrDefault("mode", " plan ", allowed, "default")).isEqualTo("plan");
    assertThat(CliArguments.allowedOrDefault("mode", "root", allowed, "default")).isEqualTo("default");
    assertThat(CliArguments.allowedOrDefault("mode", "  ", allowed, "default")).isEqualTo("default");
  }

  @Test
  @DisplayName("Should match markers ignoring case")
  void containsAnyIgnoreCase_MixedCase_Matches() {
    assertThat(CliArguments.containsAnyIgnoreCase("Error: Session Not Found", List.of("session not found"))).isTrue();
    assertThat(CliArguments.containsAnyIgnoreCase(null, List.of("x"))).isFalse();
  }

  @Test
  @DisplayName("Should split a known effort suffix off the model name")
  void parse_EffortSuffix_SplitsModel() {
    assertThat(ModelSpec.parse("gpt-5.3-codex-low")).isEqualTo(new ModelSpec("gpt-5.3-codex", "low"));
    assertThat(ModelSpec.parse("gpt-5.3-codex")).isEqualTo(new ModelSpec("gpt-5.3-codex", null));
    assertThat(ModelSpec.parse("-high")).isEqualTo(new ModelSpec("-high", null));
    assertThat(ModelSpec.parse(null).hasModel()).isFalse();
  }
}
