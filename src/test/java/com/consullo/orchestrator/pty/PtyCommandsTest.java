package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.config.ClaudeSettings;
import com.consullo.orchestrator.config.CodexSettings;
import com.consullo.orchestrator.exec.ExecutionRequest;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PtyCommandsTest {

  private static final String SESSION = "3f2a9c1e-5b7d-4e8f-9a0b-1c2d3e4f5a6b";

  @Test
  @DisplayName("Should start the item/event CLI in JSON mode with sandbox, approval, model and directory")
  void codex_BuildsInteractiveJsonCommand() {
    final ExecutionRequest request = request("chan:t1", null)
            .model("gpt-5.2-codex-high")
            .mode("read-only")
            .build();

    final PtySessionConfig config = PtyCommands.codex(CodexSettings.defaults()).apply(request);

    assertThat(config.key()).isEqualTo("chan:t1");
    assertThat(config.outputMode()).isEqualTo(OutputMode.JSON_EVENTS);
    assertThat(config.command()).containsExactly(
            "codex", "--json", "--sandbox", "read-only", "--ask-for-approval", "on-request",
            "--model", "gpt-5.2-codex", "-c", "model_reasoning_effort=\"high\"",
            "--cd", Path.of("/work").toString());
  }

  @Test
  @DisplayName("Should capture the discrete-message CLI as a terminal transcript and resume valid sessions only")
  void claude_ResumesOnlyUuidSessions() {
    final PtySessionConfig resumed = PtyCommands.claude(ClaudeSettings.defaults())
            .apply(request("chan:t1", SESSION).model("sonnet").build());
    final PtySessionConfig fresh = PtyCommands.claude(ClaudeSettings.defaults())
            .apply(request("chan:t1", "not-a-uuid").mode("nonsense").build());

    assertThat(resumed.outputMode()).isEqualTo(OutputMode.TERMINAL_TRANSCRIPT);
    assertThat(resumed.command()).containsExactly(
            "claude", "--permission-mode", "bypassPermissions", "--model", "sonnet", "--resume", SESSION);
    assertThat(fresh.command()).containsExactly("claude", "--permission-mode", "bypassPermissions");
  }

  private static ExecutionRequest.Builder request(final String owner, final String resume) {
    return ExecutionRequest.builder()
            .prompt("hi")
            .workingDirectory(Path.of("/work"))
            .resumeSessionId(resume)
            .executionId("exec-1")
            .ownerKey(owner);
  }
}
