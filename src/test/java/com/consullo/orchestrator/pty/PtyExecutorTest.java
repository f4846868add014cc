package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.config.CodexSettings;
import com.consullo.orchestrator.config.PtySettings;
import com.consullo.orchestrator.exec.ExecutionRequest;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import com.consullo.orchestrator.exec.ProcessRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PtyExecutor} over a real pool of in-memory terminals.
 *
 * @since 1.0
 */
public class PtyExecutorTest {

  private static final PtySettings SETTINGS = PtySessionTest.settings(Duration.ofSeconds(2), Duration.ofSeconds(5));

  private final List<FakePtyController> spawned = new CopyOnWriteArrayList<>();
  private final ProcessRegistry registry = new ProcessRegistry();
  private final PtyPool pool = new PtyPool(SETTINGS, config -> {
    final FakePtyController pty = new FakePtyController().exitOn("/exit");
    pty.print("codex> ");
    pty.onInput(text -> {
      if (text.endsWith("\r") && !text.startsWith("wait")) {
        pty.print("{\"type\":\"item.completed\",\"item\":{\"id\":\"i\",\"type\":\"agent_message\",\"text\":\"re: "
                + text.strip() + "\"}}\n");
        pty.print("{\"type\":\"turn.completed\"}\n");
      }
    });
    spawned.add(pty);
    return new PtySession(config, SETTINGS, pty.factory(), 4096, Clock.systemUTC());
  }, Clock.systemUTC());
  private final PtyExecutor executor = new PtyExecutor(pool, PtyCommands.codex(CodexSettings.defaults()), registry);

  @AfterEach
  void tearDown() {
    pool.close();
  }

  @Test
  @DisplayName("Should keep one CLI process per owner across turns")
  void execute_SameOwner_ReusesSession() {
    final ExecutionResult first = executor.execute(request("exec-1", "chan:t1", "one"), MessageListener.NONE);
    final ExecutionResult second = executor.execute(request("exec-2", "chan:t1", "two"), MessageListener.NONE);

    assertThat(first.getText()).isEqualTo("re: one");
    assertThat(second.getText()).isEqualTo("re: two");
    assertThat(spawned).hasSize(1);
    assertThat(pool.size()).isEqualTo(1);
    assertThat(registry.size()).isZero();
  }

  @Test
  @DisplayName("Should give different owners their own sessions")
  void execute_DifferentOwners_SeparateSessions() {
    executor.execute(request("exec-1", "chan:t1", "one"), MessageListener.NONE);
    executor.execute(request("exec-2", "chan:t2", "two"), MessageListener.NONE);

    assertThat(spawned).hasSize(2);
    assertThat(pool.describe()).extracting(SessionInfo::key).containsExactlyInAnyOrder("chan:t1", "chan:t2");
  }

  @Test
  @DisplayName("Should cancel a running turn through the registry")
  void cancel_RunningTurn_ReturnsCancelled() throws Exception {
    final CompletableFuture<ExecutionResult> running = CompletableFuture.supplyAsync(
            () -> executor.execute(request("exec-9", "chan:t1", "wait for me"), MessageListener.NONE));
    awaitTyping(1);

    assertThat(executor.cancelByOwner("chan:t1")).isEqualTo(1);
    final ExecutionResult result = running.get(3, TimeUnit.SECONDS);

    assertThat(result.wasCancelled()).isTrue();
    assertThat(spawned.get(0).typed()).contains("\u0003");
  }

  @Test
  @DisplayName("Should pass pool exhaustion to the caller")
  void execute_PoolFull_Throws() throws Exception {
    final CompletableFuture<ExecutionResult> a = CompletableFuture.supplyAsync(
            () -> executor.execute(request("exec-a", "chan:a", "wait a"), MessageListener.NONE));
    final CompletableFuture<ExecutionResult> b = CompletableFuture.supplyAsync(
            () -> executor.execute(request("exec-b", "chan:b", "wait b"), MessageListener.NONE));
    awaitTyping(2);

    assertThatThrownBy(() -> executor.execute(request("exec-c", "chan:c", "hi"), MessageListener.NONE))
            .isInstanceOf(PoolExhaustedException.class);

    executor.cancel("exec-a");
    executor.cancel("exec-b");
    assertThat(a.get(3, TimeUnit.SECONDS).wasCancelled()).isTrue();
    assertThat(b.get(3, TimeUnit.SECONDS).wasCancelled()).isTrue();
  }

  /** Waits until {@code sessions} CLIs have received a "wait" prompt. */
  private void awaitTyping(final int sessions) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 3000;
    while (System.currentTimeMillis() < deadline) {
      final long typing = spawned.stream()
              .filter(pty -> pty.typed().stream().anyMatch(text -> text.startsWith("wait")))
              .count();
      if (typing >= sessions) {
        return;
      }
      Thread.sleep(10);
    }
  }

  private static ExecutionRequest request(final String id, final String owner, final String prompt) {
    return ExecutionRequest.builder()
            .prompt(prompt)
            .workingDirectory(Path.of("."))
            .executionId(id)
            .ownerKey(owner)
            .build();
  }
}
