package com.consullo.orchestrator.demo;

import com.consullo.orchestrator.config.OrchestratorSettings;
import com.consullo.orchestrator.config.SettingsLoader;
import com.consullo.orchestrator.driver.Backend;
import com.consullo.orchestrator.driver.ConversationRunner;
import com.consullo.orchestrator.driver.ExecutorFactory;
import com.consullo.orchestrator.driver.InMemoryConversationStore;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import com.consullo.orchestrator.stream.Message;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one prompt against a chosen backend and prints the decoded messages.
 *
 * <p>
 * Usage: {@code OrchestratorDemo <backend> <prompt> [workingDirectory] [model]}
 * where backend is one of {@code claude}, {@code codex},
 * {@code codex-app-server}, {@code claude-pty} or {@code codex-pty}.
 * </p>
 *
 * @since 1.0
 */
public final class OrchestratorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(OrchestratorDemo.class);

  private static final String OWNER_KEY = "demo:main";

  private OrchestratorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   */
  public static void main(final String[] args) {
    if (args.length < 2) {
      System.err.println("usage: OrchestratorDemo <backend> <prompt> [workingDirectory] [model]");
      System.exit(2);
    }
    final Backend backend = Backend.fromName(args[0]);
    final String prompt = args[1];
    final Path workDir = args.length > 2
            ? Path.of(args[2]).toAbsolutePath().normalize()
            : Path.of(".").toAbsolutePath().normalize();
    final String model = args.length > 3 ? args[3] : null;

    final OrchestratorSettings settings = SettingsLoader.load();
    final ExecutionResult result;
    try (final ExecutorFactory factory = new ExecutorFactory(settings)) {
      final ConversationRunner runner = new ConversationRunner(factory.create(backend), new InMemoryConversationStore());
      LOGGER.info("Running {} in {}", backend, workDir);
      result = runner.run(OWNER_KEY, prompt, workDir, model, printer());
    }

    System.out.println("=== Result ===");
    System.out.println("success: " + result.isSuccess());
    if (result.getExternalSessionId() != null) {
      System.out.println("session: " + result.getExternalSessionId());
    }
    if (result.getError() != null) {
      System.out.println("error: " + result.getError());
    }
    System.out.println(result.getText());
    System.exit(result.isSuccess() ? 0 : 1);
  }

  private static MessageListener printer() {
    return message -> {
      switch (message.kind()) {
        case ASSISTANT:
          System.out.println(((Message.Assistant) message).text());
          break;
        case TOOL_CALL:
          System.out.println("[tool] " + ((Message.ToolCall) message).activity().name());
          break;
        case TOOL_RESULT:
          System.out.println("[done] " + ((Message.ToolResult) message).activity().name());
          break;
        case ERROR:
          System.out.println("[error] " + ((Message.Error) message).text());
          break;
        default:
          break;
      }
    };
  }
}
