package com.consullo.orchestrator.driver;

import com.consullo.orchestrator.config.OrchestratorSettings;
import com.consullo.orchestrator.exec.AgentExecutor;
import com.consullo.orchestrator.exec.ClaudeExecutor;
import com.consullo.orchestrator.exec.CodexExecutor;
import com.consullo.orchestrator.exec.ExecutionStateStore;
import com.consullo.orchestrator.exec.ProcessLauncher;
import com.consullo.orchestrator.exec.ProcessRegistry;
import com.consullo.orchestrator.pty.PtyCommands;
import com.consullo.orchestrator.pty.PtyExecutor;
import com.consullo.orchestrator.pty.PtyPool;
import com.consullo.orchestrator.pty.PtyProcessFactory;
import com.consullo.orchestrator.pty.PtySession;
import com.consullo.orchestrator.rpc.ApprovalCallback;
import com.consullo.orchestrator.rpc.RpcBridge;
import com.consullo.orchestrator.rpc.UserInputCallback;
import java.time.Clock;
import java.util.function.Predicate;
import org.apache.commons.lang3.Validate;

/**
 * Wires executors from one {@link OrchestratorSettings}. All executors built by
 * one factory share its {@link ProcessRegistry}, so any of them can cancel by
 * owner; PTY backends share one lazily created pool.
 *
 * @since 1.0
 */
public final class ExecutorFactory implements AutoCloseable {

  /** Plan classifier that never treats free text as a plan. */
  public static final Predicate<String> NO_PLAN_TEXT = text -> false;

  private final OrchestratorSettings settings;
  private final ProcessLauncher launcher;
  private final PtyProcessFactory ptyProcessFactory;
  private final Predicate<String> planTextClassifier;
  private final UserInputCallback userInputCallback;
  private final ApprovalCallback approvalCallback;
  private final Clock clock;
  private final ProcessRegistry registry = new ProcessRegistry();
  private final ExecutionStateStore states = new ExecutionStateStore();

  private PtyPool pool;

  public ExecutorFactory(final OrchestratorSettings settings) {
    this(settings, ProcessLauncher.system(null), PtyProcessFactory.PTY4J, NO_PLAN_TEXT, null, null,
            Clock.systemUTC());
  }

  /**
   * @param userInputCallback RPC user-input handler (may be null)
   * @param approvalCallback RPC approval handler (may be null)
   */
  public ExecutorFactory(
          final OrchestratorSettings settings,
          final ProcessLauncher launcher,
          final PtyProcessFactory ptyProcessFactory,
          final Predicate<String> planTextClassifier,
          final UserInputCallback userInputCallback,
          final ApprovalCallback approvalCallback,
          final Clock clock) {
    Validate.notNull(settings, "settings must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(ptyProcessFactory, "ptyProcessFactory must not be null");
    Validate.notNull(planTextClassifier, "planTextClassifier must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.settings = settings;
    this.launcher = launcher;
    this.ptyProcessFactory = ptyProcessFactory;
    this.planTextClassifier = planTextClassifier;
    this.userInputCallback = userInputCallback;
    this.approvalCallback = approvalCallback;
    this.clock = clock;
  }

  public AgentExecutor create(final Backend backend) {
    Validate.notNull(backend, "backend must not be null");
    switch (backend) {
      case CLAUDE:
        return new ClaudeExecutor(settings.claude(), launcher, registry, states, settings.execution(),
                settings.decoderBufferChars(), planTextClassifier, clock);
      case CODEX:
        return new CodexExecutor(settings.codex(), launcher, registry, states, settings.execution(),
                settings.decoderBufferChars(), planTextClassifier, clock);
      case CODEX_APP_SERVER:
        return new RpcBridge(settings.codex(), launcher, registry, settings.execution(),
                settings.decoderBufferChars(), userInputCallback, approvalCallback, clock);
      case CLAUDE_PTY:
        return new PtyExecutor(pool(), PtyCommands.claude(settings.claude()), registry);
      case CODEX_PTY:
        return new PtyExecutor(pool(), PtyCommands.codex(settings.codex()), registry);
      default:
        throw new IllegalArgumentException("Unsupported backend " + backend);
    }
  }

  public ProcessRegistry registry() {
    return registry;
  }

  /**
   * Returns the shared PTY pool, creating it and starting its sweeper on first
   * use.
   */
  public synchronized PtyPool pool() {
    if (pool == null) {
      pool = new PtyPool(settings.pty(),
              config -> new PtySession(config, settings.pty(), ptyProcessFactory, settings.decoderBufferChars(), clock),
              clock);
      pool.startSweeper();
    }
    return pool;
  }

  @Override
  public synchronized void close() {
    if (pool != null) {
      pool.close();
      pool = null;
    }
  }
}
