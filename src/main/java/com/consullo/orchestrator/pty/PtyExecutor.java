package com.consullo.orchestrator.pty;

import com.consullo.orchestrator.exec.AgentExecutor;
import com.consullo.orchestrator.exec.ExecutionRequest;
import com.consullo.orchestrator.exec.ExecutionResult;
import com.consullo.orchestrator.exec.MessageListener;
import com.consullo.orchestrator.exec.ProcessRegistry;
import java.util.function.Function;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs turns on pooled PTY sessions; the request's owner key is the pool key,
 * so consecutive turns of a conversation share one CLI process.
 *
 * <p>{@link PoolExhaustedException} and {@link SessionStartException} reach the
 * caller unchanged.
 *
 * @since 1.0
 */
public final class PtyExecutor implements AgentExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyExecutor.class);

  private final PtyPool pool;
  private final Function<ExecutionRequest, PtySessionConfig> sessionConfigs;
  private final ProcessRegistry registry;

  public PtyExecutor(
          final PtyPool pool,
          final Function<ExecutionRequest, PtySessionConfig> sessionConfigs,
          final ProcessRegistry registry) {
    Validate.notNull(pool, "pool must not be null");
    Validate.notNull(sessionConfigs, "sessionConfigs must not be null");
    Validate.notNull(registry, "registry must not be null");
    this.pool = pool;
    this.sessionConfigs = sessionConfigs;
    this.registry = registry;
  }

  @Override
  public ExecutionResult execute(final ExecutionRequest request, final MessageListener listener) {
    Validate.notNull(request, "request must not be null");
    Validate.notNull(listener, "listener must not be null");

    final PtySession session = pool.getOrCreate(sessionConfigs.apply(request));
    registry.register(request.executionId(), request.ownerKey(), session::cancelCurrent);
    try {
      LOGGER.debug("Execution {} sending to PTY session {}", request.executionId(), session.key());
      return session.send(request.prompt(), listener);
    } finally {
      registry.deregister(request.executionId());
    }
  }

  @Override
  public boolean cancel(final String executionId) {
    return registry.cancel(executionId);
  }

  @Override
  public int cancelByOwner(final String ownerKey) {
    return registry.cancelByOwner(ownerKey);
  }

  public PtyPool pool() {
    return pool;
  }
}
