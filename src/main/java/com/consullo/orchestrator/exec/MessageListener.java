package com.consullo.orchestrator.exec;

import com.consullo.orchestrator.stream.Message;

/**
 * Receives decoded messages for one execution, in emission order.
 *
 * <p>Exceptions thrown by a listener are logged and otherwise ignored.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface MessageListener {

  MessageListener NONE = message -> {
  };

  void onMessage(Message message) throws Exception;
}
