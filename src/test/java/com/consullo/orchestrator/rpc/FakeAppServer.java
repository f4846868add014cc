package com.consullo.orchestrator.rpc;

import com.consullo.orchestrator.exec.FakeProcess;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Scripted app-server: answers the handshake, then plays its turn script.
 * A server request in the script pauses playback until the client answers it.
 *
 * @since 1.0
 */
final class FakeAppServer implements Consumer<String> {

  private final ObjectMapper mapper = new ObjectMapper();
  private final List<JsonNode> received = new CopyOnWriteArrayList<>();
  private final Deque<String> script = new ArrayDeque<>();
  private final FakeProcess process;

  private final Deque<String> beforeThreadResponse = new ArrayDeque<>();
  private String earlyThreadId;
  private boolean resumeMissing;
  private boolean exitAfterScript;
  private long awaitingId = -1L;

  FakeAppServer() {
    this.process = new FakeProcess(this);
  }

  FakeProcess process() {
    return process;
  }

  FakeAppServer resumeMissing() {
    this.resumeMissing = true;
    return this;
  }

  /**
   * Sends {@code line} after thread/start arrives but before answering it.
   */
  FakeAppServer beforeThreadResponse(final String line) {
    beforeThreadResponse.add(line);
    return this;
  }

  /**
   * Answers the next request id (thread/start) ahead of the initialize
   * response, and leaves the later thread/start unanswered.
   */
  FakeAppServer answerThreadStartEarly(final String threadId) {
    this.earlyThreadId = threadId;
    return this;
  }

  FakeAppServer exitAfterScript() {
    this.exitAfterScript = true;
    return this;
  }

  FakeAppServer then(final String line) {
    script.add(line);
    return this;
  }

  FakeAppServer notification(final String method, final String params) {
    return then("{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\",\"params\":" + params + "}");
  }

  FakeAppServer request(final long id, final String method, final String params) {
    return then("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"" + method + "\",\"params\":" + params + "}");
  }

  FakeAppServer completeTurn() {
    return notification("turn/completed", "{\"turn\":{\"id\":\"turn-1\",\"status\":\"completed\"}}");
  }

  List<JsonNode> received() {
    return received;
  }

  List<String> receivedMethods() {
    final List<String> methods = new CopyOnWriteArrayList<>();
    for (JsonNode node : received) {
      if (node.has("method")) {
        methods.add(node.get("method").asText());
      }
    }
    return methods;
  }

  JsonNode receivedRequest(final String method) {
    for (JsonNode node : received) {
      if (method.equals(node.path("method").asText())) {
        return node;
      }
    }
    throw new AssertionError("no " + method + " received");
  }

  JsonNode responseTo(final long id) {
    for (JsonNode node : received) {
      if (!node.has("method") && node.path("id").asLong(-2L) == id) {
        return node;
      }
    }
    throw new AssertionError("no response to " + id);
  }

  @Override
  public void accept(final String line) {
    final JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("client wrote invalid JSON: " + line, e);
    }
    received.add(node);
    if (!node.has("method")) {
      if (node.path("id").asLong(-2L) == awaitingId) {
        awaitingId = -1L;
        play();
      }
      return;
    }
    if (!node.has("id")) {
      return;
    }
    final long id = node.get("id").asLong();
    switch (node.get("method").asText()) {
      case "initialize":
        if (earlyThreadId != null) {
          respond(id + 1, thread(earlyThreadId));
        }
        respond(id, mapper.createObjectNode().put("userAgent", "fake/1.0"));
        break;
      case "thread/start":
        while (!beforeThreadResponse.isEmpty()) {
          process.emit(beforeThreadResponse.poll());
        }
        if (earlyThreadId == null) {
          respond(id, thread("thr-1"));
        }
        break;
      case "thread/resume":
        if (resumeMissing) {
          process.emit("{\"jsonrpc\":\"2.0\",\"id\":" + id
                  + ",\"error\":{\"code\":-32600,\"message\":\"thread not found: "
                  + node.path("params").path("threadId").asText() + "\"}}");
        } else {
          respond(id, thread(node.path("params").path("threadId").asText()));
        }
        break;
      case "turn/start":
        final ObjectNode turn = mapper.createObjectNode();
        turn.putObject("turn").put("id", "turn-1").put("status", "inProgress");
        respond(id, turn);
        play();
        break;
      default:
        process.emit("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"error\":{\"code\":-32601,\"message\":\"unknown\"}}");
    }
  }

  private void play() {
    while (!script.isEmpty()) {
      final String line = script.poll();
      process.emit(line);
      final JsonNode node = parse(line);
      if (node.has("method") && node.has("id")) {
        awaitingId = node.get("id").asLong();
        return;
      }
    }
    if (exitAfterScript) {
      process.exit(0);
    }
  }

  private ObjectNode thread(final String id) {
    final ObjectNode result = mapper.createObjectNode();
    result.putObject("thread").put("id", id);
    return result;
  }

  private void respond(final long id, final JsonNode result) {
    final ObjectNode response = mapper.createObjectNode();
    response.put("jsonrpc", "2.0");
    response.put("id", id);
    response.set("result", result);
    process.emit(response.toString());
  }

  private JsonNode parse(final String line) {
    try {
      return mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }
}
