package com.consullo.orchestrator.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 message shapes exchanged with the app-server over stdio.
 *
 * @since 1.0
 */
public final class JsonRpcMessage {

  public static final String VERSION = "2.0";

  // Standard error codes
  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;

  public enum Type {
    REQUEST,
    RESPONSE,
    NOTIFICATION,
    INVALID
  }

  private JsonRpcMessage() {
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Request(String jsonrpc, long id, String method, JsonNode params) {

    public static Request create(final long id, final String method, final JsonNode params) {
      return new Request(VERSION, id, method, params);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Notification(String jsonrpc, String method, JsonNode params) {

    public static Notification create(final String method, final JsonNode params) {
      return new Notification(VERSION, method, params);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Response(String jsonrpc, JsonNode id, JsonNode result, RpcError error) {

    public static Response success(final JsonNode id, final JsonNode result) {
      return new Response(VERSION, id, result, null);
    }

    public static Response error(final JsonNode id, final int code, final String message) {
      return new Response(VERSION, id, null, new RpcError(code, message, null));
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record RpcError(int code, String message, JsonNode data) {
  }

  /**
   * Classifies a decoded JSON value.
   */
  public static Type classify(final JsonNode node) {
    if (node == null || !node.isObject()) {
      return Type.INVALID;
    }
    final boolean hasId = node.hasNonNull("id");
    if (node.hasNonNull("method")) {
      return hasId ? Type.REQUEST : Type.NOTIFICATION;
    }
    if (hasId && (node.has("result") || node.has("error"))) {
      return Type.RESPONSE;
    }
    return Type.INVALID;
  }
}
