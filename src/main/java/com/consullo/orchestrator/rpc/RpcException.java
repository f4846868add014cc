package com.consullo.orchestrator.rpc;

/**
 * A JSON-RPC call that failed: an error response, a broken channel or a
 * timeout.
 *
 * @since 1.0
 */
public class RpcException extends Exception {

  private static final long serialVersionUID = 1L;

  private final Integer code;

  public RpcException(final String message) {
    super(message);
    this.code = null;
  }

  public RpcException(final String message, final Integer code) {
    super(message);
    this.code = code;
  }

  public RpcException(final String message, final Throwable cause) {
    super(message, cause);
    this.code = null;
  }

  /**
   * Returns the JSON-RPC error code, or null when the failure was not an error
   * response.
   */
  public Integer getCode() {
    return code;
  }
}
