package com.gentoro.kgbridge.exception;

import java.util.Map;

/** The graph store is unreachable or rejected the supplied credentials. */
public class StoreConnectionException extends KgBridgeException {
  public StoreConnectionException(String message, Throwable cause) {
    super(KgBridgeErrorCode.STORE_UNAVAILABLE, message, cause);
  }

  public StoreConnectionException(String message, Map<String, ?> context, Throwable cause) {
    super(KgBridgeErrorCode.STORE_UNAVAILABLE, message, context, cause);
  }
}
