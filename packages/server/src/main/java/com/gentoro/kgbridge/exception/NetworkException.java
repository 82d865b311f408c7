package com.gentoro.kgbridge.exception;

/** Network-level communication error (HTTP listener, sockets). */
public class NetworkException extends KgBridgeException {
  public NetworkException(String message) {
    super(KgBridgeErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(KgBridgeErrorCode.NETWORK_ERROR, message, cause);
  }
}
