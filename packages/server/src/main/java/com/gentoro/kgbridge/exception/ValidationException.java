package com.gentoro.kgbridge.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends KgBridgeException {
  public ValidationException(String message) {
    super(KgBridgeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(KgBridgeErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
