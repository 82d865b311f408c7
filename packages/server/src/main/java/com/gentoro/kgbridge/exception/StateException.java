package com.gentoro.kgbridge.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends KgBridgeException {
  public StateException(String message) {
    super(KgBridgeErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(KgBridgeErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
