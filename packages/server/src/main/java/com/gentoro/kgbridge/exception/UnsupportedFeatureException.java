package com.gentoro.kgbridge.exception;

/** Operation not supported by the selected backend. */
public class UnsupportedFeatureException extends KgBridgeException {
  public UnsupportedFeatureException(String message) {
    super(KgBridgeErrorCode.UNSUPPORTED_FEATURE, message);
  }

  public UnsupportedFeatureException(String message, Throwable cause) {
    super(KgBridgeErrorCode.UNSUPPORTED_FEATURE, message, cause);
  }
}
