package com.gentoro.kgbridge.exception;

/** File system level failure while reading exports or resources. */
public class IoException extends KgBridgeException {
  public IoException(String message) {
    super(KgBridgeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(KgBridgeErrorCode.IO_ERROR, message, cause);
  }
}
