package com.gentoro.kgbridge.exception;

import java.util.Map;

/**
 * The export document is not well-formed JSON or lacks a structurally required field. Raised before
 * any store operation is attempted.
 */
public class MalformedExportException extends KgBridgeException {
  public MalformedExportException(String message) {
    super(KgBridgeErrorCode.MALFORMED_EXPORT, message);
  }

  public MalformedExportException(String message, Throwable cause) {
    super(KgBridgeErrorCode.MALFORMED_EXPORT, message, cause);
  }

  public MalformedExportException(String message, Map<String, ?> context) {
    super(KgBridgeErrorCode.MALFORMED_EXPORT, message, context);
  }
}
