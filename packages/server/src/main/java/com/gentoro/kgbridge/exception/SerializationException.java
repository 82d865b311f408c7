package com.gentoro.kgbridge.exception;

/** JSON/YAML serialization or deserialization failure. */
public class SerializationException extends KgBridgeException {
  public SerializationException(String message) {
    super(KgBridgeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(KgBridgeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
