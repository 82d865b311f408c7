package com.gentoro.kgbridge.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends KgBridgeException {
  public ConfigException(String message) {
    super(KgBridgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(KgBridgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
