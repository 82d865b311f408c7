package com.gentoro.kgbridge.exception;

/**
 * Canonical error codes for kgbridge. Codes are stable and suitable for logs and for the MCP error
 * results returned to agents. Prefer the most specific code that reflects the failure origin.
 */
public enum KgBridgeErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  MALFORMED_EXPORT,
  STORE_UNAVAILABLE,
  SHAPE_MISMATCH,
  UNSUPPORTED_FEATURE,
}
