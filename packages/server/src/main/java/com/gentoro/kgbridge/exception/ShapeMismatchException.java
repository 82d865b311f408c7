package com.gentoro.kgbridge.exception;

import java.util.Map;

/**
 * Buffer dimensions of a tensor-mode export are inconsistent: ragged rows, an edge feature buffer
 * whose row count differs from the edge count, or an edge index outside its node group.
 */
public class ShapeMismatchException extends KgBridgeException {
  public ShapeMismatchException(String message) {
    super(KgBridgeErrorCode.SHAPE_MISMATCH, message);
  }

  public ShapeMismatchException(String message, Map<String, ?> context) {
    super(KgBridgeErrorCode.SHAPE_MISMATCH, message, context);
  }
}
