package com.anyfile.progress.exception;

import java.util.Map;

/** Operation not allowed in the emitter's current state. */
public class StateException extends ProgressException {
  public StateException(String message) {
    super(ProgressErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Map<String, ?> context) {
    super(ProgressErrorCode.FAILED_PRECONDITION, message, context);
  }
}
