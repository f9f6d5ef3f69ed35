package com.anyfile.progress.exception;

import java.util.Map;

/** Out-of-range input: negative counts, current above total, oversized label, bad weight. */
public class ValidationException extends ProgressException {
  public ValidationException(String message) {
    super(ProgressErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(ProgressErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Map<String, ?> context, Throwable cause) {
    super(ProgressErrorCode.INVALID_ARGUMENT, message, context, cause);
  }
}
