package com.anyfile.progress.exception;

/**
 * Canonical error codes for the progress engine. Codes are stable and safe to use in logs and in
 * pipeline-level error handling.
 */
public enum ProgressErrorCode {
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  CANCELLED,
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
}
