package com.anyfile.progress.exception;

/** A blocked stream read was interrupted by the reading thread's owner. */
public class ProgressCancelledException extends ProgressException {
  public ProgressCancelledException(String message, Throwable cause) {
    super(ProgressErrorCode.CANCELLED, message, cause);
  }
}
