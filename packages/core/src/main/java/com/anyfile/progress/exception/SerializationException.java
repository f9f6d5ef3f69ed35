package com.anyfile.progress.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends ProgressException {
  public SerializationException(String message, Throwable cause) {
    super(ProgressErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
