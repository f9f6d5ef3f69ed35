package com.anyfile.progress.exception;

/** Configuration problem detected while loading or reading progress settings. */
public class ConfigException extends ProgressException {
  public ConfigException(String message) {
    super(ProgressErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ProgressErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
