package com.gentoro.gae.exception;

/** Invalid analysis request or missing configuration. Raised before any remote call. */
public class ConfigException extends GaeException {
  public ConfigException(String message) {
    super(GaeErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GaeErrorCode.CONFIG_ERROR, message, cause);
  }
}
