package com.gentoro.urltree.exception;

/** Configuration or environment related problem detected at startup. */
public class ConfigException extends UrlTreeException {
  public ConfigException(String message) {
    super(UrlTreeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(UrlTreeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
