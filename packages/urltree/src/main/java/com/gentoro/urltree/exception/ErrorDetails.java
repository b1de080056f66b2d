package com.gentoro.urltree.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final UrlTreeErrorCode code;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      UrlTreeErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp;
  }

  @Override
  public String toString() {
    return type
        + " ["
        + code
        + "] "
        + message
        + (context == null || context.isEmpty() ? "" : " " + context);
  }
}
