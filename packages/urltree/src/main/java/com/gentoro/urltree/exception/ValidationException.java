package com.gentoro.urltree.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends UrlTreeException {
  public ValidationException(String message) {
    super(UrlTreeErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(UrlTreeErrorCode.INVALID_ARGUMENT, message, cause);
  }

  /**
   * Fails when {@code value} is {@code null}.
   *
   * @return the checked value
   */
  public static <T> T requireNonNull(T value, String name) {
    if (value == null) {
      throw new ValidationException("Argument '%s' must not be null".formatted(name));
    }
    return value;
  }

  /**
   * Fails when {@code value} is {@code null} or empty.
   *
   * @return the checked value
   */
  public static String requireNonEmpty(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new ValidationException("Argument '%s' must not be null or empty".formatted(name));
    }
    return value;
  }
}
