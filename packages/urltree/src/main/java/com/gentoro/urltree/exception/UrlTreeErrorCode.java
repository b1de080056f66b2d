package com.gentoro.urltree.exception;

/**
 * Canonical error codes for the URL tree library. Codes are stable and suitable for logs and
 * callers that need to branch on the failure kind rather than on the exception message.
 */
public enum UrlTreeErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  ALREADY_EXISTS,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
}
