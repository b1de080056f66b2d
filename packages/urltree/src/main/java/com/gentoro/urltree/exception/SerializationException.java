package com.gentoro.urltree.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends UrlTreeException {
  public SerializationException(String message) {
    super(UrlTreeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(UrlTreeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
