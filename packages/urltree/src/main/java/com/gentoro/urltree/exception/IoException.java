package com.gentoro.urltree.exception;

/** I/O operation failed (filesystem, classpath, output streams). */
public class IoException extends UrlTreeException {
  public IoException(String message) {
    super(UrlTreeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(UrlTreeErrorCode.IO_ERROR, message, cause);
  }
}
