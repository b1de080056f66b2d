package com.gentoro.urltree.exception;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfLibraryExceptions() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new DuplicateLabelException("v1", "\\a"));

    assertEquals("DuplicateLabelException", details.type);
    assertEquals(UrlTreeErrorCode.ALREADY_EXISTS, details.code);
    assertEquals("\\a", details.context.get("path"));
  }

  @Test
  void otherThrowablesAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(UrlTreeErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
  }

  @Test
  void compactStackTraceHonoursFrameLimit() {
    String trace = ExceptionUtil.formatCompactStackTrace(new RuntimeException("x"), 2);

    assertEquals(1, trace.split(" > ").length - 1);
    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName()));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }
}
