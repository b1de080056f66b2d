package com.gentoro.urltree;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.urltree.exception.ValidationException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("export", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertTrue(params.getOptionalParameter("output").isEmpty());
  }

  @Test
  void parsesNameValuePairs() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config-file", "conf/app.yaml", "--output", "tree.mmd", "stray"});

    assertEquals("conf/app.yaml", params.configFile());
    assertEquals("tree.mmd", params.getOptionalParameter("output").orElseThrow());
  }

  @Test
  void flagWithoutValueDoesNotSwallowNextFlag() {
    StartupParameters params =
        new StartupParameters(new String[] {"--verbose", "--mode", "help"});

    assertTrue(params.isParameterPresent("verbose"));
    assertEquals("help", params.mode());
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "serve"}));
  }

  @Test
  void rejectsBlankConfigFile() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--config-file", " "}));
  }
}
