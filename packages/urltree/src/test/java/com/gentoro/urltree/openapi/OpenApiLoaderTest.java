package com.gentoro.urltree.openapi;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.urltree.exception.ValidationException;
import io.swagger.v3.oas.models.OpenAPI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OpenApiLoaderTest {

  @TempDir Path tmp;

  @Test
  void loadsDocumentFromFile() throws Exception {
    Path spec = tmp.resolve("svc.yaml");
    Files.writeString(
        spec,
        "openapi: 3.0.0\n"
            + "info: {title: T, version: v}\n"
            + "paths:\n"
            + "  /ping:\n"
            + "    get:\n"
            + "      responses:\n"
            + "        '200': {description: ok}\n");

    OpenAPI doc = OpenApiLoader.load(spec.toString());

    assertNotNull(doc.getPaths().get("/ping"));
  }

  @Test
  void missingLocationFails() {
    ValidationException ex =
        assertThrows(
            ValidationException.class,
            () -> OpenApiLoader.load(tmp.resolve("missing.yaml").toString()));
    assertTrue(ex.getMessage().contains("missing.yaml"));
  }

  @Test
  void emptyLocationFails() {
    assertThrows(ValidationException.class, () -> OpenApiLoader.load(""));
  }
}
