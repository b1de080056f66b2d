package com.gentoro.urltree.openapi;

import com.gentoro.urltree.exception.ValidationException;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.List;

/** Reads OpenAPI documents with swagger-parser. */
public class OpenApiLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.urltree.logging.LoggingService.getLogger(OpenApiLoader.class);

  /**
   * Load a document from a file path or URL.
   *
   * @throws ValidationException when the location cannot be read or parsed
   */
  public static OpenAPI load(String location) {
    ValidationException.requireNonEmpty(location, "location");

    ParseOptions options = new ParseOptions();
    options.setResolve(false);
    SwaggerParseResult result = new OpenAPIV3Parser().readLocation(location, null, options);
    List<String> messages = result == null ? List.of() : result.getMessages();
    if (result == null || result.getOpenAPI() == null) {
      throw new ValidationException(
          "Unable to read OpenAPI document at %s: %s".formatted(location, messages));
    }
    if (messages != null && !messages.isEmpty()) {
      log.warn(
          "OpenAPI document {} parsed with {} message(s): {}", location, messages.size(), messages);
    }
    return result.getOpenAPI();
  }
}
