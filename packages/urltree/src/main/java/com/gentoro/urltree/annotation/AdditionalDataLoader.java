package com.gentoro.urltree.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.gentoro.urltree.exception.IoException;
import com.gentoro.urltree.exception.SerializationException;
import com.gentoro.urltree.exception.ValidationException;
import com.gentoro.urltree.tree.UrlTreeNode;
import com.gentoro.urltree.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads node annotations from a YAML or JSON file and merges them into a tree.
 *
 * <p>Expected shape, keyed by URL path template:
 *
 * <pre>
 * /users/{id}:
 *   owner: [identity-team]
 *   tags: [pii, internal]
 * </pre>
 *
 * A single string value is accepted in place of a one-element list.
 */
public class AdditionalDataLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.urltree.logging.LoggingService.getLogger(AdditionalDataLoader.class);

  private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, List<String>>>>
      ANNOTATIONS_TYPE = new TypeReference<>() {};

  /**
   * Read annotations from {@code file}; {@code .json} files are read as JSON, anything else as
   * YAML.
   */
  public Map<String, Map<String, List<String>>> load(Path file) {
    ValidationException.requireNonNull(file, "file");

    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read annotations file: " + file, e);
    }
    return parse(content, file.getFileName().toString());
  }

  Map<String, Map<String, List<String>>> parse(String content, String fileName) {
    if (content.isBlank()) {
      return new LinkedHashMap<>();
    }
    ObjectReader reader =
        JacksonUtility.mapperFor(fileName)
            .readerFor(ANNOTATIONS_TYPE)
            .with(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    try {
      Map<String, Map<String, List<String>>> annotations = reader.readValue(content);
      return annotations == null ? new LinkedHashMap<>() : annotations;
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed annotations in " + fileName, e);
    }
  }

  /**
   * Merge every entry into the node its path resolves to. Paths absent from the tree are skipped.
   *
   * @return number of nodes that received annotations
   */
  public int apply(UrlTreeNode root, Map<String, Map<String, List<String>>> annotations) {
    ValidationException.requireNonNull(root, "root");
    ValidationException.requireNonNull(annotations, "annotations");

    int applied = 0;
    for (Map.Entry<String, Map<String, List<String>>> entry : annotations.entrySet()) {
      Optional<UrlTreeNode> node = root.find(entry.getKey());
      if (node.isEmpty()) {
        log.warn("Skipping annotations for unknown path {}", entry.getKey());
        continue;
      }
      if (entry.getValue() == null) continue;
      node.get().addAdditionalData(entry.getValue());
      applied++;
    }
    log.debug("Annotated {} of {} path(s)", applied, annotations.size());
    return applied;
  }
}
