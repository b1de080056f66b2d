package com.gentoro.urltree.openapi;

import com.gentoro.urltree.exception.ValidationException;
import com.gentoro.urltree.tree.UrlTreeNode;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds {@link UrlTreeNode} trees from the paths of OpenAPI documents. */
public final class OpenApiUrlTrees {
  private static final org.slf4j.Logger log =
      com.gentoro.urltree.logging.LoggingService.getLogger(OpenApiUrlTrees.class);

  private OpenApiUrlTrees() {}

  /**
   * Creates a tree from the paths of an OpenAPI document.
   *
   * @param doc the OpenAPI document
   * @param label name tag for the nodes created from {@code doc}
   * @return the root node of the created tree
   */
  public static UrlTreeNode create(OpenAPI doc, String label) {
    ValidationException.requireNonNull(doc, "doc");
    ValidationException.requireNonEmpty(label, "label");

    UrlTreeNode root = UrlTreeNode.create();
    attach(root, doc, label);
    return root;
  }

  /**
   * Appends the paths of an OpenAPI document to an existing tree.
   *
   * @param root node the document paths are attached under
   * @param doc the OpenAPI document
   * @param label name tag for the nodes created from {@code doc}
   */
  public static void attach(UrlTreeNode root, OpenAPI doc, String label) {
    ValidationException.requireNonNull(root, "root");
    ValidationException.requireNonNull(doc, "doc");
    ValidationException.requireNonEmpty(label, "label");

    if (doc.getPaths() == null) {
      log.debug("Document labelled '{}' has no paths", label);
      return;
    }
    root.attachAll(toPathOperations(doc.getPaths()), label);
  }

  static Map<String, OpenApiPathOperations> toPathOperations(Map<String, PathItem> paths) {
    Map<String, OpenApiPathOperations> result = new LinkedHashMap<>();
    paths.forEach((path, item) -> result.put(path, OpenApiPathOperations.of(item)));
    return result;
  }
}
