package com.gentoro.urltree.openapi;

import com.gentoro.urltree.exception.ValidationException;
import com.gentoro.urltree.tree.PathOperations;
import io.swagger.v3.oas.models.PathItem;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Exposes the HTTP methods of a swagger {@link PathItem} as operation keys. */
public final class OpenApiPathOperations implements PathOperations {
  private final PathItem pathItem;

  private OpenApiPathOperations(PathItem pathItem) {
    this.pathItem = pathItem;
  }

  public static OpenApiPathOperations of(PathItem pathItem) {
    return new OpenApiPathOperations(ValidationException.requireNonNull(pathItem, "pathItem"));
  }

  public PathItem getPathItem() {
    return pathItem;
  }

  @Override
  public Set<String> getOperationKeys() {
    Set<String> keys = new LinkedHashSet<>();
    for (PathItem.HttpMethod method : pathItem.readOperationsMap().keySet()) {
      keys.add(method.name());
    }
    return Collections.unmodifiableSet(keys);
  }

  @Override
  public String toString() {
    return "OpenApiPathOperations" + getOperationKeys();
  }
}
