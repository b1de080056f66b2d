package com.gentoro.urltree.exception;

import java.util.Map;

/** A label is already bound to path-item metadata at the terminal node of an inserted path. */
public class DuplicateLabelException extends UrlTreeException {
  private final String label;
  private final String path;

  public DuplicateLabelException(String label, String path) {
    super(
        UrlTreeErrorCode.ALREADY_EXISTS,
        "A duplicate label already exists for this node: " + label,
        Map.of("label", label, "path", path));
    this.label = label;
    this.path = path;
  }

  public String getLabel() {
    return label;
  }

  /** Internal tree path of the node that already holds the label. */
  public String getPath() {
    return path;
  }
}
