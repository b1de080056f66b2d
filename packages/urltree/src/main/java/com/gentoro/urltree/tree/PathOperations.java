package com.gentoro.urltree.tree;

import java.util.Set;

/**
 * Path-item metadata attached to a {@link UrlTreeNode} under a label.
 *
 * <p>The tree only needs to know which operations (typically HTTP verbs) a path item exposes;
 * everything else about the metadata is opaque to it.
 */
public interface PathOperations {

  /**
   * Keys of the operations available on the path, for example {@code GET} or {@code delete}.
   * Case is not significant for classification. A {@code null} result is treated as empty.
   */
  Set<String> getOperationKeys();
}
