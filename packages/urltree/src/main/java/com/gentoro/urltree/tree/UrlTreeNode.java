package com.gentoro.urltree.tree;

import com.gentoro.urltree.exception.DuplicateLabelException;
import com.gentoro.urltree.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A directory structure representing the paths of one or more API descriptions.
 *
 * <p>Every node stands for one segment of a URL path template. Paths sharing a prefix share
 * ancestry, so attaching {@code /a/b} and {@code /a/c} yields a single {@code a} node with two
 * children. Path-item metadata is recorded on the terminal node of each path under a caller
 * chosen label, which lets several sources be merged into the same tree and compared.
 *
 * <p>Instances are not thread-safe. Build the tree first, then read or export it.
 */
public class UrlTreeNode {
  private static final org.slf4j.Logger log =
      com.gentoro.urltree.logging.LoggingService.getLogger(UrlTreeNode.class);

  /** Segment of the root node. */
  public static final String ROOT_PATH_SEGMENT = "/";

  /** Separator used to assemble {@link #getPath()}, distinct from the URL separator. */
  public static final String PATH_SEPARATOR = "\\";

  private final String segment;
  private String path = "";
  private final Map<String, UrlTreeNode> children = new LinkedHashMap<>();
  private final Map<String, PathOperations> pathItems = new LinkedHashMap<>();
  private final Map<String, List<String>> additionalData = new LinkedHashMap<>();

  private UrlTreeNode(String segment) {
    this.segment = segment;
  }

  /**
   * Creates an empty tree.
   *
   * @return the root node
   */
  public static UrlTreeNode create() {
    return new UrlTreeNode(ROOT_PATH_SEGMENT);
  }

  /**
   * Creates a tree from an ordered mapping of path templates to path-item metadata.
   *
   * @param source path template to metadata, attached in iteration order
   * @param label name tag for the source
   * @return the root node of the created tree
   */
  public static UrlTreeNode create(Map<String, ? extends PathOperations> source, String label) {
    ValidationException.requireNonNull(source, "source");
    ValidationException.requireNonEmpty(label, "label");

    UrlTreeNode root = create();
    root.attachAll(source, label);
    return root;
  }

  /** The path component this node represents; {@code /} for the root. */
  public String getSegment() {
    return segment;
  }

  /** Relative path of this node from the root, segments joined with {@link #PATH_SEPARATOR}. */
  public String getPath() {
    return path;
  }

  /** Child nodes keyed by segment, in creation order. */
  public Map<String, UrlTreeNode> getChildren() {
    return Collections.unmodifiableMap(children);
  }

  /** Path-item metadata keyed by label, describing the operations available on this node. */
  public Map<String, PathOperations> getPathItems() {
    return Collections.unmodifiableMap(pathItems);
  }

  /** Auxiliary key/value information about this node. */
  public Map<String, List<String>> getAdditionalData() {
    return Collections.unmodifiableMap(additionalData);
  }

  /** Whether this node's segment is a path parameter such as {@code {id}}. */
  public boolean isParameter() {
    return segment.startsWith("{");
  }

  /**
   * Whether the metadata stored under {@code label} exposes at least one operation.
   *
   * @param label key of the target metadata in {@link #getPathItems()}
   */
  public boolean hasOperations(String label) {
    ValidationException.requireNonEmpty(label, "label");

    PathOperations pathItem = pathItems.get(label);
    if (pathItem == null) {
      return false;
    }
    Set<String> keys = pathItem.getOperationKeys();
    return keys != null && !keys.isEmpty();
  }

  /**
   * Attaches every path of {@code pathsByKey} under {@code label}.
   *
   * <p>Insertion stops at the first failing path; paths attached before it stay in the tree.
   *
   * @param pathsByKey path template to metadata, attached in iteration order
   * @param label name tag for the source
   */
  public void attachAll(Map<String, ? extends PathOperations> pathsByKey, String label) {
    ValidationException.requireNonNull(pathsByKey, "pathsByKey");
    ValidationException.requireNonEmpty(label, "label");

    for (Map.Entry<String, ? extends PathOperations> entry : pathsByKey.entrySet()) {
      attach(entry.getKey(), entry.getValue(), label);
    }
    log.debug("Attached {} path(s) under label '{}'", pathsByKey.size(), label);
  }

  /**
   * Appends a path and its metadata to the tree rooted at this node.
   *
   * @param path a URL path template, e.g. {@code /users/{id}}
   * @param pathItem metadata describing the operations available on the path
   * @param label name tag for the source of the path
   * @return the terminal node of {@code path}
   * @throws DuplicateLabelException if the terminal node already holds metadata for {@code label}
   */
  public UrlTreeNode attach(String path, PathOperations pathItem, String label) {
    ValidationException.requireNonEmpty(label, "label");
    ValidationException.requireNonEmpty(path, "path");
    ValidationException.requireNonNull(pathItem, "pathItem");

    String[] segments = splitSegments(path);

    UrlTreeNode current = this;
    String currentPath = "";
    for (String segment : segments) {
      if (segment.isEmpty()) {
        break;
      }
      currentPath = currentPath + PATH_SEPARATOR + segment;
      UrlTreeNode child = current.children.get(segment);
      if (child == null) {
        child = new UrlTreeNode(segment);
        child.path = currentPath;
        current.children.put(segment, child);
      }
      current = child;
    }

    if (current.pathItems.containsKey(label)) {
      throw new DuplicateLabelException(label, currentPath);
    }
    current.path = currentPath;
    current.pathItems.put(label, pathItem);
    return current;
  }

  /**
   * Looks up the node reached by following {@code path} from this node without creating any node.
   *
   * @param path a URL path template; {@code /} or an empty string resolves to this node
   */
  public Optional<UrlTreeNode> find(String path) {
    ValidationException.requireNonNull(path, "path");

    UrlTreeNode current = this;
    for (String segment : splitSegments(path)) {
      if (segment.isEmpty()) {
        break;
      }
      current = current.children.get(segment);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /**
   * Adds entries to {@link #getAdditionalData()}. Values of existing keys are replaced, not
   * appended to.
   *
   * @param additionalData key/value pairs describing this node
   */
  public void addAdditionalData(Map<String, List<String>> additionalData) {
    ValidationException.requireNonNull(additionalData, "additionalData");

    this.additionalData.putAll(additionalData);
  }

  private static String[] splitSegments(String path) {
    String relative = path.startsWith(ROOT_PATH_SEGMENT) ? path.substring(1) : path;
    return relative.split("/", -1);
  }

  @Override
  public String toString() {
    return "UrlTreeNode{segment=" + segment + ", path=" + path + ", labels=" + pathItems.keySet()
        + ", children=" + children.size() + '}';
  }
}
