package com.gentoro.urltree.mermaid;

import com.gentoro.urltree.exception.IoException;
import com.gentoro.urltree.exception.ValidationException;
import com.gentoro.urltree.tree.PathOperations;
import com.gentoro.urltree.tree.UrlTreeNode;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes a {@link UrlTreeNode} tree as a Mermaid flowchart.
 *
 * <p>The document starts with {@code graph LR} and the {@link MermaidColorScheme} class
 * definitions, followed by one edge per parent/child pair in pre-order and one {@code class}
 * statement per node. A node's class is the sorted, uppercased, underscore-joined set of
 * operation keys found across all labels at that node, or {@code OTHER} when it has none.
 *
 * <p>Lines are written to the target as they are produced; nothing is buffered here.
 */
public class MermaidExporter {
  private static final org.slf4j.Logger log =
      com.gentoro.urltree.logging.LoggingService.getLogger(MermaidExporter.class);

  static final String GRAPH_HEADER = "graph LR";
  static final String ROOT_NODE_ID = "/";

  /**
   * Write the tree rooted at {@code root} to {@code writer}. The writer is flushed but not closed.
   *
   * @throws IoException when the writer fails
   */
  public void write(UrlTreeNode root, Writer writer) {
    ValidationException.requireNonNull(root, "root");
    ValidationException.requireNonNull(writer, "writer");

    try {
      writeLine(writer, GRAPH_HEADER);
      for (MermaidColorScheme scheme : MermaidColorScheme.values()) {
        writeLine(writer, scheme.classDefinition());
      }
      int nodes = processNode(root, writer);
      writer.flush();
      log.debug("Exported {} node(s) as Mermaid", nodes);
    } catch (IOException e) {
      throw new IoException("Failed to write Mermaid graph", e);
    }
  }

  /** Renders the whole document into a string. */
  public String toMermaid(UrlTreeNode root) {
    StringWriter writer = new StringWriter();
    write(root, writer);
    return writer.toString();
  }

  private int processNode(UrlTreeNode node, Writer writer) throws IOException {
    int count = 1;
    String nodeId = nodeId(node);
    for (Map.Entry<String, UrlTreeNode> child : node.getChildren().entrySet()) {
      writeLine(
          writer,
          nodeId
              + " --> "
              + sanitize(child.getValue().getPath())
              + "[\""
              + child.getKey()
              + "\"]");
      count += processNode(child.getValue(), writer);
    }

    String token = classify(node);
    if (MermaidColorScheme.fromToken(token).isEmpty()) {
      log.debug("No colour class defined for '{}' at node {}", token, nodeId);
    }
    writeLine(writer, "class " + nodeId + " " + token);
    return count;
  }

  /**
   * Classification token of a node: distinct operation keys over every label, uppercased, sorted
   * and joined with {@code _}; {@code OTHER} when the node exposes no operation.
   */
  public static String classify(UrlTreeNode node) {
    Set<String> methods = new TreeSet<>();
    for (PathOperations pathItem : node.getPathItems().values()) {
      Set<String> keys = pathItem.getOperationKeys();
      if (keys == null) continue;
      for (String key : keys) {
        methods.add(key.toUpperCase(Locale.ROOT));
      }
    }
    if (methods.isEmpty()) {
      return MermaidColorScheme.OTHER.name();
    }
    return String.join("_", methods);
  }

  /**
   * Turns a tree path into a Mermaid node identifier. {@code default} is a reserved word in
   * Mermaid class statements, hence {@code def_ault}.
   */
  public static String sanitize(String token) {
    return token
        .replace(UrlTreeNode.PATH_SEPARATOR, "/")
        .replace("{", ":")
        .replace("}", "")
        .replace(".", "_")
        .replace(";", "_")
        .replace("-", "_")
        .replace("default", "def_ault");
  }

  private static String nodeId(UrlTreeNode node) {
    String path = node.getPath();
    return path == null || path.isEmpty() ? ROOT_NODE_ID : sanitize(path);
  }

  private static void writeLine(Writer writer, String line) throws IOException {
    writer.write(line);
    writer.write('\n');
  }
}
