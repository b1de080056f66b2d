package com.gentoro.urltree.mermaid;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.urltree.exception.IoException;
import com.gentoro.urltree.exception.UrlTreeErrorCode;
import com.gentoro.urltree.tree.PathOperations;
import com.gentoro.urltree.tree.UrlTreeNode;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MermaidExporterTest {

  private static final List<String> HEADER =
      List.of(
          "graph LR",
          "classDef GET fill:lightSteelBlue,stroke:#333,stroke-width:4px",
          "classDef POST fill:SteelBlue,stroke:#333,stroke-width:4px",
          "classDef GET_POST fill:forestGreen,stroke:#333,stroke-width:4px",
          "classDef DELETE_GET_PATCH fill:yellowGreen,stroke:#333,stroke-width:4px",
          "classDef DELETE_GET_PUT fill:olive,stroke:#333,stroke-width:4px",
          "classDef DELETE_GET fill:DarkSeaGreen,stroke:#333,stroke-width:4px",
          "classDef DELETE fill:tomato,stroke:#333,stroke-width:4px",
          "classDef OTHER fill:white,stroke:#333,stroke-width:4px");

  private final MermaidExporter exporter = new MermaidExporter();

  private static PathOperations ops(String... keys) {
    Set<String> set = Set.of(keys);
    return () -> set;
  }

  private static List<String> lines(String text) {
    return List.of(text.split("\n"));
  }

  @Test
  void emptyTreeHasHeaderAndRootClass() {
    List<String> out = lines(exporter.toMermaid(UrlTreeNode.create()));

    assertEquals(HEADER, out.subList(0, HEADER.size()));
    assertEquals(List.of("class / OTHER"), out.subList(HEADER.size(), out.size()));
  }

  @Test
  @DisplayName("items and items/{id} render edges and verb classes in pre-order")
  void itemsScenario() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/items", ops("get"), "v1");
    root.attach("/items/{id}", ops("get", "delete"), "v1");

    List<String> out = lines(exporter.toMermaid(root));

    assertEquals(
        List.of(
            "/ --> /items[\"items\"]",
            "/items --> /items/:id[\"{id}\"]",
            "class /items/:id DELETE_GET",
            "class /items GET",
            "class / OTHER"),
        out.subList(HEADER.size(), out.size()));
  }

  @Test
  void childrenAreVisitedBeforeSiblings() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/a/b", ops("get"), "v1");
    root.attach("/c", ops("post"), "v1");
    root.attach("/a/d", ops("delete"), "v1");

    List<String> out = lines(exporter.toMermaid(root));

    assertEquals(
        List.of(
            "/ --> /a[\"a\"]",
            "/a --> /a/b[\"b\"]",
            "class /a/b GET",
            "/a --> /a/d[\"d\"]",
            "class /a/d DELETE",
            "class /a OTHER",
            "/ --> /c[\"c\"]",
            "class /c POST",
            "class / OTHER"),
        out.subList(HEADER.size(), out.size()));
  }

  @Test
  void classificationUnitesAllLabels() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/pets", ops("get"), "v1");
    UrlTreeNode pets = root.attach("/pets", ops("post", "GET"), "v2");

    assertEquals("GET_POST", MermaidExporter.classify(pets));
    assertTrue(exporter.toMermaid(root).contains("class /pets GET_POST\n"));
  }

  @Test
  void classificationWithoutOperationsIsOther() {
    UrlTreeNode root = UrlTreeNode.create();
    UrlTreeNode node = root.attach("/health", ops(), "v1");

    assertEquals("OTHER", MermaidExporter.classify(node));
    assertEquals("OTHER", MermaidExporter.classify(root));
  }

  @Test
  void tokensOutsideTheTableStillGetAClassLine() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/jobs", ops("put", "patch", "head"), "v1");

    String text = exporter.toMermaid(root);

    assertTrue(text.contains("class /jobs HEAD_PATCH_PUT\n"));
    assertFalse(text.contains("classDef HEAD_PATCH_PUT"));
  }

  @Test
  void sanitizeRewritesIdentifiers() {
    assertEquals("/users/:id", MermaidExporter.sanitize("\\users\\{id}"));
    assertEquals("/v1_0/a_b/c_d", MermaidExporter.sanitize("\\v1.0\\a-b\\c;d"));
    assertEquals("/def_ault/x_def_ault", MermaidExporter.sanitize("\\default\\x-default"));
  }

  @Test
  void sanitizeIsIdempotent() {
    String once = MermaidExporter.sanitize("\\users\\{id}\\default.json");
    assertEquals(once, MermaidExporter.sanitize(once));
    assertFalse(once.contains("{"));
    assertFalse(once.contains("}"));
  }

  @Test
  void exportedNodeIdsAreSanitized() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/users/default-settings.json", ops("patch"), "v2");

    String text = exporter.toMermaid(root);

    assertTrue(
        text.contains("/users --> /users/def_ault_settings_json[\"default-settings.json\"]\n"));
    assertTrue(text.contains("class /users/def_ault_settings_json PATCH\n"));
  }

  @Test
  void exportIsRepeatable() {
    UrlTreeNode root = UrlTreeNode.create();
    root.attach("/a/{b}", ops("get"), "v1");

    assertEquals(exporter.toMermaid(root), exporter.toMermaid(root));
  }

  @Test
  void writerFailureIsWrapped() {
    Writer failing =
        new Writer() {
          @Override
          public void write(char[] cbuf, int off, int len) throws IOException {
            throw new IOException("disk full");
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };

    IoException ex =
        assertThrows(IoException.class, () -> exporter.write(UrlTreeNode.create(), failing));
    assertEquals(UrlTreeErrorCode.IO_ERROR, ex.getCode());
    assertEquals("disk full", ex.getCause().getMessage());
  }
}
