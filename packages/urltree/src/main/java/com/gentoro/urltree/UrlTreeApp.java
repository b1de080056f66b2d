package com.gentoro.urltree;

import com.gentoro.urltree.annotation.AdditionalDataLoader;
import com.gentoro.urltree.exception.ConfigException;
import com.gentoro.urltree.exception.ExceptionUtil;
import com.gentoro.urltree.exception.IoException;
import com.gentoro.urltree.logging.LoggingService;
import com.gentoro.urltree.mermaid.MermaidExporter;
import com.gentoro.urltree.openapi.OpenApiLoader;
import com.gentoro.urltree.openapi.OpenApiUrlTrees;
import com.gentoro.urltree.tree.UrlTreeNode;
import io.swagger.v3.oas.models.OpenAPI;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Merges the configured OpenAPI documents into one URL tree and writes it as a Mermaid graph.
 *
 * <p>Usage: {@code --config-file <location> [--output <file>] [--mode export|help]}
 */
public class UrlTreeApp {
  private static final org.slf4j.Logger log = LoggingService.getLogger(UrlTreeApp.class);

  private final StartupParameters parameters;

  public UrlTreeApp(StartupParameters parameters) {
    this.parameters = parameters;
  }

  public static void main(String[] args) {
    int status;
    try {
      status = new UrlTreeApp(new StartupParameters(args)).run();
    } catch (RuntimeException e) {
      log.error("Invalid arguments: {}", ExceptionUtil.toErrorDetails(e));
      printUsage();
      status = 2;
    }
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Runs the selected mode.
   *
   * @return process exit status, {@code 0} on success
   */
  public int run() {
    if ("help".equals(parameters.mode())) {
      printUsage();
      return 0;
    }
    try {
      Configuration config = new ConfigurationProvider(parameters.configFile()).config();
      LoggingService.applyConfiguration(config);

      UrlTreeNode root = buildTree(config);
      String output =
          parameters
              .getOptionalParameter("output")
              .orElse(config.getString("urltree.output", null));
      export(root, output);
      return 0;
    } catch (RuntimeException e) {
      log.error(
          "URL tree export failed: {} at {}",
          ExceptionUtil.toErrorDetails(e),
          ExceptionUtil.formatCompactStackTrace(e));
      return 1;
    }
  }

  UrlTreeNode buildTree(Configuration config) {
    List<String> labels = config.getList(String.class, "urltree.sources.label", List.of());
    List<String> locations = config.getList(String.class, "urltree.sources.location", List.of());
    if (labels.isEmpty()) {
      throw new ConfigException("No sources configured under 'urltree.sources'");
    }
    if (labels.size() != locations.size()) {
      throw new ConfigException(
          "Every entry of 'urltree.sources' needs both a label and a location");
    }

    UrlTreeNode root = UrlTreeNode.create();
    for (int i = 0; i < labels.size(); i++) {
      log.info("Attaching {} as '{}'", locations.get(i), labels.get(i));
      OpenAPI doc = OpenApiLoader.load(locations.get(i));
      OpenApiUrlTrees.attach(root, doc, labels.get(i));
    }

    String annotations = config.getString("urltree.annotations", null);
    if (annotations != null && !annotations.isBlank()) {
      AdditionalDataLoader loader = new AdditionalDataLoader();
      int applied = loader.apply(root, loader.load(Path.of(annotations)));
      log.info("Applied annotations from {} to {} node(s)", annotations, applied);
    }
    return root;
  }

  private void export(UrlTreeNode root, String output) {
    MermaidExporter exporter = new MermaidExporter();
    if (output == null || output.isBlank()) {
      Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      exporter.write(root, stdout);
      return;
    }
    Path target = Path.of(output);
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      exporter.write(root, writer);
    } catch (IOException e) {
      throw new IoException("Failed to write Mermaid output to " + target, e);
    }
    log.info("Mermaid graph written to {}", target.toAbsolutePath());
  }

  private static void printUsage() {
    System.out.println(
        "Usage: urltree --config-file <classpath:name.yaml|path> [--output <file>] [--mode"
            + " export|help]");
  }
}
