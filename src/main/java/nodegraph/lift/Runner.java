package nodegraph.lift;

import nodegraph.lift.codegen.GraphLowering;
import nodegraph.lift.codegen.SourceWriter;
import nodegraph.lift.composite.PortRef;
import nodegraph.lift.composite.VirtualPin;
import nodegraph.lift.core.SourceModel;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphJson;
import nodegraph.lift.parser.ScriptCompiler;
import nodegraph.lift.registry.NodeLibrary;
import nodegraph.lift.registry.NodeRegistry;
import nodegraph.lift.support.Diagnostics;
import nodegraph.lift.support.LiftConfig;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Runner {
  private static final Logger LOGGER = Logger.getLogger(Runner.class.getName());

  public static void main(String[] args) throws Exception {
    if (args.length > 0) {
      java.util.List<String> argList = new java.util.ArrayList<>(java.util.Arrays.asList(args));
      Path input = Path.of(argList.remove(0));

      String registryPath = LiftConfig.DEFAULT_REGISTRY;
      String outPath = null;
      boolean composite = false;
      boolean lower = false;
      for (String a : argList) {
        if (a.startsWith("--registry=")) registryPath = a.substring("--registry=".length());
        else if (a.startsWith("--out=")) outPath = a.substring("--out=".length());
        else if ("--composite".equals(a)) composite = true;
        else if ("--lower".equals(a)) lower = true;
        else System.err.println("Ignoring unknown option: " + a);
      }

      if (LiftConfig.DEBUG) {
        System.err.println("DEBUG: input=" + input.toAbsolutePath());
        System.err.println("DEBUG: registry=" + registryPath);
      }

      NodeRegistry registry = registryPath != null ? NodeLibrary.load(Path.of(registryPath)) : NodeLibrary.empty();
      String text = Files.readString(input, StandardCharsets.UTF_8);
      String moduleName = stripExtension(input.getFileName().toString());

      SourceModel.Module module;
      try {
        module = ScriptCompiler.isJsonInput(text) ? ScriptCompiler.parseJson(text) : ScriptCompiler.compile(text, moduleName);
      } catch (ScriptCompiler.CompilationException e) {
        LOGGER.log(Level.WARNING, "解析失败: {0}", input);
        System.err.println(e.getMessage());
        System.exit(1);
        return;
      }
      if (module.name == null) module.name = moduleName;

      String output;
      Diagnostics diagnostics;
      if (composite) {
        CompositeLiftResult result = new CompositeLifter(registry).lift(module);
        ObjectNode tree = GraphJson.toTree(result.graph());
        writePins(tree.putArray("virtual_pins"), result.pins());
        output = GraphJson.write(tree);
        diagnostics = result.diagnostics();
      } else {
        LiftResult result = new GraphLifter(registry).lift(module);
        diagnostics = result.diagnostics();
        if (lower) {
          output = SourceWriter.write(new GraphLowering(registry, diagnostics).lower(result.graph()));
        } else {
          output = GraphJson.write(result.graph());
        }
        report(result.graph());
      }

      for (String message : diagnostics.messages()) {
        System.err.println(message);
      }

      if (outPath != null) {
        Files.writeString(Path.of(outPath), output, StandardCharsets.UTF_8);
        LOGGER.log(Level.INFO, "已写出 {0}", outPath);
      } else {
        System.out.println(output);
      }
      return;
    }

    // Fallback: print usage
    System.err.println("Usage: Runner <file.py|file.json> [--registry=<library.json>] [--composite] [--lower] [--out=<file>]");
    System.err.println("  --registry=<path>  Node library JSON (default: $NODEGRAPH_LIFT_REGISTRY)");
    System.err.println("  --composite        Lift a composite class and resolve its virtual pins");
    System.err.println("  --lower            Write the lifted event graph back as script text");
    System.err.println("  --out=<path>       Write the result to a file instead of stdout");
  }

  private static void writePins(ArrayNode array, java.util.List<VirtualPin> pins) {
    for (VirtualPin pin : pins) {
      ObjectNode jp = array.addObject();
      jp.put("name", pin.name());
      jp.put("type", pin.spec().type());
      jp.put("direction", pin.spec().direction().name().toLowerCase(java.util.Locale.ROOT));
      jp.put("is_flow", pin.spec().flow());
      jp.put("method", pin.spec().method());
      jp.put("allow_unmapped", pin.allowUnmapped());
      ArrayNode mapped = jp.putArray("mapped_ports");
      for (PortRef ref : pin.mappings()) {
        mapped.addObject().put("node_id", ref.nodeId()).put("port", ref.port());
      }
    }
  }

  private static void report(Graph graph) {
    if (LiftConfig.DEBUG) {
      System.err.println("DEBUG: nodes=" + graph.nodes().size() + " edges=" + graph.edges().size());
    }
  }

  private static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
