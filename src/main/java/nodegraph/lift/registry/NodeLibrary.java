package nodegraph.lift.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于 JSON 节点定义的节点库。构造完成后只读；查询未命中时回退到 {@link BuiltinNodes}。
 *
 * <p>接受两种 JSON 形态：节点定义数组，或 {@code {"nodes": [...]}}。</p>
 */
public final class NodeLibrary implements NodeRegistry {
  private static final Logger LOGGER = Logger.getLogger(NodeLibrary.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Map<String, NodeSpec> specs;

  public NodeLibrary(Collection<NodeSpec> definitions) {
    Map<String, NodeSpec> byName = new LinkedHashMap<>();
    for (NodeSpec spec : definitions) {
      if (spec.name == null || spec.name.isBlank()) {
        throw new IllegalArgumentException("node definition without name");
      }
      if (byName.put(spec.name, spec) != null) {
        LOGGER.log(Level.WARNING, "节点定义重复，后者覆盖前者: {0}", spec.name);
      }
    }
    this.specs = Collections.unmodifiableMap(byName);
  }

  public static NodeLibrary of(NodeSpec... definitions) {
    return new NodeLibrary(List.of(definitions));
  }

  public static NodeLibrary empty() {
    return new NodeLibrary(List.of());
  }

  public static NodeLibrary fromJson(String json) throws IOException {
    return fromTree(MAPPER.readTree(json));
  }

  public static NodeLibrary load(Path path) throws IOException {
    return fromTree(MAPPER.readTree(Files.readString(path)));
  }

  public static NodeLibrary load(InputStream in) throws IOException {
    return fromTree(MAPPER.readTree(in));
  }

  private static NodeLibrary fromTree(JsonNode root) throws IOException {
    JsonNode array = root.isArray() ? root : root.path("nodes");
    if (!array.isArray()) {
      throw new IOException("node library must be an array or contain a 'nodes' array");
    }
    List<NodeSpec> defs = new ArrayList<>();
    for (JsonNode item : array) {
      defs.add(MAPPER.treeToValue(item, NodeSpec.class));
    }
    LOGGER.log(Level.FINE, "已加载节点定义 {0} 个", defs.size());
    return new NodeLibrary(defs);
  }

  @Override
  public Optional<NodeSpec> resolve(String name) {
    if (name == null) return Optional.empty();
    NodeSpec spec = specs.get(name);
    return spec != null ? Optional.of(spec) : BuiltinNodes.get(name);
  }

  public Collection<NodeSpec> definitions() {
    return specs.values();
  }

  public int size() {
    return specs.size();
  }
}
