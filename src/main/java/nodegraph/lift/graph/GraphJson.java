package nodegraph.lift.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * 图的 JSON 导出，字段名与编辑器持久化格式一致（snake_case）。
 */
public final class GraphJson {

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(SerializationFeature.INDENT_OUTPUT);

  private GraphJson() {}

  public static String write(Graph graph) throws JsonProcessingException {
    return write(toTree(graph));
  }

  public static String write(ObjectNode tree) throws JsonProcessingException {
    return MAPPER.writeValueAsString(tree);
  }

  public static ObjectNode toTree(Graph graph) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("graph_id", graph.graphId());
    root.put("graph_name", graph.graphName());

    ArrayNode nodes = root.putArray("nodes");
    for (GraphNode n : graph.nodes()) {
      ObjectNode jn = nodes.addObject();
      jn.put("id", n.id());
      jn.put("title", n.title());
      jn.put("category", n.category());
      writePorts(jn.putArray("inputs"), n.inputs());
      writePorts(jn.putArray("outputs"), n.outputs());
      jn.set("input_constants", MAPPER.valueToTree(n.inputConstants()));
      if (!n.customVarNames().isEmpty()) {
        jn.set("custom_var_names", MAPPER.valueToTree(n.customVarNames()));
      }
      if (n.compositeId() != null) jn.put("composite_id", n.compositeId());
      jn.put("source_lineno", n.sourceLine());
      jn.put("source_end_lineno", n.sourceEndLine());
      if (n.isDataNodeCopy()) {
        jn.put("is_data_node_copy", true);
        jn.put("original_node_id", n.originalNodeId());
        jn.put("copy_block_id", n.copyBlockId());
      }
    }

    ArrayNode edges = root.putArray("edges");
    for (Edge e : graph.edges()) {
      ObjectNode je = edges.addObject();
      je.put("id", e.id);
      je.put("src_node", e.srcNode);
      je.put("src_port", e.srcPort);
      je.put("dst_node", e.dstNode);
      je.put("dst_port", e.dstPort);
    }

    root.set("event_flow_order", MAPPER.valueToTree(graph.eventFlowOrder()));
    root.set("event_flow_titles", MAPPER.valueToTree(graph.eventFlowTitles()));
    root.set("metadata", MAPPER.valueToTree(graph.metadata()));
    return root;
  }

  private static void writePorts(ArrayNode array, List<Port> ports) {
    for (Port p : ports) {
      ObjectNode jp = array.addObject();
      jp.put("name", p.name);
      jp.put("type", p.type);
    }
  }
}
