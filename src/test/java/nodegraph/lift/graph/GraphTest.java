package nodegraph.lift.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Graph 单元测试
 *
 * 测试目标：
 * 1. 数据输入端口单一来源约束
 * 2. 流程连线去重与多入边
 * 3. 图合并时的 id 改写
 */
public class GraphTest {

  private Graph graph;

  @BeforeEach
  public void setUp() {
    graph = new Graph("g", "Demo");
  }

  private GraphNode flowNode(String id) {
    GraphNode n = new GraphNode(id, "print_string", "Execution Node");
    n.addInput(new Port(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE));
    n.addInput(new Port("string", "String"));
    n.addOutput(new Port(PortKinds.FLOW_OUT, PortKinds.FLOW_TYPE));
    graph.addNode(n);
    return n;
  }

  private GraphNode dataNode(String id) {
    GraphNode n = new GraphNode(id, "get_value", "Query Node");
    n.addInput(new Port("key", "String"));
    n.addOutput(new Port("value", PortKinds.GENERIC_TYPE));
    graph.addNode(n);
    return n;
  }

  @Test
  public void testDataPortAcceptsSingleSource() {
    dataNode("d1");
    dataNode("d2");
    flowNode("p");
    graph.addEdge("d1", "value", "p", "string");

    IllegalStateException ex = assertThrows(IllegalStateException.class,
      () -> graph.addEdge("d2", "value", "p", "string"));
    assertTrue(ex.getMessage().contains("p.string"));
    assertEquals(1, graph.dataEdges().size());
  }

  @Test
  public void testFlowPortAcceptsManySources() {
    flowNode("a");
    flowNode("b");
    flowNode("c");
    graph.addEdge("a", PortKinds.FLOW_OUT, "c", PortKinds.FLOW_IN);
    graph.addEdge("b", PortKinds.FLOW_OUT, "c", PortKinds.FLOW_IN);
    Edge again = graph.addEdge("a", PortKinds.FLOW_OUT, "c", PortKinds.FLOW_IN);

    assertEquals(2, graph.incoming("c", PortKinds.FLOW_IN).size(), "重复的流程连线只保留一条");
    assertEquals("edge_1", again.id, "返回已有连线");
    assertTrue(graph.isFlowEdge(again));
  }

  @Test
  public void testMissingEndpointIsRejected() {
    flowNode("a");
    assertThrows(IllegalStateException.class, () -> graph.addEdge("a", PortKinds.FLOW_OUT, "ghost", PortKinds.FLOW_IN));
  }

  @Test
  public void testDuplicateNodeIdIsRejected() {
    flowNode("a");
    assertThrows(IllegalStateException.class, () -> flowNode("a"));
  }

  @Test
  public void testConnectionQueries() {
    flowNode("a");
    flowNode("b");
    graph.addEdge("a", PortKinds.FLOW_OUT, "b", PortKinds.FLOW_IN);
    assertTrue(graph.isConnected("a", PortKinds.FLOW_OUT, true));
    assertFalse(graph.isConnected("a", PortKinds.FLOW_IN, false));
    assertEquals(1, graph.outgoingFrom("a").size());
    assertEquals(1, graph.incomingTo("b").size());
  }

  @Test
  public void testMergeRenamesClashingIds() {
    flowNode("a");
    Graph other = new Graph("o", "Other");
    GraphNode a = new GraphNode("a", "print_string", "Execution Node");
    a.addOutput(new Port(PortKinds.FLOW_OUT, PortKinds.FLOW_TYPE));
    GraphNode b = new GraphNode("b", "print_string", "Execution Node");
    b.addInput(new Port(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE));
    b.setConstant("string", "x");
    other.addNode(a);
    other.addNode(b);
    other.addEdge("a", PortKinds.FLOW_OUT, "b", PortKinds.FLOW_IN);

    Map<String, String> renames = graph.merge(other);

    assertEquals("a_1", renames.get("a"));
    assertEquals("b", renames.get("b"));
    assertEquals(List.of("a", "a_1", "b"), graph.nodes().stream().map(GraphNode::id).toList());
    assertEquals(1, graph.incoming("b", PortKinds.FLOW_IN).size());
    assertEquals("a_1", graph.edges().get(0).srcNode, "连线随改名改写");
    assertEquals("x", graph.node("b").constant("string"));
  }

  @Test
  public void testCopyWithIdKeepsPortsAndConstants() {
    GraphNode original = dataNode("d");
    original.setConstant("key", "hp");
    original.setCustomVarName("value", "health");
    original.setSourceSpan(3, 4);

    GraphNode copy = Graph.copyWithId(original, "d2");
    assertEquals("d2", copy.id());
    assertEquals(original.inputs(), copy.inputs());
    assertEquals("hp", copy.constant("key"));
    assertEquals("health", copy.customVarNames().get("value"));
    assertEquals(4, copy.sourceEndLine());
  }
}
