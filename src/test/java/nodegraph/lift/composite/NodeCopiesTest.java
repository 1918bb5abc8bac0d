package nodegraph.lift.composite;

import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeCopiesTest {

  private Graph graph;
  private GraphNode source;
  private GraphNode query;

  @BeforeEach
  public void setUp() {
    graph = new Graph("g", "g");
    source = new GraphNode("root", "get_value", "Query Node");
    source.addOutput(new Port("value", PortKinds.GENERIC_TYPE));
    query = new GraphNode("root_query", "is_ready", "Query Node");
    query.addInput(new Port("entity", "Entity"));
    query.addOutput(new Port("result", "Boolean"));
    graph.addNode(source);
    graph.addNode(query);
    graph.addEdge("root", "value", "root_query", "entity");
  }

  @Test
  public void testCopyGetsBlockScopedIdAndInputEdges() {
    GraphNode copy = NodeCopies.copyDataNode(graph, query, "block");

    assertEquals("root_query_copy_block_1", copy.id());
    assertTrue(copy.isDataNodeCopy());
    assertEquals("root_query", copy.originalNodeId());
    assertEquals("block", copy.copyBlockId());
    assertEquals(1, graph.incoming(copy.id(), "entity").size(), "输入数据连线随副本复制");
  }

  @Test
  public void testCopiesInSameBlockAreNumbered() {
    NodeCopies.copyDataNode(graph, query, "block");
    GraphNode second = NodeCopies.copyDataNode(graph, query, "block");
    assertEquals("root_query_copy_block_2", second.id());
  }

  @Test
  public void testCopyOfCopyPointsAtRoot() {
    GraphNode first = NodeCopies.copyDataNode(graph, query, "a");
    GraphNode stacked = NodeCopies.copyDataNode(graph, first, "b");

    assertEquals("root_query_copy_b_1", stacked.id(), "id 不叠加");
    assertEquals("root_query", stacked.originalNodeId());
    assertEquals("root_query", NodeCopies.rootOf(stacked));
    assertEquals("root_query", NodeCopies.rootOf(query));
  }

  @Test
  public void testFlowNodesCannotBeCopied() {
    GraphNode print = new GraphNode("p", "print_string", "Execution Node");
    print.addInput(new Port(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE));
    graph.addNode(print);
    assertThrows(IllegalArgumentException.class, () -> NodeCopies.copyDataNode(graph, print, "block"));
  }

  @Test
  public void testPinMappingsPropagateToCopies() {
    GraphNode copy = NodeCopies.copyDataNode(graph, query, "block");
    VirtualPin pin = new VirtualPin(PinSpec.dataInput("who", "Entity", "run"));
    pin.addMapping(new PortRef(query.id(), "entity"));

    VirtualPinResolver.propagateToCopies(List.of(pin), graph);

    assertEquals(List.of(new PortRef(query.id(), "entity"), new PortRef(copy.id(), "entity")), pin.mappings());
  }

  @Test
  public void testPinMappedOnCopyAlsoReachesOriginal() {
    GraphNode copy = NodeCopies.copyDataNode(graph, query, "block");
    VirtualPin pin = new VirtualPin(PinSpec.dataOutput("ready", "Boolean", null, "run"));
    pin.addMapping(new PortRef(copy.id(), "result"));

    VirtualPinResolver.propagateToCopies(List.of(pin), graph);

    assertTrue(pin.mappings().contains(new PortRef(query.id(), "result")));
  }
}
