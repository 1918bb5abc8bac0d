package nodegraph.lift.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次编译单元（一组事件处理方法，或一个复合节点的全部方法）产出的图。
 *
 * <p>不变量：一个数据输入端口最多接收一条数据连线；流程输入端口可接收任意条连线。
 * 违反时抛出 {@link IllegalStateException}，属于构建器错误，不做静默修复。</p>
 */
public final class Graph {
  private final String graphId;
  private String graphName;
  private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
  private final List<Edge> edges = new ArrayList<>();
  private final Map<String, Object> metadata = new LinkedHashMap<>();
  private final List<String> eventFlowOrder = new ArrayList<>();
  private final List<String> eventFlowTitles = new ArrayList<>();
  private int edgeCounter;

  public Graph(String graphId, String graphName) {
    this.graphId = graphId;
    this.graphName = graphName;
  }

  public String graphId() { return graphId; }
  public String graphName() { return graphName; }
  public void setGraphName(String graphName) { this.graphName = graphName; }

  public void addNode(GraphNode node) {
    if (nodes.containsKey(node.id())) {
      throw new IllegalStateException("duplicate node id: " + node.id());
    }
    nodes.put(node.id(), node);
  }

  public GraphNode node(String id) { return nodes.get(id); }
  public boolean containsNode(String id) { return nodes.containsKey(id); }
  public Collection<GraphNode> nodes() { return Collections.unmodifiableCollection(nodes.values()); }
  public List<Edge> edges() { return Collections.unmodifiableList(edges); }
  public Map<String, Object> metadata() { return metadata; }
  public List<String> eventFlowOrder() { return eventFlowOrder; }
  public List<String> eventFlowTitles() { return eventFlowTitles; }

  /**
   * 添加连线。完全相同的流程连线只保留一条。
   *
   * @throws IllegalStateException 端点不存在，或数据输入端口已有来源
   */
  public Edge addEdge(String srcNode, String srcPort, String dstNode, String dstPort) {
    GraphNode src = nodes.get(srcNode);
    GraphNode dst = nodes.get(dstNode);
    if (src == null || dst == null) {
      throw new IllegalStateException("edge endpoint missing: " + srcNode + " -> " + dstNode);
    }
    boolean flow = PortKinds.isFlowInput(dst, dstPort);
    for (Edge e : edges) {
      if (!e.dstNode.equals(dstNode) || !e.dstPort.equals(dstPort)) continue;
      if (flow) {
        if (e.srcNode.equals(srcNode) && e.srcPort.equals(srcPort)) return e;
      } else {
        throw new IllegalStateException(
          "data port already connected: " + dstNode + "." + dstPort + " <- " + e.srcNode + "." + e.srcPort);
      }
    }
    Edge edge = new Edge("edge_" + (++edgeCounter), srcNode, srcPort, dstNode, dstPort);
    edges.add(edge);
    return edge;
  }

  public boolean isFlowEdge(Edge e) {
    GraphNode dst = nodes.get(e.dstNode);
    return dst != null && PortKinds.isFlowInput(dst, e.dstPort);
  }

  public List<Edge> flowEdges() {
    return edges.stream().filter(this::isFlowEdge).toList();
  }

  public List<Edge> dataEdges() {
    return edges.stream().filter(e -> !isFlowEdge(e)).toList();
  }

  public List<Edge> incoming(String nodeId, String port) {
    List<Edge> out = new ArrayList<>();
    for (Edge e : edges) {
      if (e.dstNode.equals(nodeId) && e.dstPort.equals(port)) out.add(e);
    }
    return out;
  }

  public List<Edge> outgoing(String nodeId, String port) {
    List<Edge> out = new ArrayList<>();
    for (Edge e : edges) {
      if (e.srcNode.equals(nodeId) && e.srcPort.equals(port)) out.add(e);
    }
    return out;
  }

  public List<Edge> incomingTo(String nodeId) {
    return edges.stream().filter(e -> e.dstNode.equals(nodeId)).toList();
  }

  public List<Edge> outgoingFrom(String nodeId) {
    return edges.stream().filter(e -> e.srcNode.equals(nodeId)).toList();
  }

  /** 端口是否已有连线（输入看入边，输出看出边） */
  public boolean isConnected(String nodeId, String port, boolean output) {
    for (Edge e : edges) {
      if (output ? (e.srcNode.equals(nodeId) && e.srcPort.equals(port))
                 : (e.dstNode.equals(nodeId) && e.dstPort.equals(port))) {
        return true;
      }
    }
    return false;
  }

  /**
   * 合并另一张图的节点与连线。节点 id 冲突时追加 {@code _1}、{@code _2} 后缀并改写连线。
   *
   * @return 被合并图中的旧 id → 新 id
   */
  public Map<String, String> merge(Graph other) {
    Map<String, String> renames = new LinkedHashMap<>();
    for (GraphNode n : other.nodes()) {
      String id = n.id();
      int suffix = 1;
      while (nodes.containsKey(id)) {
        id = n.id() + "_" + suffix++;
      }
      renames.put(n.id(), id);
      nodes.put(id, id.equals(n.id()) ? n : copyWithId(n, id));
    }
    for (Edge e : other.edges()) {
      edges.add(new Edge("edge_" + (++edgeCounter),
        renames.get(e.srcNode), e.srcPort, renames.get(e.dstNode), e.dstPort));
    }
    return renames;
  }

  /** 以新 id 复制节点（端口、常量、元信息全部保留） */
  public static GraphNode copyWithId(GraphNode n, String id) {
    GraphNode copy = new GraphNode(id, n.title(), n.category());
    n.inputs().forEach(copy::addInput);
    n.outputs().forEach(copy::addOutput);
    n.inputConstants().forEach(copy::setConstant);
    n.declaredFlowPorts().forEach(copy::declareFlowPort);
    n.customVarNames().forEach(copy::setCustomVarName);
    copy.setCompositeId(n.compositeId());
    copy.setSourceSpan(n.sourceLine(), n.sourceEndLine());
    if (n.isDataNodeCopy()) copy.markCopyOf(n.originalNodeId(), n.copyBlockId());
    return copy;
  }
}
