package nodegraph.lift.composite;

import nodegraph.lift.graph.Edge;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;

import java.util.ArrayList;
import java.util.List;

/**
 * 布局阶段的纯数据节点副本。
 *
 * <p>副本 id 为 {@code {原始id}_copy_{块id}_{序号}}；副本的 {@code originalNodeId} 总是指向最初的原始节点，
 * 对副本再复制也不会形成叠加的 id。</p>
 */
public final class NodeCopies {
  private NodeCopies() {}

  /**
   * 复制一个纯数据节点到指定块，连同其输入数据连线。
   *
   * @throws IllegalArgumentException 节点带流程端口
   */
  public static GraphNode copyDataNode(Graph graph, GraphNode original, String blockId) {
    if (PortKinds.isFlowNode(original)) {
      throw new IllegalArgumentException("only data nodes can be copied: " + original.id());
    }
    String root = rootOf(original);
    int n = 1;
    String id = root + "_copy_" + blockId + "_" + n;
    while (graph.containsNode(id)) {
      id = root + "_copy_" + blockId + "_" + (++n);
    }
    GraphNode copy = Graph.copyWithId(original, id);
    copy.markCopyOf(root, blockId);
    graph.addNode(copy);

    List<Edge> inputs = new ArrayList<>(graph.incomingTo(original.id()));
    for (Edge e : inputs) {
      graph.addEdge(e.srcNode, e.srcPort, copy.id(), e.dstPort);
    }
    return copy;
  }

  /** 节点的逻辑来源：副本返回原始节点 id，否则返回自身 id */
  public static String rootOf(GraphNode node) {
    return node.isDataNodeCopy() && node.originalNodeId() != null ? node.originalNodeId() : node.id();
  }
}
