package nodegraph.lift.ir;

import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;

/**
 * 语句块提升时的流程游标：持有当前前沿与一次性的“首条连线抑制”标记。
 */
final class FlowCursor {
  private final Graph graph;
  private FlowFrontier frontier;
  private boolean suppressInitialEdge;

  FlowCursor(Graph graph, FlowFrontier start, boolean suppressInitialEdge) {
    this.graph = graph;
    this.frontier = start;
    this.suppressInitialEdge = suppressInitialEdge;
  }

  FlowFrontier frontier() {
    return frontier;
  }

  void setFrontier(FlowFrontier frontier) {
    this.frontier = frontier;
  }

  /** 把前沿全部连到节点的主流程入口，节点成为新前沿 */
  void attach(GraphNode node) {
    connect(node, PortKinds.defaultFlowInput(node));
    frontier = FlowFrontier.of(node);
  }

  /**
   * 把每个前沿元素连到 node.inputPort。抑制标记只消耗一次。
   */
  void connect(GraphNode node, String inputPort) {
    if (suppressInitialEdge) {
      suppressInitialEdge = false;
      return;
    }
    for (FlowFrontier.Anchor anchor : frontier.anchors()) {
      graph.addEdge(anchor.node().id(), anchor.resolvedPort(), node.id(), inputPort);
    }
  }
}
