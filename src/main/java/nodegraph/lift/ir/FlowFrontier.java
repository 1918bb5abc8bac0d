package nodegraph.lift.ir;

import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;

import java.util.ArrayList;
import java.util.List;

/**
 * 流程前沿：下一条流程连线需要挂接的位置。
 *
 * <p>三种形态：单个节点、节点列表、(节点, 指定出口) 列表。后者用于必须从某个具名出口
 * （如分支的 {@code no}）连出的情况。空的节点列表表示“当前没有前沿”。</p>
 */
public sealed interface FlowFrontier permits FlowFrontier.Single, FlowFrontier.Nodes, FlowFrontier.Ports {

  /** 前沿元素；port 为 null 时使用节点的默认流程出口 */
  record Anchor(GraphNode node, String port) {
    public String resolvedPort() {
      return port != null ? port : PortKinds.defaultFlowOutput(node);
    }
  }

  record Single(GraphNode node) implements FlowFrontier {}

  record Nodes(List<GraphNode> nodes) implements FlowFrontier {
    public Nodes {
      nodes = List.copyOf(nodes);
    }
  }

  record Ports(List<Anchor> anchors) implements FlowFrontier {
    public Ports {
      anchors = List.copyOf(anchors);
    }
  }

  FlowFrontier EMPTY = new Nodes(List.of());

  static FlowFrontier of(GraphNode node) {
    return new Single(node);
  }

  static FlowFrontier at(GraphNode node, String port) {
    return new Ports(List.of(new Anchor(node, port)));
  }

  /** 每个前沿元素，统一为 (节点, 指定出口或 null) */
  default List<Anchor> anchors() {
    if (this instanceof Single s) {
      return List.of(new Anchor(s.node(), null));
    } else if (this instanceof Nodes n) {
      List<Anchor> out = new ArrayList<>();
      for (GraphNode node : n.nodes()) out.add(new Anchor(node, null));
      return out;
    } else {
      return ((Ports) this).anchors();
    }
  }

  default boolean isEmpty() {
    return anchors().isEmpty();
  }

  /**
   * 拼接两个前沿（不合并为单个节点）。任一方带指定出口时结果为 {@link Ports}，
   * 未指定出口的元素在拼接时解析为默认出口。
   */
  static FlowFrontier concat(FlowFrontier a, FlowFrontier b) {
    if (a.isEmpty()) return b;
    if (b.isEmpty()) return a;
    if (!(a instanceof Ports) && !(b instanceof Ports)) {
      List<GraphNode> nodes = new ArrayList<>();
      for (Anchor x : a.anchors()) nodes.add(x.node());
      for (Anchor x : b.anchors()) nodes.add(x.node());
      return new Nodes(nodes);
    }
    List<Anchor> anchors = new ArrayList<>();
    for (Anchor x : a.anchors()) anchors.add(new Anchor(x.node(), x.resolvedPort()));
    for (Anchor x : b.anchors()) anchors.add(new Anchor(x.node(), x.resolvedPort()));
    return new Ports(anchors);
  }
}
