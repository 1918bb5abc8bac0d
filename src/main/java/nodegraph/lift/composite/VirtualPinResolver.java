package nodegraph.lift.composite;

import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.ir.Binding;
import nodegraph.lift.ir.FlowFrontier;
import nodegraph.lift.ir.VarEnv;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.support.DiagnosticSink;
import nodegraph.lift.support.ErrorMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 虚拟引脚解析：把复合节点方法声明的引脚落到方法图内具体的 (节点, 端口) 上。
 *
 * <p>只追加映射记录，不修改图。多个候选位置时按节点插入顺序取第一个。</p>
 */
public final class VirtualPinResolver {
  private static final Logger LOGGER = Logger.getLogger(VirtualPinResolver.class.getName());

  private final Graph graph;
  private final DiagnosticSink diagnostics;

  public VirtualPinResolver(Graph graph, DiagnosticSink diagnostics) {
    this.graph = graph;
    this.diagnostics = diagnostics;
  }

  /**
   * @param env 方法提升结束时的变量环境（数据输出取值用）
   * @param tracker 提升期间记录的参数使用位置
   * @param finalFrontier 方法体结束时的流程前沿
   */
  public List<VirtualPin> resolve(List<PinSpec> pins, VarEnv env, ParamUsageTracker tracker, FlowFrontier finalFrontier) {
    List<VirtualPin> resolved = new ArrayList<>();
    List<VirtualPin> flowOutputs = new ArrayList<>();
    for (PinSpec spec : pins) {
      VirtualPin pin = new VirtualPin(spec);
      resolved.add(pin);
      if (spec.flow() && spec.isInput()) {
        resolveFlowInput(pin);
      } else if (spec.flow()) {
        flowOutputs.add(pin);
      } else if (spec.isInput()) {
        resolveDataInput(pin, tracker);
      } else {
        resolveDataOutput(pin, env);
      }
    }
    resolveFlowOutputs(flowOutputs, finalFrontier);
    return resolved;
  }

  /**
   * 把其他方法中读取实例字段的位置补到写入该字段的方法的数据输入引脚上。
   *
   * @param stateUsages 字段来源 → 使用位置，节点 id 已是合并图中的 id
   */
  public static void applyStateUsages(List<VirtualPin> pins, Map<StateFieldSources.Source, List<PortRef>> stateUsages) {
    for (VirtualPin pin : pins) {
      PinSpec spec = pin.spec();
      if (spec.flow() || !spec.isInput()) continue;
      List<PortRef> sites = stateUsages.get(new StateFieldSources.Source(spec.method(), spec.name()));
      if (sites == null) continue;
      for (PortRef ref : sites) pin.addMapping(ref);
    }
  }

  /**
   * 所有映射都收集完之后调用：仍然没有位置的引脚标记为允许未映射并上报。
   */
  public static void markUnmapped(List<VirtualPin> pins, DiagnosticSink diagnostics) {
    for (VirtualPin pin : pins) {
      if (!pin.isMapped()) {
        pin.markAllowUnmapped();
        diagnostics.warn(ErrorMessages.unresolvedPin(pin.name()));
      }
    }
  }

  private void resolveDataInput(VirtualPin pin, ParamUsageTracker tracker) {
    String param = tracker.paramOf(pin.name());
    if (param == null) param = pin.name();
    for (PortRef ref : tracker.usages(param)) pin.addMapping(ref);
    if (pin.isMapped() || !tracker.usedInCondition(param)) return;

    // 只在条件里出现的参数：落到第一个分支节点的条件端口
    GraphNode branch = firstBranchNode();
    if (branch != null) {
      String port = BuiltinNodes.DOUBLE_BRANCH.equals(branch.title()) ? PortKinds.CONDITION : PortKinds.CONTROL_EXPRESSION;
      pin.addMapping(new PortRef(branch.id(), port));
      LOGGER.log(Level.FINE, "参数 {0} 仅用于条件，映射到 {1}", new Object[]{param, branch.id()});
    }
  }

  private void resolveFlowInput(VirtualPin pin) {
    GraphNode fallback = null;
    for (GraphNode n : graph.nodes()) {
      String port = PortKinds.defaultFlowInput(n);
      if (!n.hasInput(port) || !PortKinds.isFlowInput(n, port) || graph.isConnected(n.id(), port, false)) continue;
      if (BuiltinNodes.isBranch(n.title()) || BuiltinNodes.isLoop(n.title())) {
        pin.addMapping(new PortRef(n.id(), port));
        return;
      }
      if (fallback == null) fallback = n;
    }
    if (fallback != null) pin.addMapping(new PortRef(fallback.id(), PortKinds.defaultFlowInput(fallback)));
  }

  private void resolveDataOutput(VirtualPin pin, VarEnv env) {
    Binding b = env.get(pin.spec().sourceVariable());
    if (b != null && !b.isConstant() && graph.containsNode(b.nodeId)) {
      pin.addMapping(new PortRef(b.nodeId, b.port));
    }
  }

  private void resolveFlowOutputs(List<VirtualPin> pins, FlowFrontier frontier) {
    if (pins.isEmpty()) return;
    List<FlowFrontier.Anchor> anchors = frontier.anchors();

    // 每个流程出口引脚只落到一个出口：优先全部未连接的分支出口，按序号配对
    GraphNode branch = firstBranchNode();
    if (branch != null) {
      List<Port> exits = PortKinds.flowOutputs(branch);
      boolean allOpen = !exits.isEmpty();
      for (Port p : exits) {
        if (graph.isConnected(branch.id(), p.name, true)) allOpen = false;
      }
      if (allOpen) {
        for (int i = 0; i < pins.size() && i < exits.size(); i++) {
          pins.get(i).addMapping(new PortRef(branch.id(), exits.get(i).name));
        }
        return;
      }
    }
    if (anchors.isEmpty()) return;
    if (anchors.size() == pins.size()) {
      for (int i = 0; i < pins.size(); i++) {
        FlowFrontier.Anchor a = anchors.get(i);
        pins.get(i).addMapping(new PortRef(a.node().id(), a.resolvedPort()));
      }
      return;
    }
    FlowFrontier.Anchor last = anchors.get(anchors.size() - 1);
    for (VirtualPin pin : pins) pin.addMapping(new PortRef(last.node().id(), last.resolvedPort()));
  }

  private GraphNode firstBranchNode() {
    for (GraphNode n : graph.nodes()) {
      if (BuiltinNodes.isBranch(n.title())) return n;
    }
    return null;
  }

  /**
   * 把每条映射复制到与其同源的全部副本（以及副本的原始节点）上。
   */
  public static void propagateToCopies(List<VirtualPin> pins, Graph graph) {
    for (VirtualPin pin : pins) {
      for (PortRef ref : new ArrayList<>(pin.mappings())) {
        GraphNode node = graph.node(ref.nodeId());
        if (node == null) continue;
        String root = NodeCopies.rootOf(node);
        for (GraphNode other : graph.nodes()) {
          if (other.id().equals(ref.nodeId())) continue;
          if (other.id().equals(root) || (other.isDataNodeCopy() && root.equals(other.originalNodeId()))) {
            pin.addMapping(new PortRef(other.id(), ref.port()));
          }
        }
      }
    }
  }
}
