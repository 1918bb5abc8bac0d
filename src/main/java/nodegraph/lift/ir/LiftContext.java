package nodegraph.lift.ir;

import nodegraph.lift.graph.Graph;
import nodegraph.lift.registry.NodeRegistry;
import nodegraph.lift.support.DiagnosticSink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次提升共享的上下文：目标图、节点库、诊断输出、常量表、id 生成器与复合节点实例表。
 */
public final class LiftContext {
  public final NodeRegistry registry;
  public final DiagnosticSink diagnostics;
  public final Graph graph;
  public final NodeIdGenerator ids;
  public final ConstantScope constants;
  public final ConstantEvaluator evaluator;
  public final LiftOptions options;
  // 实例别名（self.xxx 的 xxx）→ 复合节点类名
  private final Map<String, String> compositeInstances;
  private final ArgumentUsageListener usageListener;

  public LiftContext(NodeRegistry registry, DiagnosticSink diagnostics, Graph graph, NodeIdGenerator ids,
                     ConstantScope constants, LiftOptions options, Map<String, String> compositeInstances,
                     ArgumentUsageListener usageListener) {
    this.registry = registry;
    this.diagnostics = diagnostics;
    this.graph = graph;
    this.ids = ids;
    this.constants = constants;
    this.evaluator = new ConstantEvaluator(constants);
    this.options = options;
    this.compositeInstances = Collections.unmodifiableMap(new LinkedHashMap<>(compositeInstances));
    this.usageListener = usageListener != null ? usageListener : ArgumentUsageListener.NONE;
  }

  public static LiftContext simple(NodeRegistry registry, DiagnosticSink diagnostics, Graph graph) {
    return new LiftContext(registry, diagnostics, graph, new NodeIdGenerator(), ConstantScope.empty(),
      LiftOptions.defaults(), Map.of(), ArgumentUsageListener.NONE);
  }

  public String compositeClassOf(String alias) {
    return compositeInstances.get(alias);
  }

  public ArgumentUsageListener usageListener() {
    return usageListener;
  }
}
