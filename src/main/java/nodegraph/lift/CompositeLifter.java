package nodegraph.lift;

import nodegraph.lift.composite.PinDeclarationParser;
import nodegraph.lift.composite.PinSpec;
import nodegraph.lift.composite.ParamUsageTracker;
import nodegraph.lift.composite.PortRef;
import nodegraph.lift.composite.StateFieldSources;
import nodegraph.lift.composite.VirtualPin;
import nodegraph.lift.composite.VirtualPinResolver;
import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.ClassDef;
import nodegraph.lift.core.SourceModel.Expr;
import nodegraph.lift.core.SourceModel.FunctionDef;
import nodegraph.lift.core.SourceModel.Stmt;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.ir.ConstantScope;
import nodegraph.lift.ir.FlowFrontier;
import nodegraph.lift.ir.LiftContext;
import nodegraph.lift.ir.LiftOptions;
import nodegraph.lift.ir.NodeIdGenerator;
import nodegraph.lift.ir.StatementLifter;
import nodegraph.lift.ir.VarEnv;
import nodegraph.lift.registry.NodeRegistry;
import nodegraph.lift.support.Diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 复合节点类提升：每个入口方法单独提升成一张方法图并解析其虚拟引脚，
 * 再合并为一张复合节点图。
 *
 * <p>方法体没有事件节点，首条流程连线不生成；方法图之间共享 id 生成器，合并时 id 不冲突。</p>
 */
public final class CompositeLifter {
  private static final Logger LOGGER = Logger.getLogger(CompositeLifter.class.getName());

  public static final String COMPOSITE_DECORATOR = "composite_class";

  private final NodeRegistry registry;
  private final LiftOptions options;

  public CompositeLifter(NodeRegistry registry) {
    this(registry, LiftOptions.defaults());
  }

  public CompositeLifter(NodeRegistry registry, LiftOptions options) {
    this.registry = registry;
    this.options = options;
  }

  /**
   * 提升模块中的复合节点类（{@code @composite_class} 装饰，或第一个带入口方法的类）。
   *
   * @throws IllegalArgumentException 模块中没有复合节点类
   */
  public CompositeLiftResult lift(SourceModel.Module module) {
    ClassDef cls = findCompositeClass(module);
    if (cls == null) {
      throw new IllegalArgumentException("no composite class in module " + module.name);
    }
    ConstantScope constants = ConstantScope.forModule(module);
    return lift(cls, constants);
  }

  public CompositeLiftResult lift(ClassDef cls, ConstantScope constants) {
    constants.collectClass(cls);
    Diagnostics diagnostics = new Diagnostics();
    Graph merged = new Graph(cls.name, cls.name);
    merged.metadata().put("composite_class", cls.name);
    NodeIdGenerator ids = new NodeIdGenerator();
    Map<String, String> instances = GraphLifter.compositeInstances(cls, registry);
    List<VirtualPin> pins = new ArrayList<>();
    StateFieldSources stateFields = StateFieldSources.of(cls);
    Map<StateFieldSources.Source, List<PortRef>> stateUsages = new LinkedHashMap<>();

    for (FunctionDef method : PinDeclarationParser.entryMethods(cls)) {
      Graph methodGraph = new Graph(cls.name + "." + method.name, method.name);
      ParamUsageTracker tracker = new ParamUsageTracker(method, stateFields);
      LiftContext ctx = new LiftContext(registry, diagnostics, methodGraph, ids, constants, options, instances, tracker);
      VarEnv env = new VarEnv();
      FlowFrontier end = new StatementLifter(ctx, env).liftBody(method.body, FlowFrontier.EMPTY, true);

      List<PinSpec> declared = PinDeclarationParser.parse(method);
      List<VirtualPin> resolved = new VirtualPinResolver(methodGraph, diagnostics).resolve(declared, env, tracker, end);

      Map<String, String> renames = merged.merge(methodGraph);
      resolved.forEach(p -> p.renameNodes(renames));
      mergePortTypeOverrides(merged, methodGraph, renames);
      pins.addAll(resolved);
      tracker.foreignUsages().forEach((source, sites) -> {
        List<PortRef> target = stateUsages.computeIfAbsent(source, k -> new ArrayList<>());
        for (PortRef ref : sites) target.add(new PortRef(renames.getOrDefault(ref.nodeId(), ref.nodeId()), ref.port()));
      });
      LOGGER.log(Level.FINE, "复合节点方法 {0}：{1} 个节点，{2} 个引脚",
        new Object[]{method.name, methodGraph.nodes().size(), resolved.size()});
    }
    // 字段可能在后面的方法里才被读取，所有方法合并后再补映射、再判定未映射
    VirtualPinResolver.applyStateUsages(pins, stateUsages);
    VirtualPinResolver.markUnmapped(pins, diagnostics);
    VirtualPinResolver.propagateToCopies(pins, merged);
    return new CompositeLiftResult(merged, pins, diagnostics);
  }

  @SuppressWarnings("unchecked")
  private static void mergePortTypeOverrides(Graph merged, Graph methodGraph, Map<String, String> renames) {
    Object source = methodGraph.metadata().get(StatementLifter.PORT_TYPE_OVERRIDES);
    if (!(source instanceof Map<?, ?> overrides)) return;
    Map<String, Object> target = (Map<String, Object>)
      merged.metadata().computeIfAbsent(StatementLifter.PORT_TYPE_OVERRIDES, k -> new LinkedHashMap<String, Object>());
    overrides.forEach((nodeId, ports) -> target.put(renames.getOrDefault((String) nodeId, (String) nodeId), ports));
  }

  static ClassDef findCompositeClass(SourceModel.Module module) {
    ClassDef withEntries = null;
    for (Stmt s : SourceTrees.orEmpty(module.body)) {
      if (!(s instanceof ClassDef cls)) continue;
      for (Expr d : SourceTrees.orEmpty(cls.decorators)) {
        Expr target = d instanceof SourceModel.Call c ? c.func : d;
        if (COMPOSITE_DECORATOR.equals(SourceTrees.dottedName(target))) return cls;
      }
      if (withEntries == null && !PinDeclarationParser.entryMethods(cls).isEmpty()) withEntries = cls;
    }
    return withEntries;
  }
}
