package nodegraph.lift;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.Assign;
import nodegraph.lift.core.SourceModel.Attribute;
import nodegraph.lift.core.SourceModel.Call;
import nodegraph.lift.core.SourceModel.ClassDef;
import nodegraph.lift.core.SourceModel.FunctionDef;
import nodegraph.lift.core.SourceModel.Name;
import nodegraph.lift.core.SourceModel.Param;
import nodegraph.lift.core.SourceModel.Stmt;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.ir.Binding;
import nodegraph.lift.ir.ConstantScope;
import nodegraph.lift.ir.FlowFrontier;
import nodegraph.lift.ir.LiftContext;
import nodegraph.lift.ir.LiftOptions;
import nodegraph.lift.ir.NodeFactory;
import nodegraph.lift.ir.NodeIdGenerator;
import nodegraph.lift.ir.StatementLifter;
import nodegraph.lift.ir.VarEnv;
import nodegraph.lift.registry.NodeRegistry;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.support.Diagnostics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 事件图提升入口。
 *
 * <p>在模块中找到节点图类（含事件前缀方法的类），收集模块常量与类字段常量，登记
 * {@code __init__} 中的复合节点实例，然后为每个事件方法生成一个事件节点并提升方法体。</p>
 *
 * <pre>
 * class 示例图:
 *     def __init__(self, game, owner_entity):
 *         self.game = game
 *
 *     def on_实体创建时(self, 事件源实体):
 *         打印字符串(self.game, 字符串="hello")
 * </pre>
 */
public final class GraphLifter {
  private static final Logger LOGGER = Logger.getLogger(GraphLifter.class.getName());

  private final NodeRegistry registry;
  private final LiftOptions options;

  public GraphLifter(NodeRegistry registry) {
    this(registry, LiftOptions.defaults());
  }

  public GraphLifter(NodeRegistry registry, LiftOptions options) {
    this.registry = registry;
    this.options = options;
  }

  public LiftResult lift(SourceModel.Module module) {
    Diagnostics diagnostics = new Diagnostics();
    ConstantScope constants = ConstantScope.forModule(module);
    ClassDef cls = findGraphClass(module, options.eventPrefix());
    String unitName = module.name != null ? module.name : (cls != null ? cls.name : "graph");
    Graph graph = new Graph(unitName, cls != null ? cls.name : unitName);
    if (cls == null) {
      LOGGER.log(Level.WARNING, "模块 {0} 中没有事件方法", unitName);
      return new LiftResult(graph, diagnostics);
    }
    constants.collectClass(cls);

    LiftContext ctx = new LiftContext(registry, diagnostics, graph, new NodeIdGenerator(), constants, options,
      compositeInstances(cls, registry), null);
    for (Stmt s : SourceTrees.orEmpty(cls.body)) {
      if (s instanceof FunctionDef fn && fn.name.startsWith(options.eventPrefix())) {
        liftEvent(ctx, fn);
      }
    }
    LOGGER.log(Level.FINE, "提升完成：{0} 个节点，{1} 条连线",
      new Object[]{graph.nodes().size(), graph.edges().size()});
    return new LiftResult(graph, diagnostics);
  }

  /**
   * 提升不属于任何事件的语句列表：没有初始前沿，首条流程连线不生成。
   */
  public LiftResult liftStatements(List<Stmt> body) {
    Diagnostics diagnostics = new Diagnostics();
    Graph graph = new Graph("statements", "statements");
    LiftContext ctx = new LiftContext(registry, diagnostics, graph, new NodeIdGenerator(), ConstantScope.empty(),
      options, Map.of(), null);
    new StatementLifter(ctx, new VarEnv()).liftBody(body, FlowFrontier.EMPTY, true);
    return new LiftResult(graph, diagnostics);
  }

  private void liftEvent(LiftContext ctx, FunctionDef fn) {
    String eventName = fn.name.substring(options.eventPrefix().length());
    List<Param> params = new ArrayList<>();
    for (Param p : SourceTrees.orEmpty(fn.params)) {
      if (!"self".equals(p.name)) params.add(p);
    }

    VarEnv env = new VarEnv();
    GraphNode event = new NodeFactory(ctx).createEventNode(eventName, params, fn);
    for (Param p : params) {
      env.set(p.name, Binding.port(event.id(), p.name));
    }
    new StatementLifter(ctx, env).liftBody(fn.body, FlowFrontier.of(event), false);

    ctx.graph.eventFlowOrder().add(event.id());
    ctx.graph.eventFlowTitles().add(eventName);
  }

  /** 第一个包含事件前缀方法的类 */
  static ClassDef findGraphClass(SourceModel.Module module, String eventPrefix) {
    for (Stmt s : SourceTrees.orEmpty(module.body)) {
      if (!(s instanceof ClassDef cls)) continue;
      for (Stmt member : SourceTrees.orEmpty(cls.body)) {
        if (member instanceof FunctionDef fn && fn.name.startsWith(eventPrefix)) return cls;
      }
    }
    return null;
  }

  /**
   * {@code __init__} 中 {@code self.别名 = 复合节点类(...)} 的实例表。只登记节点库中带复合 id 的类。
   */
  static Map<String, String> compositeInstances(ClassDef cls, NodeRegistry registry) {
    Map<String, String> instances = new LinkedHashMap<>();
    for (Stmt s : SourceTrees.orEmpty(cls.body)) {
      if (!(s instanceof FunctionDef fn) || !"__init__".equals(fn.name)) continue;
      for (Stmt inner : SourceTrees.orEmpty(fn.body)) {
        if (inner instanceof Assign a && a.target instanceof Attribute attr
            && "self".equals(SourceTrees.dottedName(attr.value))
            && a.value instanceof Call call && call.func instanceof Name className) {
          Optional<NodeSpec> spec = registry.resolve(className.id);
          if (spec.isPresent() && spec.get().isComposite()) {
            instances.put(attr.attr, className.id);
          }
        }
      }
    }
    return instances;
  }
}
