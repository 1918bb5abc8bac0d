package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.registry.PortSpec;
import nodegraph.lift.support.ErrorMessages;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 节点工厂：按节点定义建端口、展开可变参数、把字面量实参写入常量表，并把节点加入图。
 */
public final class NodeFactory {
  private static final Logger LOGGER = Logger.getLogger(NodeFactory.class.getName());

  /** 没有可变实参时补齐端口使用的常量 */
  static final Long EMPTY_VARIADIC_CONSTANT = 0L;

  private final LiftContext ctx;

  public NodeFactory(LiftContext ctx) {
    this.ctx = ctx;
  }

  /**
   * 按节点定义与实参绑定构造节点。
   *
   * <p>可变参数范围：每个实参一个端口；没有任何可变实参时补齐最小端口集
   * （简单范围一个端口，键值范围一对端口），保证节点结构不为空。</p>
   */
  GraphNode create(NodeSpec spec, ArgumentBinder.Bindings bindings, SourceModel.Stmt stmt, VarEnv env) {
    GraphNode node = newNode(spec, stmt);
    int line = stmt != null ? stmt.line : 0;

    for (ArgumentBinder.BoundArgument arg : bindings.arguments()) {
      if (!node.hasInput(arg.port())) {
        if (arg.variadic() || spec.dynamicPorts) {
          node.addInput(new Port(arg.port(), arg.type()));
        } else {
          ctx.diagnostics.warn(ErrorMessages.unknownPort(spec.name, arg.port(), line));
          continue;
        }
      }
      Object value = ctx.evaluator.evaluate(arg.expr(), env);
      if (value != ConstantEvaluator.NOT_CONSTANT) {
        node.setConstant(arg.port(), value);
      }
    }
    if (!bindings.overflow().isEmpty()) {
      ctx.diagnostics.warn(ErrorMessages.unknownPort(spec.name, "#" + bindings.overflow().size() + " extra", line));
    }

    NodeSpec.VariadicRange range = spec.variadicRange();
    if (range != null && bindings.variadicCount() == 0) {
      if (range.keyed()) {
        addVariadicPort(node, range.keyPort(0), range.keyType());
        addVariadicPort(node, range.valuePort(0), range.valueType());
      } else {
        addVariadicPort(node, range.simplePort(0), range.valueType());
      }
    }

    ctx.graph.addNode(node);
    return node;
  }

  private static void addVariadicPort(GraphNode node, String port, String type) {
    node.addInput(new Port(port, type));
    node.setConstant(port, EMPTY_VARIADIC_CONSTANT);
  }

  /** 构造内置合成节点（分支、循环、局部变量）并加入图 */
  GraphNode createBuiltin(String title, SourceModel.Stmt stmt) {
    GraphNode node = newNode(BuiltinNodes.require(title), stmt);
    ctx.graph.addNode(node);
    return node;
  }

  /**
   * 构造事件节点：输出为 {@code flow_out} 加每个事件参数一个数据输出。
   */
  public GraphNode createEventNode(String eventName, List<SourceModel.Param> params, SourceModel.Stmt stmt) {
    GraphNode node = new GraphNode(ctx.ids.eventId(eventName), eventName, BuiltinNodes.EVENT);
    node.addOutput(new Port(PortKinds.FLOW_OUT, PortKinds.FLOW_TYPE));
    for (SourceModel.Param p : params) {
      node.addOutput(new Port(p.name, annotationType(p.annotation)));
    }
    if (stmt != null) node.setSourceSpan(stmt.line, stmt.endLine);
    ctx.graph.addNode(node);
    LOGGER.log(Level.FINE, "事件节点 {0} 参数 {1}", new Object[]{node.id(), params.size()});
    return node;
  }

  /** 注解转端口类型：字符串注解取其内容，名称注解取名称，缺省为 Generic */
  public static String annotationType(SourceModel.Expr annotation) {
    if (annotation instanceof SourceModel.StringE s) return s.value;
    String dotted = SourceTrees.dottedName(annotation);
    return dotted != null ? dotted : PortKinds.GENERIC_TYPE;
  }

  private GraphNode newNode(NodeSpec spec, SourceModel.Stmt stmt) {
    String category = spec.category;
    if (category == null) {
      category = spec.isComposite() ? BuiltinNodes.COMPOSITE
        : spec.hasFlowPorts() ? BuiltinNodes.EXECUTION : BuiltinNodes.QUERY;
    }
    GraphNode node = new GraphNode(ctx.ids.nodeId(spec.name), spec.name, category);
    for (PortSpec p : spec.inputs) {
      if (p.isRange()) continue;
      node.addInput(new Port(p.name, p.type));
      if (spec.isFlowPort(p, false)) node.declareFlowPort(p.name);
    }
    for (PortSpec p : spec.outputs) {
      node.addOutput(new Port(p.name, p.type));
      if (spec.isFlowPort(p, true)) node.declareFlowPort(p.name);
    }
    node.setCompositeId(spec.compositeId);
    if (stmt != null) node.setSourceSpan(stmt.line, stmt.endLine);
    return node;
  }
}
