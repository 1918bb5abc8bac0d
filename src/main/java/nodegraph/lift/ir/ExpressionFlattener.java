package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.support.ErrorMessages;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 调用表达式展平。
 *
 * <p>嵌套调用按深度优先先行实例化为独立节点（最内层最先），再由外层节点按实参绑定到的
 * 端口名接收数据连线。带流程端口的嵌套节点先于外层节点挂到流程前沿上。</p>
 */
final class ExpressionFlattener {
  private static final Logger LOGGER = Logger.getLogger(ExpressionFlattener.class.getName());

  private final LiftContext ctx;
  private final VarEnv env;
  private final NodeFactory factory;

  ExpressionFlattener(LiftContext ctx, VarEnv env, NodeFactory factory) {
    this.ctx = ctx;
    this.env = env;
    this.factory = factory;
  }

  /** 调用是否为 {@code self.实例.方法(...)} 形式的复合节点调用 */
  boolean isCompositeCall(Call call) {
    return compositeAlias(call) != null;
  }

  private String compositeAlias(Call call) {
    if (call.func instanceof Attribute method && method.value instanceof Attribute inst
        && "self".equals(SourceTrees.dottedName(inst.value))) {
      return ctx.compositeClassOf(inst.attr) != null ? inst.attr : null;
    }
    return null;
  }

  boolean isMarkerCall(Call call) {
    return call.func instanceof Name n && ctx.options.markerCalls().contains(n.id);
  }

  /** 调用对应的节点定义；复合节点调用解析到复合节点类 */
  Optional<NodeSpec> resolve(Call call) {
    String alias = compositeAlias(call);
    if (alias != null) return ctx.registry.resolve(ctx.compositeClassOf(alias));
    if (call.func instanceof Name n) return ctx.registry.resolve(n.id);
    return Optional.empty();
  }

  /**
   * 复合节点调用的方法出口；节点库没有方法信息时取全部流程输出。
   */
  List<String> compositeExits(Call call, NodeSpec spec) {
    String method = ((Attribute) call.func).attr;
    NodeSpec.CompositeMethod m = spec.methods.get(method);
    if (m != null && m.exits != null && !m.exits.isEmpty()) return m.exits;
    return spec.outputs.stream().filter(p -> spec.isFlowPort(p, true)).map(p -> p.name).toList();
  }

  /**
   * 实例化调用（含嵌套实参）。节点带流程端口时挂到流程前沿并成为新前沿。
   *
   * @return 新节点；调用无法解析时返回 null（已记录诊断）
   */
  GraphNode materializeCall(Call call, Stmt stmt, FlowCursor cursor) {
    int line = stmt != null ? stmt.line : 0;
    if (isMarkerCall(call)) return null;
    boolean composite = isCompositeCall(call);
    if (!composite && !(call.func instanceof Name)) {
      ctx.diagnostics.warn(ErrorMessages.unsupportedMethodCall(String.valueOf(SourceTrees.dottedName(call.func)), line));
      return null;
    }
    Optional<NodeSpec> resolved = resolve(call);
    if (resolved.isEmpty()) {
      String callee = composite ? SourceTrees.dottedName(call.func) : SourceTrees.calleeName(call);
      ctx.diagnostics.warn(ErrorMessages.unresolvedCall(callee, line));
      return null;
    }
    NodeSpec spec = resolved.get();
    ArgumentBinder.Bindings bindings = ArgumentBinder.bind(call, spec, ctx.options);

    // 深度优先：先实例化嵌套调用
    Map<String, GraphNode> nested = flattenArguments(bindings, stmt, cursor);
    GraphNode node = factory.create(spec, bindings, stmt, env);
    wireArguments(node, bindings, nested);

    if (composite) {
      attachComposite(node, call, spec, cursor);
    } else if (PortKinds.isFlowNode(node)) {
      cursor.attach(node);
    }
    return node;
  }

  private void attachComposite(GraphNode node, Call call, NodeSpec spec, FlowCursor cursor) {
    String method = ((Attribute) call.func).attr;
    NodeSpec.CompositeMethod m = spec.methods.get(method);
    String flowIn = m != null && m.flowIn != null ? m.flowIn : PortKinds.defaultFlowInput(node);
    if (!node.hasInput(flowIn)) return;
    cursor.connect(node, flowIn);
    List<String> exits = compositeExits(call, spec);
    cursor.setFrontier(exits.isEmpty() ? FlowFrontier.of(node) : FlowFrontier.at(node, exits.get(0)));
  }

  private Map<String, GraphNode> flattenArguments(ArgumentBinder.Bindings bindings, Stmt stmt, FlowCursor cursor) {
    Map<String, GraphNode> nested = new LinkedHashMap<>();
    for (ArgumentBinder.BoundArgument arg : bindings.arguments()) {
      if (arg.expr() instanceof Call inner) {
        GraphNode n = materializeCall(inner, stmt, cursor);
        if (n != null) nested.put(arg.port(), n);
      }
    }
    return nested;
  }

  private void wireArguments(GraphNode node, ArgumentBinder.Bindings bindings, Map<String, GraphNode> nested) {
    for (ArgumentBinder.BoundArgument arg : bindings.arguments()) {
      if (!node.hasInput(arg.port())) continue;
      GraphNode producer = nested.get(arg.port());
      if (producer != null) {
        connectOutput(producer, node, arg.port());
      } else if (!(arg.expr() instanceof Call)) {
        wireReference(arg.expr(), node, arg.port());
      }
    }
  }

  /**
   * 把任意值表达式接到 dst.port：调用先实例化再连数据线，常量写入常量表，变量按绑定连线。
   *
   * @return 是否识别了该表达式形态
   */
  boolean wireValue(Expr value, GraphNode dst, String port, Stmt stmt, FlowCursor cursor) {
    if (value instanceof Call call) {
      GraphNode producer = materializeCall(call, stmt, cursor);
      if (producer != null) connectOutput(producer, dst, port);
      return true;
    }
    Object constant = ctx.evaluator.evaluate(value, env);
    if (constant != ConstantEvaluator.NOT_CONSTANT) {
      dst.setConstant(port, constant);
      return true;
    }
    if (value instanceof Name || value instanceof Attribute) {
      wireReference(value, dst, port);
      return true;
    }
    return false;
  }

  /** 名称引用：通知参数追踪，已绑定时连数据线 */
  void wireReference(Expr e, GraphNode dst, String port) {
    ctx.usageListener().onArgument(dst, port, e);
    if (e instanceof Name n) {
      Binding b = env.get(n.id);
      if (b == null) {
        LOGGER.log(Level.FINE, "未绑定的变量 {0}，留给校验器报告", n.id);
      } else if (!b.isConstant()) {
        ctx.graph.addEdge(b.nodeId, b.port, dst.id(), port);
      }
    }
  }

  /** producer 的第一个数据输出 → dst.port */
  void connectOutput(GraphNode producer, GraphNode dst, String port) {
    List<Port> outputs = PortKinds.dataOutputs(producer);
    if (outputs.isEmpty()) {
      LOGGER.log(Level.FINE, "节点 {0} 没有数据输出，跳过连线", producer.id());
      return;
    }
    ctx.graph.addEdge(producer.id(), outputs.get(0).name, dst.id(), port);
  }
}
