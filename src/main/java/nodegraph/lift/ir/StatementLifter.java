package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.support.ErrorMessages;
import nodegraph.lift.support.LiftConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 语句提升器：逐条遍历语句列表，按语句种类分派，并维护流程前沿。
 *
 * <p>失败策略：无法解析或不支持的语句只产生诊断并保持前沿不变，不影响后续语句。</p>
 */
public final class StatementLifter {
  private static final Logger LOGGER = Logger.getLogger(StatementLifter.class.getName());

  public static final String PORT_TYPE_OVERRIDES = "port_type_overrides";

  private final LiftContext ctx;
  private final VarEnv env;
  private final ExpressionFlattener flattener;
  private final LocalVariableSynthesizer locals;
  private final BranchFlowBuilder branches;
  private final LoopFlowBuilder loops;

  public StatementLifter(LiftContext ctx, VarEnv env) {
    this.ctx = ctx;
    this.env = env;
    NodeFactory factory = new NodeFactory(ctx);
    this.flattener = new ExpressionFlattener(ctx, env, factory);
    this.locals = new LocalVariableSynthesizer(ctx, env, factory, flattener);
    this.branches = new BranchFlowBuilder(ctx, env, factory, flattener, this);
    this.loops = new LoopFlowBuilder(ctx, env, factory, flattener, this);
  }

  public VarEnv env() {
    return env;
  }

  /**
   * 提升一个方法体。首次调用时先对整个方法体做赋值分析。
   *
   * @param start 初始前沿（事件/入口节点；没有时为 {@link FlowFrontier#EMPTY}）
   * @param suppressInitialEdge 为 true 时第一条流程连线不生成
   * @return 方法体结束时的前沿
   */
  public FlowFrontier liftBody(List<Stmt> body, FlowFrontier start, boolean suppressInitialEdge) {
    if (env.analysis() == null) {
      env.applyAnalysis(AssignmentAnalysis.analyze(body));
    }
    return liftBlock(body, start, suppressInitialEdge);
  }

  /**
   * 提升一个语句块。遇到 break 时停止处理该块剩余语句并返回空前沿。
   */
  FlowFrontier liftBlock(List<Stmt> stmts, FlowFrontier start, boolean suppressInitialEdge) {
    FlowCursor cursor = new FlowCursor(ctx.graph, start, suppressInitialEdge);
    for (Stmt s : SourceTrees.orEmpty(stmts)) {
      if (LiftConfig.DEBUG) {
        LOGGER.log(Level.INFO, "提升语句 {0} (line {1})", new Object[]{s.getClass().getSimpleName(), s.line});
      }
      if (s instanceof Assign a) {
        liftAssign(a, cursor);
      } else if (s instanceof AnnAssign aa) {
        liftAnnAssign(aa, cursor);
      } else if (s instanceof ExprStmt es) {
        liftExprStmt(es, cursor);
      } else if (s instanceof If iff) {
        cursor.setFrontier(branches.liftIf(iff, cursor));
      } else if (s instanceof Match m) {
        cursor.setFrontier(branches.liftMatch(m, cursor));
      } else if (s instanceof For f) {
        cursor.setFrontier(loops.liftFor(f, cursor));
      } else if (s instanceof Break b) {
        if (liftBreak(b, cursor)) return FlowFrontier.EMPTY;
      } else if (s instanceof While) {
        LOGGER.log(Level.FINE, "while 循环不受支持，已忽略 (line {0})", s.line);
      }
      // Pass / Return / Import / 嵌套定义：不生成节点
    }
    return cursor.frontier();
  }

  // ---- 赋值 ----

  /**
   * @return 赋值生成的节点；未生成节点时为 null
   */
  private GraphNode liftAssign(Assign a, FlowCursor cursor) {
    Expr value = a.value;
    if (a.target instanceof Name target) {
      return liftNameAssign(target.id, value, a, cursor);
    }
    if (a.target instanceof TupleE tuple) {
      if (!(value instanceof Call call)) {
        ctx.diagnostics.warn(ErrorMessages.unsupportedExpression("tuple assignment from " + SourceTrees.kindOf(value), a.line));
        return null;
      }
      GraphNode node = flattener.materializeCall(call, a, cursor);
      if (node != null) {
        List<String> names = new ArrayList<>();
        for (Expr e : SourceTrees.orEmpty(tuple.elts)) {
          names.add(e instanceof Name n ? n.id : null);
        }
        registerOutputs(node, call, names);
      }
      return node;
    }
    // self.x = ...：调用照常实例化，实例状态赋值本身不生成节点
    if (value instanceof Call call) {
      return flattener.materializeCall(call, a, cursor);
    }
    return null;
  }

  private GraphNode liftNameAssign(String name, Expr value, Stmt stmt, FlowCursor cursor) {
    if (value instanceof Call call) {
      if (flattener.isMarkerCall(call)) return null;
      if (locals.shouldModel(name)) {
        locals.assign(name, value, stmt, cursor);
        return null;
      }
      // 赋值语句总是实例化，不做“未使用”裁剪
      GraphNode node = flattener.materializeCall(call, stmt, cursor);
      if (node != null) registerOutputs(node, call, List.of(name));
      return node;
    }

    if (value instanceof Name source) {
      if (locals.shouldBypassAlias(name, value)) {
        locals.assign(name, value, stmt, cursor);
        return null;
      }
      Binding b = env.get(source.id);
      if (b != null) {
        env.set(name, b);
        return null;
      }
    }

    if (value instanceof FString || value instanceof DictE) {
      ctx.diagnostics.warn(ErrorMessages.unsupportedLiteral(name, SourceTrees.kindOf(value), stmt.line));
      return null;
    }

    Object constant = ctx.evaluator.evaluate(value, env);
    if (constant != ConstantEvaluator.NOT_CONSTANT) {
      if (locals.shouldModel(name)) {
        locals.assign(name, value, stmt, cursor);
      } else {
        env.setConstant(name, constant);
      }
      return null;
    }

    if (value instanceof Name || value instanceof Attribute) {
      // 未绑定的别名（如入口参数）由参数追踪处理
      LOGGER.log(Level.FINE, "变量 {0} 的来源未绑定 (line {1})", new Object[]{name, stmt.line});
      return null;
    }
    ctx.diagnostics.warn(ErrorMessages.unsupportedLiteral(name, SourceTrees.kindOf(value), stmt.line));
    return null;
  }

  private void liftAnnAssign(AnnAssign aa, FlowCursor cursor) {
    if (aa.value == null) return;
    Assign plain = new Assign();
    plain.target = aa.target;
    plain.value = aa.value;
    plain.line = aa.line;
    plain.endLine = aa.endLine;
    GraphNode node = liftAssign(plain, cursor);
    if (node != null && aa.annotation instanceof StringE type) {
      List<Port> outputs = PortKinds.dataOutputs(node);
      if (!outputs.isEmpty()) recordPortTypeOverride(node, outputs.get(0).name, type.value);
    }
  }

  @SuppressWarnings("unchecked")
  private void recordPortTypeOverride(GraphNode node, String port, String type) {
    Map<String, Map<String, String>> overrides = (Map<String, Map<String, String>>)
      ctx.graph.metadata().computeIfAbsent(PORT_TYPE_OVERRIDES, k -> new LinkedHashMap<String, Map<String, String>>());
    overrides.computeIfAbsent(node.id(), k -> new LinkedHashMap<>()).put(port, type);
  }

  /**
   * 登记输出绑定：单目标绑定第一个数据输出，元组目标按下标绑定数据输出。
   * 输出由目标决定的节点先按目标名补齐输出端口。
   */
  private void registerOutputs(GraphNode node, Call call, List<String> targets) {
    Optional<NodeSpec> spec = flattener.resolve(call);
    if (spec.isPresent() && spec.get().outputsFromTargets) {
      for (String t : targets) {
        if (t != null) node.addOutput(new Port(t, PortKinds.GENERIC_TYPE));
      }
    }
    List<Port> outputs = PortKinds.dataOutputs(node);
    for (int i = 0; i < targets.size() && i < outputs.size(); i++) {
      String t = targets.get(i);
      if (t == null) continue;
      env.set(t, Binding.port(node.id(), outputs.get(i).name));
      node.setCustomVarName(outputs.get(i).name, t);
    }
  }

  // ---- 表达式语句 ----

  private void liftExprStmt(ExprStmt es, FlowCursor cursor) {
    if (!(es.value instanceof Call call)) return;
    if (flattener.isMarkerCall(call)) return;
    if (!flattener.isCompositeCall(call) && call.func instanceof Name) {
      Optional<NodeSpec> spec = flattener.resolve(call);
      // 裸表达式的纯数据调用没有任何消费者，直接丢弃
      if (spec.isPresent() && !spec.get().hasFlowPorts()) {
        LOGGER.log(Level.FINE, "丢弃未使用的纯数据调用 {0} (line {1})", new Object[]{spec.get().name, es.line});
        return;
      }
    }
    flattener.materializeCall(call, es, cursor);
  }

  // ---- break ----

  /**
   * @return 是否终止当前语句块
   */
  private boolean liftBreak(Break b, FlowCursor cursor) {
    GraphNode loop = env.currentLoop();
    if (loop == null) {
      ctx.diagnostics.warn(ErrorMessages.breakOutsideLoop(b.line));
      return false;
    }
    for (FlowFrontier.Anchor anchor : cursor.frontier().anchors()) {
      ctx.graph.addEdge(anchor.node().id(), anchor.resolvedPort(), loop.id(), PortKinds.BREAK_LOOP);
    }
    return true;
  }
}
