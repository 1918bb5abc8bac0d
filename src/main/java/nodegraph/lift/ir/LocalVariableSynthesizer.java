package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.Expr;
import nodegraph.lift.core.SourceModel.Name;
import nodegraph.lift.core.SourceModel.Stmt;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.registry.BuiltinNodes;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 局部变量合成：为在多个分支中赋值、并在分支后被读取的变量生成 获取/设置 节点对。
 *
 * <p>获取节点是合并点，分支之后的读取都连到它的 {@code value} 输出；每个赋值点生成一个
 * 设置节点，写入获取节点的句柄。</p>
 */
final class LocalVariableSynthesizer {
  private static final Logger LOGGER = Logger.getLogger(LocalVariableSynthesizer.class.getName());

  private final LiftContext ctx;
  private final VarEnv env;
  private final NodeFactory factory;
  private final ExpressionFlattener flattener;

  LocalVariableSynthesizer(LiftContext ctx, VarEnv env, NodeFactory factory, ExpressionFlattener flattener) {
    this.ctx = ctx;
    this.env = env;
    this.factory = factory;
    this.flattener = flattener;
  }

  /** 该变量的赋值是否需要走局部变量节点 */
  boolean shouldModel(String name) {
    return env.isMultiAssignCandidate(name) || env.hasLocalHandle(name);
  }

  /**
   * 别名赋值 {@code x = y} 是否必须绕过直接改名：目标是候选变量，或已有局部变量句柄。
   * 否则进行中的合并点会与其中一个分支断开。
   */
  boolean shouldBypassAlias(String target, Expr value) {
    return value instanceof Name && shouldModel(target);
  }

  /**
   * 在当前位置为 name 生成设置节点（必要时先创建获取节点），并把 name 绑定到获取节点的值输出。
   */
  void assign(String name, Expr value, Stmt stmt, FlowCursor cursor) {
    GraphNode get = ensureGetNode(name, stmt);
    GraphNode set = factory.createBuiltin(BuiltinNodes.SET_LOCAL_VARIABLE, stmt);

    // 值先实例化（带流程的调用会先挂到前沿上），设置节点随后挂接
    if (!flattener.wireValue(value, set, BuiltinNodes.VALUE, stmt, cursor)) {
      LOGGER.log(Level.FINE, "局部变量 {0} 的赋值表达式无法连线", name);
    }
    cursor.attach(set);
    ctx.graph.addEdge(get.id(), BuiltinNodes.LOCAL_VARIABLE, set.id(), BuiltinNodes.LOCAL_VARIABLE);

    env.set(name, Binding.port(get.id(), BuiltinNodes.VALUE));
  }

  private GraphNode ensureGetNode(String name, Stmt stmt) {
    Binding handle = env.getLocalHandle(name);
    if (handle != null) {
      return ctx.graph.node(handle.nodeId);
    }
    GraphNode get = factory.createBuiltin(BuiltinNodes.GET_LOCAL_VARIABLE, stmt);
    get.setCustomVarName(BuiltinNodes.VALUE, name);
    env.setLocalHandle(name, Binding.port(get.id(), BuiltinNodes.LOCAL_VARIABLE));
    LOGGER.log(Level.FINE, "为变量 {0} 合成局部变量节点 {1}", new Object[]{name, get.id()});
    return get;
  }
}
