package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.support.ErrorMessages;

import java.util.List;

/**
 * for 循环的降级：{@code range(...)} 为有限循环，其他可迭代对象为列表迭代循环。
 *
 * <p>循环体以 (循环节点, loop_body) 为初始前沿提升，循环体的结束前沿不向外传播；
 * 返回给调用方的前沿是 (循环节点, loop_complete)。</p>
 */
final class LoopFlowBuilder {
  private final LiftContext ctx;
  private final VarEnv env;
  private final NodeFactory factory;
  private final ExpressionFlattener flattener;
  private final StatementLifter lifter;

  LoopFlowBuilder(LiftContext ctx, VarEnv env, NodeFactory factory, ExpressionFlattener flattener, StatementLifter lifter) {
    this.ctx = ctx;
    this.env = env;
    this.factory = factory;
    this.flattener = flattener;
    this.lifter = lifter;
  }

  FlowFrontier liftFor(For loopStmt, FlowCursor cursor) {
    GraphNode loop;
    String valuePort;
    if (SourceTrees.isCallTo(loopStmt.iter, "range")) {
      loop = factory.createBuiltin(BuiltinNodes.FINITE_LOOP, loopStmt);
      valuePort = BuiltinNodes.CURRENT_VALUE;
      List<Expr> args = SourceTrees.orEmpty(((Call) loopStmt.iter).args);
      if (args.size() == 1) {
        loop.setConstant(BuiltinNodes.START_VALUE, 0L);
        wire(args.get(0), loop, BuiltinNodes.END_VALUE, loopStmt, cursor);
      } else if (args.size() >= 2) {
        wire(args.get(0), loop, BuiltinNodes.START_VALUE, loopStmt, cursor);
        wire(args.get(1), loop, BuiltinNodes.END_VALUE, loopStmt, cursor);
      }
    } else {
      loop = factory.createBuiltin(BuiltinNodes.LIST_ITERATION_LOOP, loopStmt);
      valuePort = BuiltinNodes.ITERATION_VALUE;
      wire(loopStmt.iter, loop, BuiltinNodes.ITERATION_LIST, loopStmt, cursor);
    }
    cursor.attach(loop);

    if (loopStmt.target instanceof Name target) {
      env.set(target.id, Binding.port(loop.id(), valuePort));
      loop.setCustomVarName(valuePort, target.id);
    }

    env.pushLoop(loop);
    try {
      lifter.liftBlock(loopStmt.body, FlowFrontier.at(loop, PortKinds.LOOP_BODY), false);
    } finally {
      env.popLoop();
    }
    return FlowFrontier.at(loop, PortKinds.LOOP_COMPLETE);
  }

  private void wire(Expr value, GraphNode loop, String port, Stmt stmt, FlowCursor cursor) {
    if (!flattener.wireValue(value, loop, port, stmt, cursor)) {
      ctx.diagnostics.warn(ErrorMessages.unsupportedExpression(SourceTrees.kindOf(value), stmt.line));
    }
  }
}
