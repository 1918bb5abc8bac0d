package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.support.ErrorMessages;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * if/else 与 match 的降级。
 *
 * <p>每一侧以 (分支节点, 指定出口) 为初始前沿递归提升，各侧结果前沿拼接后返回，
 * 使任意数量的出口都能汇聚到下一条语句。</p>
 */
final class BranchFlowBuilder {
  private final LiftContext ctx;
  private final VarEnv env;
  private final NodeFactory factory;
  private final ExpressionFlattener flattener;
  private final StatementLifter lifter;

  BranchFlowBuilder(LiftContext ctx, VarEnv env, NodeFactory factory, ExpressionFlattener flattener, StatementLifter lifter) {
    this.ctx = ctx;
    this.env = env;
    this.factory = factory;
    this.flattener = flattener;
    this.lifter = lifter;
  }

  FlowFrontier liftIf(If iff, FlowCursor cursor) {
    GraphNode branch = factory.createBuiltin(BuiltinNodes.DOUBLE_BRANCH, iff);
    wireCondition(iff.test, branch, PortKinds.CONDITION, iff, cursor);
    cursor.attach(branch);

    FlowFrontier yes = lifter.liftBlock(iff.body, FlowFrontier.at(branch, PortKinds.YES), false);
    FlowFrontier no = lifter.liftBlock(iff.orelse, FlowFrontier.at(branch, PortKinds.NO), false);
    return FlowFrontier.concat(yes, no);
  }

  FlowFrontier liftMatch(Match match, FlowCursor cursor) {
    if (match.subject instanceof Call call && flattener.isCompositeCall(call)) {
      return liftCompositeMatch(match, call, cursor);
    }

    GraphNode branch = factory.createBuiltin(BuiltinNodes.MULTIPLE_BRANCHES, match);
    boolean hasWildcard = false;
    for (Case c : SourceTrees.orEmpty(match.cases)) {
      String label = caseLabel(c.pattern);
      if (label == null) {
        hasWildcard = true;
      } else {
        branch.addOutput(new Port(label, PortKinds.FLOW_TYPE));
        branch.declareFlowPort(label);
      }
    }
    wireCondition(match.subject, branch, PortKinds.CONTROL_EXPRESSION, match, cursor);
    cursor.attach(branch);

    FlowFrontier result = FlowFrontier.EMPTY;
    Set<String> taken = new HashSet<>();
    for (Case c : SourceTrees.orEmpty(match.cases)) {
      String label = caseLabel(c.pattern);
      String port = label != null ? label : PortKinds.DEFAULT;
      // 同一标签只有第一个 case 会执行
      if (!taken.add(port)) {
        ctx.diagnostics.warn(ErrorMessages.duplicateCaseLabel(port, match.line));
        continue;
      }
      result = FlowFrontier.concat(result, lifter.liftBlock(c.body, FlowFrontier.at(branch, port), false));
    }
    // 没有 case _ 时默认出口直接落到后续语句
    if (!hasWildcard) {
      result = FlowFrontier.concat(result, FlowFrontier.at(branch, PortKinds.DEFAULT));
    }
    return result;
  }

  /**
   * 直接匹配复合节点多出口调用：每个 case 标签都必须是该调用声明的出口，
   * 此时不生成分支节点，case 体直接接到调用自身的出口上；否则整条语句丢弃。
   */
  private FlowFrontier liftCompositeMatch(Match match, Call call, FlowCursor cursor) {
    String dotted = SourceTrees.dottedName(call.func);
    Optional<NodeSpec> spec = flattener.resolve(call);
    if (spec.isEmpty()) {
      ctx.diagnostics.warn(ErrorMessages.unresolvedCall(dotted, match.line));
      return cursor.frontier();
    }
    List<String> exits = flattener.compositeExits(call, spec.get());
    for (Case c : SourceTrees.orEmpty(match.cases)) {
      String label = exitLabel(c.pattern);
      if (!exits.contains(label)) {
        ctx.diagnostics.warn(ErrorMessages.ambiguousMatchDispatch(dotted, label, match.line));
        return cursor.frontier();
      }
    }

    GraphNode node = flattener.materializeCall(call, match, cursor);
    if (node == null) return cursor.frontier();

    FlowFrontier result = FlowFrontier.EMPTY;
    Set<String> taken = new HashSet<>();
    for (Case c : SourceTrees.orEmpty(match.cases)) {
      String exit = exitLabel(c.pattern);
      if (!taken.add(exit)) {
        ctx.diagnostics.warn(ErrorMessages.duplicateCaseLabel(exit, match.line));
        continue;
      }
      result = FlowFrontier.concat(result, lifter.liftBlock(c.body, FlowFrontier.at(node, exit), false));
    }
    return result;
  }

  private String exitLabel(Pattern pattern) {
    String label = caseLabel(pattern);
    return label != null ? label : PortKinds.DEFAULT;
  }

  /** case 标签文本；通配 {@code _} 返回 null */
  String caseLabel(Pattern pattern) {
    if (!(pattern instanceof PatValue v)) return null;
    Object value = ctx.evaluator.evaluate(v.value, env);
    if (value == ConstantEvaluator.NOT_CONSTANT) {
      String dotted = SourceTrees.dottedName(v.value);
      return dotted != null ? dotted : SourceTrees.kindOf(v.value);
    }
    return labelText(value);
  }

  static String labelText(Object value) {
    if (value == null) return "None";
    if (value instanceof Boolean b) return b ? "True" : "False";
    return String.valueOf(value);
  }

  private void wireCondition(Expr test, GraphNode node, String port, Stmt stmt, FlowCursor cursor) {
    ctx.usageListener().onCondition(test);
    if (!flattener.wireValue(test, node, port, stmt, cursor)) {
      ctx.diagnostics.warn(ErrorMessages.unsupportedCondition(SourceTrees.kindOf(test), stmt.line));
    }
  }
}
