package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.graph.GraphNode;

/**
 * 参数使用回调：每个表达式被接到某个输入端口、或出现在分支条件中时通知。
 * 复合节点提升用它追踪入口参数落在哪些端口上。
 */
public interface ArgumentUsageListener {

  void onArgument(GraphNode node, String port, SourceModel.Expr argument);

  void onCondition(SourceModel.Expr condition);

  ArgumentUsageListener NONE = new ArgumentUsageListener() {
    @Override
    public void onArgument(GraphNode node, String port, SourceModel.Expr argument) {}

    @Override
    public void onCondition(SourceModel.Expr condition) {}
  };
}
