package nodegraph.lift.graph;

import java.util.List;
import java.util.Set;

/**
 * 端口命名约定。
 *
 * <p>流程端口不在 {@link Port} 上打标记，而是按以下约定识别：</p>
 * <ul>
 *   <li>标准流程端口名（流程入/流程出/分支出口/循环出口/跳出循环）</li>
 *   <li>节点声明的流程端口（节点库中类型为 {@code Flow} 的端口、多分支节点的 case 出口）</li>
 * </ul>
 */
public final class PortKinds {
  private PortKinds() {}

  public static final String FLOW_TYPE = "Flow";
  public static final String GENERIC_TYPE = "Generic";

  public static final String FLOW_IN = "flow_in";
  public static final String FLOW_OUT = "flow_out";
  public static final String YES = "yes";
  public static final String NO = "no";
  public static final String DEFAULT = "default";
  public static final String LOOP_BODY = "loop_body";
  public static final String LOOP_COMPLETE = "loop_complete";
  public static final String BREAK_LOOP = "break_loop";

  public static final String CONDITION = "condition";
  public static final String CONTROL_EXPRESSION = "control_expression";

  public static final Set<String> FLOW_INPUT_NAMES = Set.of(FLOW_IN, BREAK_LOOP);
  public static final Set<String> FLOW_OUTPUT_NAMES = Set.of(FLOW_OUT, YES, NO, DEFAULT, LOOP_BODY, LOOP_COMPLETE);

  /** 选择默认流程出口时的优先顺序 */
  private static final List<String> DEFAULT_OUTPUT_ORDER = List.of(FLOW_OUT, LOOP_COMPLETE, YES, DEFAULT);

  public static boolean isFlowPort(GraphNode node, String port, boolean output) {
    if (node.declaredFlowPorts().contains(port)) return true;
    return output ? FLOW_OUTPUT_NAMES.contains(port) : FLOW_INPUT_NAMES.contains(port);
  }

  public static boolean isFlowInput(GraphNode node, String port) {
    return isFlowPort(node, port, false);
  }

  public static boolean isFlowOutput(GraphNode node, String port) {
    return isFlowPort(node, port, true);
  }

  /** 节点是否参与流程（拥有任一流程端口） */
  public static boolean isFlowNode(GraphNode node) {
    for (Port p : node.inputs()) if (isFlowInput(node, p.name)) return true;
    for (Port p : node.outputs()) if (isFlowOutput(node, p.name)) return true;
    return false;
  }

  /**
   * 节点的默认流程出口：优先标准名，其次第一个流程输出；没有流程输出时回退到 {@code flow_out}。
   */
  public static String defaultFlowOutput(GraphNode node) {
    for (String candidate : DEFAULT_OUTPUT_ORDER) {
      if (node.hasOutput(candidate)) return candidate;
    }
    for (Port p : node.outputs()) {
      if (isFlowOutput(node, p.name)) return p.name;
    }
    return FLOW_OUT;
  }

  /** 节点的主流程入口 */
  public static String defaultFlowInput(GraphNode node) {
    if (node.hasInput(FLOW_IN)) return FLOW_IN;
    for (Port p : node.inputs()) {
      if (isFlowInput(node, p.name) && !BREAK_LOOP.equals(p.name)) return p.name;
    }
    return FLOW_IN;
  }

  /** 节点的数据输出端口（按声明顺序） */
  public static List<Port> dataOutputs(GraphNode node) {
    return node.outputs().stream().filter(p -> !isFlowOutput(node, p.name)).toList();
  }

  /** 节点的流程输出端口（按声明顺序） */
  public static List<Port> flowOutputs(GraphNode node) {
    return node.outputs().stream().filter(p -> isFlowOutput(node, p.name)).toList();
  }
}
