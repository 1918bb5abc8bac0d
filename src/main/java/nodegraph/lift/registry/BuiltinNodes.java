package nodegraph.lift.registry;

import nodegraph.lift.graph.PortKinds;

import java.util.*;

/**
 * 内置的合成节点：分支、循环、局部变量。
 *
 * <p>这些节点由提升过程直接构造，不依赖外部节点库；节点库查询失败时也会回退到这里，
 * 以便回写后的源码（显式调用 get_local_variable 等）能够再次提升。</p>
 */
public final class BuiltinNodes {
  private BuiltinNodes() {}

  public static final String DOUBLE_BRANCH = "double_branch";
  public static final String MULTIPLE_BRANCHES = "multiple_branches";
  public static final String FINITE_LOOP = "finite_loop";
  public static final String LIST_ITERATION_LOOP = "list_iteration_loop";
  public static final String GET_LOCAL_VARIABLE = "get_local_variable";
  public static final String SET_LOCAL_VARIABLE = "set_local_variable";

  public static final String FLOW_CONTROL = "Flow Control Node";
  public static final String QUERY = "Query Node";
  public static final String EXECUTION = "Execution Node";
  public static final String EVENT = "Event Node";
  public static final String COMPOSITE = "Composite Node";

  // 循环端口
  public static final String START_VALUE = "start_value";
  public static final String END_VALUE = "end_value";
  public static final String CURRENT_VALUE = "current_value";
  public static final String ITERATION_LIST = "iteration_list";
  public static final String ITERATION_VALUE = "iteration_value";

  // 局部变量端口
  public static final String INITIAL_VALUE = "initial_value";
  public static final String LOCAL_VARIABLE = "local_variable";
  public static final String VALUE = "value";
  public static final String LOCAL_VARIABLE_TYPE = "Local Variable";

  public static final Set<String> BRANCH_TITLES = Set.of(DOUBLE_BRANCH, MULTIPLE_BRANCHES);
  public static final Set<String> LOOP_TITLES = Set.of(FINITE_LOOP, LIST_ITERATION_LOOP);

  private static final Map<String, NodeSpec> REGISTRY = new LinkedHashMap<>();

  static {
    register(NodeSpec.of(DOUBLE_BRANCH, FLOW_CONTROL)
      .withInput(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE)
      .withInput(PortKinds.CONDITION, "Boolean")
      .withOutput(PortKinds.YES, PortKinds.FLOW_TYPE)
      .withOutput(PortKinds.NO, PortKinds.FLOW_TYPE));

    // case 出口在构造时按标签追加
    register(NodeSpec.of(MULTIPLE_BRANCHES, FLOW_CONTROL)
      .withInput(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE)
      .withInput(PortKinds.CONTROL_EXPRESSION, PortKinds.GENERIC_TYPE)
      .withOutput(PortKinds.DEFAULT, PortKinds.FLOW_TYPE));

    register(NodeSpec.of(FINITE_LOOP, FLOW_CONTROL)
      .withInput(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE)
      .withInput(PortKinds.BREAK_LOOP, PortKinds.FLOW_TYPE)
      .withInput(START_VALUE, "Integer")
      .withInput(END_VALUE, "Integer")
      .withOutput(PortKinds.LOOP_BODY, PortKinds.FLOW_TYPE)
      .withOutput(PortKinds.LOOP_COMPLETE, PortKinds.FLOW_TYPE)
      .withOutput(CURRENT_VALUE, "Integer"));

    register(NodeSpec.of(LIST_ITERATION_LOOP, FLOW_CONTROL)
      .withInput(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE)
      .withInput(PortKinds.BREAK_LOOP, PortKinds.FLOW_TYPE)
      .withInput(ITERATION_LIST, "Generic List")
      .withOutput(PortKinds.LOOP_BODY, PortKinds.FLOW_TYPE)
      .withOutput(PortKinds.LOOP_COMPLETE, PortKinds.FLOW_TYPE)
      .withOutput(ITERATION_VALUE, PortKinds.GENERIC_TYPE));

    register(NodeSpec.of(GET_LOCAL_VARIABLE, QUERY)
      .withInput(INITIAL_VALUE, PortKinds.GENERIC_TYPE)
      .withOutput(LOCAL_VARIABLE, LOCAL_VARIABLE_TYPE)
      .withOutput(VALUE, PortKinds.GENERIC_TYPE));

    register(NodeSpec.of(SET_LOCAL_VARIABLE, EXECUTION)
      .withInput(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE)
      .withInput(LOCAL_VARIABLE, LOCAL_VARIABLE_TYPE)
      .withInput(VALUE, PortKinds.GENERIC_TYPE)
      .withOutput(PortKinds.FLOW_OUT, PortKinds.FLOW_TYPE));
  }

  private static void register(NodeSpec spec) {
    REGISTRY.put(spec.name, spec);
  }

  public static Optional<NodeSpec> get(String name) {
    return Optional.ofNullable(REGISTRY.get(name));
  }

  public static NodeSpec require(String name) {
    NodeSpec spec = REGISTRY.get(name);
    if (spec == null) throw new IllegalArgumentException("unknown builtin node: " + name);
    return spec;
  }

  public static boolean has(String name) {
    return REGISTRY.containsKey(name);
  }

  public static boolean isBranch(String title) {
    return BRANCH_TITLES.contains(title);
  }

  public static boolean isLoop(String title) {
    return LOOP_TITLES.contains(title);
  }
}
