package nodegraph.lift.ir;

import nodegraph.lift.graph.GraphNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 方法体内的变量环境。
 *
 * <p>变量名映射到 (产出节点, 端口) 或常量；重新赋值总是整体覆盖。读取未绑定的名称返回 null，
 * 由下游校验负责报告，提升本身不中断。</p>
 */
public final class VarEnv {
  private final Map<String, Binding> vars = new LinkedHashMap<>();
  private final Map<String, Object> constants = new HashMap<>();
  private final Deque<GraphNode> loops = new ArrayDeque<>();
  private final Set<String> multiAssignCandidates = new LinkedHashSet<>();
  // 变量名 → 获取局部变量节点的句柄输出
  private final Map<String, Binding> localHandles = new LinkedHashMap<>();
  private AssignmentAnalysis analysis;

  public void set(String name, Binding binding) {
    constants.remove(name);
    vars.put(name, binding);
  }

  public Binding get(String name) {
    return vars.get(name);
  }

  public boolean contains(String name) {
    return vars.containsKey(name);
  }

  public void setConstant(String name, Object value) {
    vars.remove(name);
    constants.put(name, value);
  }

  public Object getConstant(String name) {
    return constants.get(name);
  }

  public boolean hasConstant(String name) {
    return constants.containsKey(name);
  }

  public void pushLoop(GraphNode loop) {
    loops.push(loop);
  }

  public GraphNode popLoop() {
    return loops.pop();
  }

  public GraphNode currentLoop() {
    return loops.peek();
  }

  public void markMultiAssignCandidate(String name) {
    multiAssignCandidates.add(name);
  }

  public boolean isMultiAssignCandidate(String name) {
    return multiAssignCandidates.contains(name);
  }

  public void setLocalHandle(String name, Binding handle) {
    localHandles.put(name, handle);
  }

  public Binding getLocalHandle(String name) {
    return localHandles.get(name);
  }

  public boolean hasLocalHandle(String name) {
    return localHandles.containsKey(name);
  }

  /**
   * 记录赋值分析结果，并据此标记多分支赋值候选变量。
   */
  public void applyAnalysis(AssignmentAnalysis result) {
    this.analysis = result;
    result.multiAssignCandidates().forEach(this::markMultiAssignCandidate);
  }

  public AssignmentAnalysis analysis() {
    return analysis;
  }

  /** 当前全部变量绑定的快照 */
  public Map<String, Binding> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
  }
}
