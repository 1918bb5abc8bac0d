package nodegraph.lift.registry;

import nodegraph.lift.graph.PortKinds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点定义：端口名称、类型、可变参数范围。由节点库提供，提升过程只读。
 *
 * <p>JSON 形态：</p>
 * <pre>
 * {"name": "add_numbers", "category": "Query Node",
 *  "inputs": [{"name": "left", "type": "Integer"}, {"name": "right", "type": "Integer"}],
 *  "outputs": [{"name": "result", "type": "Integer"}]}
 * </pre>
 */
public final class NodeSpec {
  public String name;
  public String category;
  public List<PortSpec> inputs = new ArrayList<>();
  public List<PortSpec> outputs = new ArrayList<>();
  /** 复合节点 id；普通节点为 null */
  public String compositeId;
  /** 允许按关键字参数追加端口 */
  public boolean dynamicPorts;
  /** 输出端口由赋值目标决定（拆分结构体一类节点） */
  public boolean outputsFromTargets;
  /** 复合节点的方法入口与出口 */
  public Map<String, CompositeMethod> methods = new LinkedHashMap<>();

  public static final class CompositeMethod {
    public String flowIn;
    public List<String> exits = new ArrayList<>();
  }

  /**
   * 可变参数范围。简单范围 {@code 0~99} 的 keyPrefix 为 null；
   * 键值范围 {@code key0~49}/{@code value0~49} 成对出现。
   */
  public record VariadicRange(String keyPrefix, String valuePrefix, int start, int end, String keyType, String valueType) {
    public boolean keyed() {
      return keyPrefix != null;
    }

    /** 第 index 个（从 0 计）变参对应的端口名 */
    public String simplePort(int index) {
      return String.valueOf(start + index);
    }

    public String keyPort(int index) {
      return keyPrefix + (start + index);
    }

    public String valuePort(int index) {
      return valuePrefix + (start + index);
    }

    public int capacity() {
      return end - start + 1;
    }
  }

  public static NodeSpec of(String name, String category) {
    NodeSpec spec = new NodeSpec();
    spec.name = name;
    spec.category = category;
    return spec;
  }

  public NodeSpec withInput(String port, String type) {
    inputs.add(new PortSpec(port, type));
    return this;
  }

  public NodeSpec withOutput(String port, String type) {
    outputs.add(new PortSpec(port, type));
    return this;
  }

  /** 追加标准流程入口与出口 */
  public NodeSpec withFlow() {
    inputs.add(0, new PortSpec(PortKinds.FLOW_IN, PortKinds.FLOW_TYPE));
    outputs.add(0, new PortSpec(PortKinds.FLOW_OUT, PortKinds.FLOW_TYPE));
    return this;
  }

  public NodeSpec withMethod(String method, String flowIn, List<String> exits) {
    CompositeMethod m = new CompositeMethod();
    m.flowIn = flowIn;
    m.exits = new ArrayList<>(exits);
    methods.put(method, m);
    return this;
  }

  public boolean isFlowPort(PortSpec port, boolean output) {
    if (PortKinds.FLOW_TYPE.equals(port.type)) return true;
    return output ? PortKinds.FLOW_OUTPUT_NAMES.contains(port.name) : PortKinds.FLOW_INPUT_NAMES.contains(port.name);
  }

  public boolean hasFlowPorts() {
    for (PortSpec p : inputs) if (isFlowPort(p, false)) return true;
    for (PortSpec p : outputs) if (isFlowPort(p, true)) return true;
    return false;
  }

  public boolean isComposite() {
    return compositeId != null;
  }

  /** 非范围、非流程的输入端口，按声明顺序，用于位置参数绑定 */
  public List<PortSpec> positionalInputs() {
    List<PortSpec> out = new ArrayList<>();
    for (PortSpec p : inputs) {
      if (!p.isRange() && !isFlowPort(p, false)) out.add(p);
    }
    return out;
  }

  public PortSpec findInput(String port) {
    for (PortSpec p : inputs) if (p.name.equals(port)) return p;
    return null;
  }

  /** 解析可变参数范围；没有时返回 null */
  public VariadicRange variadicRange() {
    List<PortSpec> ranges = new ArrayList<>();
    for (PortSpec p : inputs) if (p.isRange()) ranges.add(p);
    if (ranges.isEmpty()) return null;

    PortSpec first = ranges.get(0);
    String prefix = prefixOf(first.name);
    int[] bounds = boundsOf(first.name, prefix);
    if (prefix.isEmpty() || ranges.size() < 2) {
      return new VariadicRange(null, null, bounds[0], bounds[1], null, first.type);
    }
    PortSpec second = ranges.get(1);
    return new VariadicRange(prefix, prefixOf(second.name), bounds[0], bounds[1], first.type, second.type);
  }

  private static String prefixOf(String rangeName) {
    int i = 0;
    while (i < rangeName.length() && !Character.isDigit(rangeName.charAt(i))) i++;
    return rangeName.substring(0, i);
  }

  private static int[] boundsOf(String rangeName, String prefix) {
    String[] parts = rangeName.substring(prefix.length()).split("~");
    int start = Integer.parseInt(parts[0].trim());
    String endText = parts.length > 1 ? parts[1].trim() : parts[0].trim();
    // 右端点可能再次带前缀，如 key0~key49
    int j = 0;
    while (j < endText.length() && !Character.isDigit(endText.charAt(j))) j++;
    int end = Integer.parseInt(endText.substring(j));
    return new int[] {start, end};
  }

  @Override
  public String toString() {
    return "NodeSpec(" + name + ")";
  }
}
