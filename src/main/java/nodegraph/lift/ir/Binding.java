package nodegraph.lift.ir;

/**
 * 变量绑定：指向 (产出节点, 输出端口)，或内联常量。
 */
public final class Binding {
  public final String nodeId;
  public final String port;
  public final Object constant;
  private final boolean constantValue;

  private Binding(String nodeId, String port, Object constant, boolean constantValue) {
    this.nodeId = nodeId;
    this.port = port;
    this.constant = constant;
    this.constantValue = constantValue;
  }

  public static Binding port(String nodeId, String port) {
    return new Binding(nodeId, port, null, false);
  }

  public static Binding constant(Object value) {
    return new Binding(null, null, value, true);
  }

  public boolean isConstant() {
    return constantValue;
  }

  public boolean sameSource(Binding other) {
    if (other == null || constantValue || other.constantValue) return false;
    return nodeId.equals(other.nodeId) && port.equals(other.port);
  }

  @Override
  public String toString() {
    return constantValue ? "const(" + constant + ")" : nodeId + "." + port;
  }
}
