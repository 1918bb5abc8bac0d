package nodegraph.lift.composite;

/** 图内的 (节点, 端口) 位置 */
public record PortRef(String nodeId, String port) {
  @Override
  public String toString() {
    return nodeId + "." + port;
  }
}
