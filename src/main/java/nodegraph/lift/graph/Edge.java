package nodegraph.lift.graph;

/**
 * 连线：(源节点, 源端口) → (目标节点, 目标端口)。流程/数据类型由目标端口推断。
 */
public final class Edge {
  public final String id;
  public final String srcNode;
  public final String srcPort;
  public final String dstNode;
  public final String dstPort;

  public Edge(String id, String srcNode, String srcPort, String dstNode, String dstPort) {
    this.id = id;
    this.srcNode = srcNode;
    this.srcPort = srcPort;
    this.dstNode = dstNode;
    this.dstPort = dstPort;
  }

  public boolean connects(String src, String srcPortName, String dst, String dstPortName) {
    return srcNode.equals(src) && srcPort.equals(srcPortName) && dstNode.equals(dst) && dstPort.equals(dstPortName);
  }

  @Override
  public String toString() {
    return srcNode + "." + srcPort + " -> " + dstNode + "." + dstPort;
  }
}
