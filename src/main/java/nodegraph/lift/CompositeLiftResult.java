package nodegraph.lift;

import nodegraph.lift.composite.VirtualPin;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.support.Diagnostics;

import java.util.List;

/**
 * 复合节点类的提升产物：全部入口方法合并后的图、已解析的虚拟引脚与诊断。
 */
public record CompositeLiftResult(Graph graph, List<VirtualPin> pins, Diagnostics diagnostics) {

  public VirtualPin pin(String name) {
    for (VirtualPin p : pins) {
      if (p.name().equals(name)) return p;
    }
    return null;
  }
}
