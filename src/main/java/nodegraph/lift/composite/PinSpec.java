package nodegraph.lift.composite;

import nodegraph.lift.graph.PortKinds;

/**
 * 复合节点对外暴露的引脚声明。
 *
 * @param name 引脚名
 * @param type 端口类型；流程引脚为 {@code Flow}
 * @param direction 输入或输出
 * @param flow 是否为流程引脚
 * @param variable 数据输出引脚取值的变量名；为 null 时与引脚同名
 * @param method 声明该引脚的方法名
 */
public record PinSpec(String name, String type, Direction direction, boolean flow, String variable, String method) {

  public enum Direction { INPUT, OUTPUT }

  public static PinSpec dataInput(String name, String type, String method) {
    return new PinSpec(name, type, Direction.INPUT, false, null, method);
  }

  public static PinSpec dataOutput(String name, String type, String variable, String method) {
    return new PinSpec(name, type, Direction.OUTPUT, false, variable, method);
  }

  public static PinSpec flowInput(String name, String method) {
    return new PinSpec(name, PortKinds.FLOW_TYPE, Direction.INPUT, true, null, method);
  }

  public static PinSpec flowOutput(String name, String method) {
    return new PinSpec(name, PortKinds.FLOW_TYPE, Direction.OUTPUT, true, null, method);
  }

  public boolean isInput() {
    return direction == Direction.INPUT;
  }

  /** 数据输出取值的变量名 */
  public String sourceVariable() {
    return variable != null ? variable : name;
  }

  public PinSpec withType(String newType) {
    return new PinSpec(name, newType, direction, flow, variable, method);
  }
}
