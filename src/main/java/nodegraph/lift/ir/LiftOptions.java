package nodegraph.lift.ir;

import nodegraph.lift.support.LiftConfig;

import java.util.Set;

/**
 * 单次提升的选项。
 *
 * @param reservedArguments 调用首个位置参数若为其中之一则视为上下文参数跳过
 * @param markerCalls 虚拟引脚标记调用，不生成节点
 * @param eventPrefix 事件方法名前缀
 */
public record LiftOptions(Set<String> reservedArguments, Set<String> markerCalls, String eventPrefix) {

  public static final Set<String> DEFAULT_RESERVED = Set.of("self.game", "game", "self", "owner_entity", "self.owner_entity");
  public static final Set<String> DEFAULT_MARKERS = Set.of("flow_in", "flow_out", "data_in", "data_out");

  public static LiftOptions defaults() {
    return new LiftOptions(DEFAULT_RESERVED, DEFAULT_MARKERS, LiftConfig.EVENT_PREFIX);
  }
}
