package nodegraph.lift.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 节点库中的端口声明。名称包含 {@code ~} 时表示可变参数范围（如 {@code 0~99}）。
 */
public final class PortSpec {
  public final String name;
  public final String type;

  @JsonCreator
  public PortSpec(@JsonProperty("name") String name, @JsonProperty("type") String type) {
    this.name = name;
    this.type = type;
  }

  public boolean isRange() {
    return name.contains("~");
  }

  @Override
  public String toString() {
    return name + ":" + type;
  }
}
