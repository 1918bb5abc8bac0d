package nodegraph.lift.graph;

import java.util.Objects;

/**
 * 节点端口。流程/数据类型不单独存储，由 {@link PortKinds} 按命名约定推断。
 */
public final class Port {
  public final String name;
  public final String type;

  public Port(String name, String type) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = type != null ? type : PortKinds.GENERIC_TYPE;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Port)) return false;
    Port other = (Port) o;
    return name.equals(other.name) && type.equals(other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name + ":" + type;
  }
}
