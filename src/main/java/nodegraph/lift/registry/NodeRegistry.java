package nodegraph.lift.registry;

import java.util.Optional;

/**
 * 节点定义查询接口。提升期间只读，不允许并发修改。
 */
@FunctionalInterface
public interface NodeRegistry {
  Optional<NodeSpec> resolve(String name);
}
