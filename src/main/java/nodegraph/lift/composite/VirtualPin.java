package nodegraph.lift.composite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 已解析的虚拟引脚：声明加上它在图内的全部映射位置。
 *
 * <p>找不到映射位置的引脚显式标记 {@code allowUnmapped}，不会处于未定义状态。</p>
 */
public final class VirtualPin {
  private final PinSpec spec;
  private final List<PortRef> mappings = new ArrayList<>();
  private boolean allowUnmapped;

  public VirtualPin(PinSpec spec) {
    this.spec = spec;
  }

  public PinSpec spec() { return spec; }
  public String name() { return spec.name(); }
  public List<PortRef> mappings() { return Collections.unmodifiableList(mappings); }
  public boolean allowUnmapped() { return allowUnmapped; }

  public void addMapping(PortRef ref) {
    if (!mappings.contains(ref)) mappings.add(ref);
  }

  public void markAllowUnmapped() {
    this.allowUnmapped = true;
  }

  public boolean isMapped() {
    return !mappings.isEmpty();
  }

  /** 按节点 id 改写映射（合并图时 id 可能被重命名） */
  public void renameNodes(java.util.Map<String, String> renames) {
    for (int i = 0; i < mappings.size(); i++) {
      PortRef ref = mappings.get(i);
      String renamed = renames.get(ref.nodeId());
      if (renamed != null && !renamed.equals(ref.nodeId())) {
        mappings.set(i, new PortRef(renamed, ref.port()));
      }
    }
  }

  @Override
  public String toString() {
    return "VirtualPin(" + spec.name() + " -> " + mappings + (allowUnmapped ? ", allow-unmapped" : "") + ")";
  }
}
