package nodegraph.lift.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 图中的节点。
 *
 * <p>端口列表与常量表在提升期间由工厂逐步填充；图返回后拓扑不再变化。</p>
 */
public final class GraphNode {
  private final String id;
  private final String title;
  private final String category;
  private final List<Port> inputs = new ArrayList<>();
  private final List<Port> outputs = new ArrayList<>();
  private final Map<String, Object> inputConstants = new LinkedHashMap<>();
  private final Set<String> declaredFlowPorts = new LinkedHashSet<>();
  // 输出端口 → 赋值时绑定的变量名，供回写源码时复用
  private final Map<String, String> customVarNames = new LinkedHashMap<>();
  private String compositeId;
  private int sourceLine;
  private int sourceEndLine;

  // 布局复制产生的副本信息
  private String originalNodeId;
  private boolean dataNodeCopy;
  private String copyBlockId;

  public GraphNode(String id, String title, String category) {
    this.id = id;
    this.title = title;
    this.category = category;
  }

  public String id() { return id; }
  public String title() { return title; }
  public String category() { return category; }

  public List<Port> inputs() { return Collections.unmodifiableList(inputs); }
  public List<Port> outputs() { return Collections.unmodifiableList(outputs); }

  public void addInput(Port port) {
    if (!hasInput(port.name)) inputs.add(port);
  }

  public void addOutput(Port port) {
    if (!hasOutput(port.name)) outputs.add(port);
  }

  public boolean hasInput(String name) {
    return find(inputs, name) != null;
  }

  public boolean hasOutput(String name) {
    return find(outputs, name) != null;
  }

  public Port input(String name) { return find(inputs, name); }
  public Port output(String name) { return find(outputs, name); }

  private static Port find(List<Port> ports, String name) {
    for (Port p : ports) {
      if (p.name.equals(name)) return p;
    }
    return null;
  }

  public Map<String, Object> inputConstants() { return Collections.unmodifiableMap(inputConstants); }

  public void setConstant(String port, Object value) { inputConstants.put(port, value); }
  public boolean hasConstant(String port) { return inputConstants.containsKey(port); }
  public Object constant(String port) { return inputConstants.get(port); }

  public Set<String> declaredFlowPorts() { return Collections.unmodifiableSet(declaredFlowPorts); }
  public void declareFlowPort(String port) { declaredFlowPorts.add(port); }

  public Map<String, String> customVarNames() { return Collections.unmodifiableMap(customVarNames); }
  public void setCustomVarName(String port, String variable) { customVarNames.put(port, variable); }

  public String compositeId() { return compositeId; }
  public void setCompositeId(String compositeId) { this.compositeId = compositeId; }

  public int sourceLine() { return sourceLine; }
  public int sourceEndLine() { return sourceEndLine; }

  public void setSourceSpan(int line, int endLine) {
    this.sourceLine = line;
    this.sourceEndLine = endLine;
  }

  public String originalNodeId() { return originalNodeId; }
  public boolean isDataNodeCopy() { return dataNodeCopy; }
  public String copyBlockId() { return copyBlockId; }

  public void markCopyOf(String originalId, String blockId) {
    this.originalNodeId = originalId;
    this.dataNodeCopy = true;
    this.copyBlockId = blockId;
  }

  @Override
  public String toString() {
    return id + "<" + title + ">";
  }
}
