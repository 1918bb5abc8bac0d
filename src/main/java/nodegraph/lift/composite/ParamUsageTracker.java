package nodegraph.lift.composite;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.ir.ArgumentUsageListener;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 追踪入口参数在提升过程中落到了哪些 (节点, 端口) 上。
 *
 * <p>除直接引用外，还识别两类别名：方法内的 {@code y = 参数}（可传递），
 * 以及实例字段 {@code self.字段}。字段若由本方法的参数写入，按本方法的参数记录；
 * 若由类中其他方法写入，记录为对那个方法引脚的跨方法使用，由复合节点提升在合并后补到对应引脚上。</p>
 */
public final class ParamUsageTracker implements ArgumentUsageListener {
  private final String methodName;
  private final Set<String> params = new LinkedHashSet<>();
  private final Map<String, String> aliases;
  private final StateFieldSources stateFields;
  private final Map<String, List<PortRef>> usages = new LinkedHashMap<>();
  private final Map<StateFieldSources.Source, List<PortRef>> foreignUsages = new LinkedHashMap<>();
  private final Set<String> conditionParams = new LinkedHashSet<>();

  public ParamUsageTracker(FunctionDef method, StateFieldSources stateFields) {
    this.methodName = method.name;
    for (Param p : SourceTrees.orEmpty(method.params)) {
      if (!"self".equals(p.name)) params.add(p.name);
    }
    this.aliases = localAliases(params, method.body);
    this.stateFields = stateFields;
  }

  /**
   * 方法内 {@code y = x} 形式的别名闭包，结果为 别名 → 入口参数。
   */
  static Map<String, String> localAliases(Set<String> params, List<Stmt> body) {
    Map<String, String> aliases = new LinkedHashMap<>();
    List<Assign> assigns = new ArrayList<>();
    SourceTrees.walk(body, s -> {
      if (s instanceof Assign a && a.target instanceof Name && a.value instanceof Name) assigns.add(a);
    });
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Assign a : assigns) {
        String target = ((Name) a.target).id;
        String value = ((Name) a.value).id;
        String source = params.contains(value) ? value : aliases.get(value);
        if (source != null && !params.contains(target) && !source.equals(aliases.get(target))) {
          aliases.put(target, source);
          changed = true;
        }
      }
    }
    return aliases;
  }

  /** 名称对应的入口参数；不是参数或别名时为 null */
  public String paramOf(String name) {
    if (params.contains(name)) return name;
    return aliases.get(name);
  }

  private String paramOf(Expr e) {
    if (e instanceof Name n) return paramOf(n.id);
    StateFieldSources.Source source = stateSource(e);
    return source != null && source.method().equals(methodName) ? source.param() : null;
  }

  private StateFieldSources.Source stateSource(Expr e) {
    if (stateFields == null || !(e instanceof Attribute a) || !"self".equals(SourceTrees.dottedName(a.value))) {
      return null;
    }
    return stateFields.sourceOf(a.attr);
  }

  private static void record(List<PortRef> sites, PortRef ref) {
    if (!sites.contains(ref)) sites.add(ref);
  }

  @Override
  public void onArgument(GraphNode node, String port, Expr argument) {
    PortRef ref = new PortRef(node.id(), port);
    String param = paramOf(argument);
    if (param != null) {
      record(usages.computeIfAbsent(param, k -> new ArrayList<>()), ref);
      return;
    }
    StateFieldSources.Source source = stateSource(argument);
    if (source != null) record(foreignUsages.computeIfAbsent(source, k -> new ArrayList<>()), ref);
  }

  @Override
  public void onCondition(Expr condition) {
    String direct = paramOf(condition);
    if (direct != null) conditionParams.add(direct);
    Set<String> names = new LinkedHashSet<>();
    SourceTrees.collectNames(condition, names);
    for (String n : names) {
      String param = paramOf(n);
      if (param != null) conditionParams.add(param);
    }
  }

  public Set<String> params() {
    return params;
  }

  public List<PortRef> usages(String param) {
    return usages.getOrDefault(param, List.of());
  }

  /** 读取其他方法写入的实例字段的位置，按字段来源分组；节点 id 为本方法图内的 id */
  public Map<StateFieldSources.Source, List<PortRef>> foreignUsages() {
    return foreignUsages;
  }

  public boolean usedInCondition(String param) {
    return conditionParams.contains(param);
  }
}
