package nodegraph.lift.composite;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 复合节点类中 {@code self.字段 = 入口参数} 的来源表，在提升任何方法之前对整个类建立。
 *
 * <p>字段记住写入它的方法与参数；其他方法读取 {@code self.字段} 时，使用位置归到写入方法的同名引脚上，
 * 与读取方自己的参数名无关。同一字段被多处写入时取类中第一处。</p>
 */
public final class StateFieldSources {

  /** 字段的来源：写入它的方法名与该方法的参数名 */
  public record Source(String method, String param) {}

  private final Map<String, Source> fields = new LinkedHashMap<>();

  private StateFieldSources() {}

  public static StateFieldSources of(ClassDef cls) {
    StateFieldSources sources = new StateFieldSources();
    if (cls == null) return sources;
    for (Stmt s : SourceTrees.orEmpty(cls.body)) {
      if (!(s instanceof FunctionDef fn)) continue;
      Set<String> params = new LinkedHashSet<>();
      for (Param p : SourceTrees.orEmpty(fn.params)) {
        if (!"self".equals(p.name)) params.add(p.name);
      }
      Map<String, String> aliases = ParamUsageTracker.localAliases(params, fn.body);
      SourceTrees.walk(fn.body, inner -> {
        if (inner instanceof Assign a && a.target instanceof Attribute attr
            && "self".equals(SourceTrees.dottedName(attr.value)) && a.value instanceof Name n) {
          String param = params.contains(n.id) ? n.id : aliases.get(n.id);
          if (param != null) sources.fields.putIfAbsent(attr.attr, new Source(fn.name, param));
        }
      });
    }
    return sources;
  }

  /** 字段来源；不是由入口参数写入的字段返回 null */
  public Source sourceOf(String field) {
    return fields.get(field);
  }

  public boolean isEmpty() {
    return fields.isEmpty();
  }
}
