package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceTrees;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编译单元级常量表：模块常量与类字段常量。
 *
 * <p>由调用方创建并随提升传递，作用域限定在一个编译单元内，不做进程级缓存。
 * 按源码顺序收集，因此 {@code B = A} 在 A 为常量时同样可解析。</p>
 */
public final class ConstantScope {
  private final Map<String, Object> moduleConstants = new LinkedHashMap<>();
  private final Map<String, Object> classConstants = new LinkedHashMap<>();

  public static ConstantScope empty() {
    return new ConstantScope();
  }

  public static ConstantScope forModule(SourceModel.Module module) {
    ConstantScope scope = new ConstantScope();
    scope.collectModule(module);
    return scope;
  }

  public void collectModule(SourceModel.Module module) {
    ConstantEvaluator evaluator = new ConstantEvaluator(this);
    for (SourceModel.Stmt s : SourceTrees.orEmpty(module.body)) {
      if (s instanceof SourceModel.Assign a && a.target instanceof SourceModel.Name n) {
        Object value = evaluator.evaluate(a.value, null);
        if (value != ConstantEvaluator.NOT_CONSTANT) moduleConstants.put(n.id, value);
      }
    }
  }

  /**
   * 收集类体中的 {@code NAME = 常量} 以及 {@code __init__} 中的 {@code self.x = 常量}。
   */
  public void collectClass(SourceModel.ClassDef cls) {
    ConstantEvaluator evaluator = new ConstantEvaluator(this);
    for (SourceModel.Stmt s : SourceTrees.orEmpty(cls.body)) {
      if (s instanceof SourceModel.Assign a && a.target instanceof SourceModel.Name n) {
        Object value = evaluator.evaluate(a.value, null);
        if (value != ConstantEvaluator.NOT_CONSTANT) classConstants.put(n.id, value);
      } else if (s instanceof SourceModel.FunctionDef fn && "__init__".equals(fn.name)) {
        for (SourceModel.Stmt inner : SourceTrees.orEmpty(fn.body)) {
          if (inner instanceof SourceModel.Assign a
              && a.target instanceof SourceModel.Attribute attr
              && "self".equals(SourceTrees.dottedName(attr.value))) {
            Object value = evaluator.evaluate(a.value, null);
            if (value != ConstantEvaluator.NOT_CONSTANT) classConstants.put(attr.attr, value);
          }
        }
      }
    }
  }

  public boolean hasModuleConstant(String name) { return moduleConstants.containsKey(name); }
  public Object moduleConstant(String name) { return moduleConstants.get(name); }
  public boolean hasClassConstant(String field) { return classConstants.containsKey(field); }
  public Object classConstant(String field) { return classConstants.get(field); }
}
