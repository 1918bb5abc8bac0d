package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 常量提取。
 *
 * <p>可提取：字面量、数值上的一元 +/-、常量组成的列表/元组、已知常量名、{@code self.字段} 类常量。
 * {@code self.owner_entity} 提取为字符串 "self.owner_entity"；下划线开头的私有字段不提取；
 * f-string 永远不是常量。变量环境中已绑定到节点输出的名称优先于同名常量。</p>
 */
public final class ConstantEvaluator {

  /** 无法提取常量的标记（常量本身可以是 null，即 None） */
  public static final Object NOT_CONSTANT = new Object() {
    @Override
    public String toString() {
      return "<not-constant>";
    }
  };

  private final ConstantScope scope;

  public ConstantEvaluator(ConstantScope scope) {
    this.scope = scope;
  }

  public boolean isConstant(Expr e, VarEnv env) {
    return evaluate(e, env) != NOT_CONSTANT;
  }

  public Object evaluate(Expr e, VarEnv env) {
    if (e == null) return NOT_CONSTANT;
    if (e instanceof IntE i) return i.value;
    if (e instanceof FloatE f) return f.value;
    if (e instanceof StringE s) return s.value;
    if (e instanceof BoolE b) return b.value;
    if (e instanceof NoneE) return null;
    if (e instanceof UnaryOp u) return evaluateUnary(u, env);
    if (e instanceof TupleE t) return evaluateAll(t.elts, env);
    if (e instanceof ListE l) return evaluateAll(l.elts, env);
    if (e instanceof Name n) return evaluateName(n.id, env);
    if (e instanceof Attribute a) return evaluateAttribute(a);
    return NOT_CONSTANT;
  }

  private Object evaluateUnary(UnaryOp u, VarEnv env) {
    Object operand = evaluate(u.operand, env);
    if ("-".equals(u.op)) {
      if (operand instanceof Long l) return -l;
      if (operand instanceof Double d) return -d;
    } else if ("+".equals(u.op)) {
      if (operand instanceof Long || operand instanceof Double) return operand;
    }
    return NOT_CONSTANT;
  }

  private Object evaluateAll(List<Expr> elts, VarEnv env) {
    List<Object> values = new ArrayList<>();
    for (Expr x : SourceTrees.orEmpty(elts)) {
      Object v = evaluate(x, env);
      if (v == NOT_CONSTANT) return NOT_CONSTANT;
      values.add(v);
    }
    return Collections.unmodifiableList(values);
  }

  private Object evaluateName(String id, VarEnv env) {
    if (env != null) {
      if (env.contains(id)) {
        Binding b = env.get(id);
        return b.isConstant() ? b.constant : NOT_CONSTANT;
      }
      if (env.hasConstant(id)) return env.getConstant(id);
    }
    if (scope.hasModuleConstant(id)) return scope.moduleConstant(id);
    return NOT_CONSTANT;
  }

  private Object evaluateAttribute(Attribute a) {
    if (!"self".equals(SourceTrees.dottedName(a.value))) return NOT_CONSTANT;
    if ("owner_entity".equals(a.attr)) return "self.owner_entity";
    if (a.attr.startsWith("_")) return NOT_CONSTANT;
    if (scope.hasClassConstant(a.attr)) return scope.classConstant(a.attr);
    return NOT_CONSTANT;
  }
}
