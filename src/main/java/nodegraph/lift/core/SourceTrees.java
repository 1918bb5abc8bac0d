package nodegraph.lift.core;

import nodegraph.lift.core.SourceModel.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 源码模型的构造与遍历工具。
 *
 * <p>构造方法供代码生成与测试使用；遍历方法供变量分析、参数追踪等前置扫描使用。</p>
 */
public final class SourceTrees {

  private SourceTrees() {
    // 禁止实例化工具类
  }

  // ---- 构造 ----

  public static Name name(String id) {
    Name n = new Name();
    n.id = id;
    return n;
  }

  public static Attribute attribute(Expr value, String attr) {
    Attribute a = new Attribute();
    a.value = value;
    a.attr = attr;
    return a;
  }

  /** 解析 {@code a.b.c} 形式的点号路径 */
  public static Expr dotted(String path) {
    String[] parts = path.split("\\.");
    Expr e = name(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      e = attribute(e, parts[i]);
    }
    return e;
  }

  public static Call call(Expr func, List<Expr> args, List<Keyword> keywords) {
    Call c = new Call();
    c.func = func;
    c.args = new ArrayList<>(args);
    c.keywords = new ArrayList<>(keywords);
    return c;
  }

  public static Keyword keyword(String name, Expr value) {
    Keyword k = new Keyword();
    k.name = name;
    k.value = value;
    return k;
  }

  public static IntE intLit(long value) {
    IntE e = new IntE();
    e.value = value;
    return e;
  }

  public static FloatE floatLit(double value) {
    FloatE e = new FloatE();
    e.value = value;
    return e;
  }

  public static StringE str(String value) {
    StringE e = new StringE();
    e.value = value;
    return e;
  }

  public static BoolE bool(boolean value) {
    BoolE e = new BoolE();
    e.value = value;
    return e;
  }

  public static NoneE none() {
    return new NoneE();
  }

  public static TupleE tuple(List<Expr> elts) {
    TupleE t = new TupleE();
    t.elts = new ArrayList<>(elts);
    return t;
  }

  public static ListE list(List<Expr> elts) {
    ListE l = new ListE();
    l.elts = new ArrayList<>(elts);
    return l;
  }

  // ---- 查询 ----

  public static <T> List<T> orEmpty(List<T> list) {
    return list != null ? list : List.of();
  }

  /**
   * 点号路径：{@code self.game} → "self.game"；非 Name/Attribute 链返回 null。
   */
  public static String dottedName(Expr e) {
    if (e instanceof Name n) return n.id;
    if (e instanceof Attribute a) {
      String base = dottedName(a.value);
      return base != null ? base + "." + a.attr : null;
    }
    return null;
  }

  /** 调用的函数名：{@code f(..)} 为 f，{@code a.b.f(..)} 为 f */
  public static String calleeName(Call call) {
    if (call.func instanceof Name n) return n.id;
    if (call.func instanceof Attribute a) return a.attr;
    return null;
  }

  /** 诊断用的表达式种类名 */
  public static String kindOf(Expr e) {
    return e == null ? "None" : e.getClass().getSimpleName();
  }

  /** 是否为 {@code name(...)} 形式的调用 */
  public static boolean isCallTo(Expr e, String name) {
    return e instanceof Call c && c.func instanceof Name n && n.id.equals(name);
  }

  public static boolean isBranchConstruct(Stmt s) {
    return s instanceof If || s instanceof Match || s instanceof For || s instanceof While;
  }

  /** 语句直接包含的子语句块 */
  public static List<List<Stmt>> childBlocks(Stmt s) {
    List<List<Stmt>> blocks = new ArrayList<>();
    if (s instanceof If iff) {
      blocks.add(orEmpty(iff.body));
      blocks.add(orEmpty(iff.orelse));
    } else if (s instanceof Match m) {
      for (Case c : orEmpty(m.cases)) blocks.add(orEmpty(c.body));
    } else if (s instanceof For f) {
      blocks.add(orEmpty(f.body));
    } else if (s instanceof While w) {
      blocks.add(orEmpty(w.body));
    }
    return blocks;
  }

  /** 语句（含嵌套块）中被赋值的变量名 */
  public static Set<String> namesStored(Stmt s) {
    Set<String> out = new LinkedHashSet<>();
    collectStored(s, out);
    return out;
  }

  private static void collectStored(Stmt s, Set<String> out) {
    if (s instanceof Assign a) {
      collectTargetNames(a.target, out);
    } else if (s instanceof AnnAssign aa && aa.value != null) {
      collectTargetNames(aa.target, out);
    } else if (s instanceof For f) {
      collectTargetNames(f.target, out);
    }
    for (List<Stmt> block : childBlocks(s)) {
      for (Stmt child : block) collectStored(child, out);
    }
  }

  public static void collectTargetNames(Expr target, Set<String> out) {
    if (target instanceof Name n) {
      out.add(n.id);
    } else if (target instanceof TupleE t) {
      for (Expr e : orEmpty(t.elts)) collectTargetNames(e, out);
    } else if (target instanceof ListE l) {
      for (Expr e : orEmpty(l.elts)) collectTargetNames(e, out);
    }
  }

  /** 语句（含嵌套块）中被读取的变量名 */
  public static Set<String> namesRead(Stmt s) {
    Set<String> out = new LinkedHashSet<>();
    collectRead(s, out);
    return out;
  }

  private static void collectRead(Stmt s, Set<String> out) {
    if (s instanceof Assign a) {
      collectNames(a.value, out);
      if (!(a.target instanceof Name) && !(a.target instanceof TupleE)) collectNames(a.target, out);
    } else if (s instanceof AnnAssign aa) {
      collectNames(aa.value, out);
    } else if (s instanceof ExprStmt es) {
      collectNames(es.value, out);
    } else if (s instanceof If iff) {
      collectNames(iff.test, out);
    } else if (s instanceof Match m) {
      collectNames(m.subject, out);
    } else if (s instanceof For f) {
      collectNames(f.iter, out);
    } else if (s instanceof While w) {
      collectNames(w.test, out);
    } else if (s instanceof Return r) {
      collectNames(r.value, out);
    }
    for (List<Stmt> block : childBlocks(s)) {
      for (Stmt child : block) collectRead(child, out);
    }
  }

  /** 表达式中出现的全部 Name */
  public static void collectNames(Expr e, Set<String> out) {
    if (e == null) return;
    if (e instanceof Name n) {
      out.add(n.id);
    } else if (e instanceof Attribute a) {
      collectNames(a.value, out);
    } else if (e instanceof Call c) {
      collectNames(c.func, out);
      for (Expr arg : orEmpty(c.args)) collectNames(arg, out);
      for (Keyword k : orEmpty(c.keywords)) collectNames(k.value, out);
    } else if (e instanceof TupleE t) {
      for (Expr x : orEmpty(t.elts)) collectNames(x, out);
    } else if (e instanceof ListE l) {
      for (Expr x : orEmpty(l.elts)) collectNames(x, out);
    } else if (e instanceof DictE d) {
      for (Expr x : orEmpty(d.keys)) collectNames(x, out);
      for (Expr x : orEmpty(d.values)) collectNames(x, out);
    } else if (e instanceof UnaryOp u) {
      collectNames(u.operand, out);
    } else if (e instanceof BinOp b) {
      collectNames(b.left, out);
      collectNames(b.right, out);
    } else if (e instanceof Compare c) {
      collectNames(c.left, out);
      for (Expr x : orEmpty(c.comparators)) collectNames(x, out);
    } else if (e instanceof BoolOp b) {
      for (Expr x : orEmpty(b.values)) collectNames(x, out);
    } else if (e instanceof Subscript s) {
      collectNames(s.value, out);
      collectNames(s.index, out);
    }
  }

  /** 按先序收集表达式中的调用（外层在前） */
  public static void collectCalls(Expr e, List<Call> out) {
    if (e == null) return;
    if (e instanceof Call c) {
      out.add(c);
      for (Expr arg : orEmpty(c.args)) collectCalls(arg, out);
      for (Keyword k : orEmpty(c.keywords)) collectCalls(k.value, out);
    } else if (e instanceof TupleE t) {
      for (Expr x : orEmpty(t.elts)) collectCalls(x, out);
    } else if (e instanceof ListE l) {
      for (Expr x : orEmpty(l.elts)) collectCalls(x, out);
    } else if (e instanceof UnaryOp u) {
      collectCalls(u.operand, out);
    } else if (e instanceof BinOp b) {
      collectCalls(b.left, out);
      collectCalls(b.right, out);
    } else if (e instanceof Compare c) {
      collectCalls(c.left, out);
      for (Expr x : orEmpty(c.comparators)) collectCalls(x, out);
    } else if (e instanceof BoolOp b) {
      for (Expr x : orEmpty(b.values)) collectCalls(x, out);
    }
  }

  /** 深度优先遍历全部语句（含嵌套块） */
  public static void walk(List<Stmt> body, java.util.function.Consumer<Stmt> visitor) {
    for (Stmt s : orEmpty(body)) {
      visitor.accept(s);
      for (List<Stmt> block : childBlocks(s)) walk(block, visitor);
    }
  }
}
