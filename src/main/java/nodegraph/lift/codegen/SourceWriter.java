package nodegraph.lift.codegen;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;

import java.util.List;

/**
 * 源码模型写回脚本文本，缩进四个空格。
 *
 * <p>复合表达式作为子表达式时一律加括号，不依赖运算符优先级。</p>
 */
public final class SourceWriter {
  private static final String INDENT = "    ";

  private final StringBuilder out = new StringBuilder();

  public static String write(SourceModel.Module module) {
    SourceWriter w = new SourceWriter();
    w.block(SourceTrees.orEmpty(module.body), 0);
    return w.out.toString();
  }

  private void block(List<Stmt> stmts, int depth) {
    if (stmts.isEmpty()) {
      line(depth, "pass");
      return;
    }
    for (Stmt s : stmts) stmt(s, depth);
  }

  private void line(int depth, String text) {
    out.append(INDENT.repeat(depth)).append(text).append('\n');
  }

  private void stmt(Stmt s, int depth) {
    if (s instanceof Assign a) {
      line(depth, target(a.target) + " = " + expr(a.value));
    } else if (s instanceof AnnAssign a) {
      line(depth, target(a.target) + ": " + expr(a.annotation) + (a.value != null ? " = " + expr(a.value) : ""));
    } else if (s instanceof SourceModel.ExprStmt e) {
      line(depth, expr(e.value));
    } else if (s instanceof If iff) {
      ifChain(iff, depth, "if ");
    } else if (s instanceof Match m) {
      line(depth, "match " + expr(m.subject) + ":");
      for (Case c : SourceTrees.orEmpty(m.cases)) {
        String pattern = c.pattern instanceof PatValue v ? expr(v.value) : "_";
        line(depth + 1, "case " + pattern + ":");
        block(SourceTrees.orEmpty(c.body), depth + 2);
      }
    } else if (s instanceof For f) {
      line(depth, "for " + target(f.target) + " in " + expr(f.iter) + ":");
      block(SourceTrees.orEmpty(f.body), depth + 1);
    } else if (s instanceof While w) {
      line(depth, "while " + expr(w.test) + ":");
      block(SourceTrees.orEmpty(w.body), depth + 1);
    } else if (s instanceof Break) {
      line(depth, "break");
    } else if (s instanceof Pass) {
      line(depth, "pass");
    } else if (s instanceof Return r) {
      line(depth, r.value != null ? "return " + expr(r.value) : "return");
    } else if (s instanceof Import imp) {
      importLine(imp, depth);
    } else if (s instanceof FunctionDef fn) {
      out.append('\n');
      for (Expr d : SourceTrees.orEmpty(fn.decorators)) line(depth, "@" + expr(d));
      StringBuilder params = new StringBuilder();
      for (Param p : SourceTrees.orEmpty(fn.params)) {
        if (params.length() > 0) params.append(", ");
        params.append(p.name);
        if (p.annotation != null) params.append(": ").append(expr(p.annotation));
        if (p.defaultValue != null) params.append("=").append(expr(p.defaultValue));
      }
      line(depth, "def " + fn.name + "(" + params + "):");
      block(SourceTrees.orEmpty(fn.body), depth + 1);
    } else if (s instanceof ClassDef cls) {
      for (Expr d : SourceTrees.orEmpty(cls.decorators)) line(depth, "@" + expr(d));
      String bases = SourceTrees.orEmpty(cls.bases).isEmpty() ? "" : "(" + joined(cls.bases) + ")";
      line(depth, "class " + cls.name + bases + ":");
      block(SourceTrees.orEmpty(cls.body), depth + 1);
    }
  }

  // else 中只有一个 If 时写成 elif
  private void ifChain(If iff, int depth, String keyword) {
    line(depth, keyword + expr(iff.test) + ":");
    block(SourceTrees.orEmpty(iff.body), depth + 1);
    List<Stmt> orelse = SourceTrees.orEmpty(iff.orelse);
    if (orelse.isEmpty()) return;
    if (orelse.size() == 1 && orelse.get(0) instanceof If nested) {
      ifChain(nested, depth, "elif ");
      return;
    }
    line(depth, "else:");
    block(orelse, depth + 1);
  }

  private void importLine(Import imp, int depth) {
    List<String> names = SourceTrees.orEmpty(imp.names);
    if (imp.module == null || (!names.isEmpty() && imp.module.equals(names.get(0)))) {
      line(depth, "import " + String.join(", ", names));
    } else {
      line(depth, "from " + imp.module + " import " + String.join(", ", names));
    }
  }

  private static String target(Expr e) {
    if (e instanceof TupleE t && !SourceTrees.orEmpty(t.elts).isEmpty()) return joined(t.elts);
    return expr(e);
  }

  static String expr(Expr e) {
    if (e == null) return "None";
    if (e instanceof Name n) return n.id;
    if (e instanceof Attribute a) return operand(a.value) + "." + a.attr;
    if (e instanceof Call c) {
      StringBuilder sb = new StringBuilder(operand(c.func)).append('(');
      String sep = "";
      for (Expr arg : SourceTrees.orEmpty(c.args)) {
        sb.append(sep).append(expr(arg));
        sep = ", ";
      }
      for (Keyword k : SourceTrees.orEmpty(c.keywords)) {
        sb.append(sep).append(k.name).append('=').append(expr(k.value));
        sep = ", ";
      }
      return sb.append(')').toString();
    }
    if (e instanceof IntE i) return Long.toString(i.value);
    if (e instanceof FloatE f) return Double.toString(f.value);
    if (e instanceof StringE s) return quote(s.value);
    if (e instanceof BoolE b) return b.value ? "True" : "False";
    if (e instanceof NoneE) return "None";
    if (e instanceof FString f) {
      char q = f.raw.indexOf('"') >= 0 && f.raw.indexOf('\'') < 0 ? '\'' : '"';
      return "f" + q + f.raw + q;
    }
    if (e instanceof TupleE t) {
      List<Expr> elts = SourceTrees.orEmpty(t.elts);
      return elts.size() == 1 ? "(" + expr(elts.get(0)) + ",)" : "(" + joined(elts) + ")";
    }
    if (e instanceof ListE l) return "[" + joined(SourceTrees.orEmpty(l.elts)) + "]";
    if (e instanceof DictE d) {
      StringBuilder sb = new StringBuilder("{");
      for (int i = 0; i < SourceTrees.orEmpty(d.keys).size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(expr(d.keys.get(i))).append(": ").append(expr(d.values.get(i)));
      }
      return sb.append('}').toString();
    }
    if (e instanceof UnaryOp u) {
      return ("not".equals(u.op) ? "not " : u.op) + operand(u.operand);
    }
    if (e instanceof BinOp b) return operand(b.left) + " " + b.op + " " + operand(b.right);
    if (e instanceof Compare c) {
      StringBuilder sb = new StringBuilder(operand(c.left));
      for (int i = 0; i < c.ops.size(); i++) {
        sb.append(' ').append(c.ops.get(i)).append(' ').append(operand(c.comparators.get(i)));
      }
      return sb.toString();
    }
    if (e instanceof BoolOp b) {
      StringBuilder sb = new StringBuilder();
      for (Expr v : SourceTrees.orEmpty(b.values)) {
        if (sb.length() > 0) sb.append(' ').append(b.op).append(' ');
        sb.append(operand(v));
      }
      return sb.toString();
    }
    Subscript s = (Subscript) e;
    return operand(s.value) + "[" + expr(s.index) + "]";
  }

  private static String operand(Expr e) {
    boolean compound = e instanceof UnaryOp || e instanceof BinOp || e instanceof Compare || e instanceof BoolOp;
    return compound ? "(" + expr(e) + ")" : expr(e);
  }

  private static String joined(List<Expr> elts) {
    StringBuilder sb = new StringBuilder();
    for (Expr e : elts) {
      if (sb.length() > 0) sb.append(", ");
      sb.append(expr(e));
    }
    return sb.toString();
  }

  static String quote(String value) {
    StringBuilder sb = new StringBuilder("\"");
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
