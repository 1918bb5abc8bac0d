package nodegraph.lift.parser;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.parser.GraphScriptParser.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 ANTLR 解析树转换为 {@link SourceModel}。
 *
 * <p>语句行号取自起始 token；结束行号跳过末尾的标记 token（逻辑行结束、反缩进），
 * 指向语句最后一个实际 token 所在行。</p>
 */
public final class AstBuilder extends GraphScriptBaseVisitor<Object> {
  private final TokenStream tokens;

  public AstBuilder(TokenStream tokens) {
    this.tokens = tokens;
  }

  public SourceModel.Module buildModule(ModuleContext ctx, String name) {
    SourceModel.Module module = new SourceModel.Module();
    module.name = name;
    module.body = new ArrayList<>();
    for (StatementContext s : ctx.statement()) {
      module.body.addAll(statement(s));
    }
    return module;
  }

  // ---- 语句 ----

  private List<Stmt> statement(StatementContext ctx) {
    if (ctx.simpleStmt() != null) return simpleStmt(ctx.simpleStmt());
    return List.of(compound(ctx.compoundStmt()));
  }

  private List<Stmt> simpleStmt(SimpleStmtContext ctx) {
    List<Stmt> out = new ArrayList<>();
    for (SmallStmtContext s : ctx.smallStmt()) {
      out.add(span((Stmt) visit(s), s));
    }
    return out;
  }

  private List<Stmt> block(BlockContext ctx) {
    if (ctx.simpleStmt() != null) return simpleStmt(ctx.simpleStmt());
    List<Stmt> out = new ArrayList<>();
    for (StatementContext s : ctx.statement()) out.addAll(statement(s));
    return out;
  }

  private Stmt compound(CompoundStmtContext ctx) {
    Stmt s;
    if (ctx.ifStmt() != null) s = ifStmt(ctx.ifStmt());
    else if (ctx.matchStmt() != null) s = matchStmt(ctx.matchStmt());
    else if (ctx.forStmt() != null) s = forStmt(ctx.forStmt());
    else if (ctx.whileStmt() != null) s = whileStmt(ctx.whileStmt());
    else if (ctx.funcDef() != null) s = funcDef(ctx.funcDef(), List.of());
    else if (ctx.classDef() != null) s = classDef(ctx.classDef(), List.of());
    else s = decorated(ctx.decorated());
    return span(s, ctx);
  }

  @Override
  public Object visitAnnAssignStmt(AnnAssignStmtContext ctx) {
    AnnAssign a = new AnnAssign();
    a.target = testList(ctx.target);
    a.annotation = expr(ctx.annotation);
    a.value = ctx.value != null ? testList(ctx.value) : null;
    return a;
  }

  @Override
  public Object visitAssignStmt(AssignStmtContext ctx) {
    Assign a = new Assign();
    a.target = testList(ctx.target);
    a.value = testList(ctx.value);
    return a;
  }

  @Override
  public Object visitExprStmt(ExprStmtContext ctx) {
    SourceModel.ExprStmt e = new SourceModel.ExprStmt();
    e.value = testList(ctx.testList());
    return e;
  }

  @Override
  public Object visitPassStmt(PassStmtContext ctx) {
    return new Pass();
  }

  @Override
  public Object visitBreakStmt(BreakStmtContext ctx) {
    return new Break();
  }

  @Override
  public Object visitReturnStmt(ReturnStmtContext ctx) {
    Return r = new Return();
    r.value = ctx.testList() != null ? testList(ctx.testList()) : null;
    return r;
  }

  @Override
  public Object visitImportStmt(ImportStmtContext ctx) {
    Import imp = new Import();
    imp.names = new ArrayList<>();
    for (ImportAliasContext a : ctx.importAlias()) imp.names.add(a.dottedName().getText());
    imp.module = imp.names.isEmpty() ? null : imp.names.get(0);
    return imp;
  }

  @Override
  public Object visitFromImportStmt(FromImportStmtContext ctx) {
    Import imp = new Import();
    String dots = ".".repeat(ctx.DOT().size());
    imp.module = dots + (ctx.dottedName() != null ? ctx.dottedName().getText() : "");
    imp.names = new ArrayList<>();
    ImportTargetsContext targets = ctx.importTargets();
    if (targets.importAlias().isEmpty()) {
      imp.names.add("*");
    } else {
      for (ImportAliasContext a : targets.importAlias()) imp.names.add(a.dottedName().getText());
    }
    return imp;
  }

  private If ifStmt(IfStmtContext ctx) {
    If root = new If();
    root.test = expr(ctx.test());
    root.body = block(ctx.block());
    root.orelse = new ArrayList<>();

    // elif 展开为 else 分支中嵌套的 If
    If tail = root;
    for (ElifClauseContext elif : ctx.elifClause()) {
      If nested = new If();
      nested.test = expr(elif.test());
      nested.body = block(elif.block());
      nested.orelse = new ArrayList<>();
      span(nested, elif);
      tail.orelse.add(nested);
      tail = nested;
    }
    if (ctx.elseClause() != null) tail.orelse.addAll(block(ctx.elseClause().block()));
    return root;
  }

  private Match matchStmt(MatchStmtContext ctx) {
    Match m = new Match();
    m.subject = testList(ctx.testList());
    m.cases = new ArrayList<>();
    for (CaseBlockContext c : ctx.caseBlock()) {
      Case kase = new Case();
      Expr value = expr(c.test());
      if (value instanceof Name n && "_".equals(n.id)) {
        kase.pattern = new PatWildcard();
      } else {
        PatValue p = new PatValue();
        p.value = value;
        kase.pattern = p;
      }
      kase.body = block(c.block());
      m.cases.add(kase);
    }
    return m;
  }

  private For forStmt(ForStmtContext ctx) {
    For f = new For();
    TargetListContext targets = ctx.targetList();
    if (targets.atomExpr().size() == 1 && targets.getChildCount() == 1) {
      f.target = atomExpr(targets.atomExpr(0));
    } else {
      List<Expr> elts = new ArrayList<>();
      for (AtomExprContext a : targets.atomExpr()) elts.add(atomExpr(a));
      f.target = SourceTrees.tuple(elts);
    }
    f.iter = testList(ctx.testList());
    f.body = block(ctx.block());
    return f;
  }

  private While whileStmt(WhileStmtContext ctx) {
    While w = new While();
    w.test = expr(ctx.test());
    w.body = block(ctx.block());
    return w;
  }

  private Stmt decorated(DecoratedContext ctx) {
    List<Expr> decorators = new ArrayList<>();
    for (DecoratorContext d : ctx.decorator()) {
      Expr target = SourceTrees.dotted(d.dottedName().getText());
      // '@' name NEWLINE 之外还有括号时为调用形式
      decorators.add(d.getChildCount() > 3 ? call(target, d.arguments()) : target);
    }
    return ctx.funcDef() != null ? funcDef(ctx.funcDef(), decorators) : classDef(ctx.classDef(), decorators);
  }

  private FunctionDef funcDef(FuncDefContext ctx, List<Expr> decorators) {
    FunctionDef fn = new FunctionDef();
    fn.name = ctx.identifier().getText();
    fn.decorators = new ArrayList<>(decorators);
    fn.params = new ArrayList<>();
    if (ctx.parameters() != null) {
      for (ParameterContext p : ctx.parameters().parameter()) {
        Param param = new Param();
        param.name = p.identifier().getText();
        param.annotation = p.annotation != null ? expr(p.annotation) : null;
        param.defaultValue = p.defaultValue != null ? expr(p.defaultValue) : null;
        fn.params.add(param);
      }
    }
    fn.body = block(ctx.block());
    return fn;
  }

  private ClassDef classDef(ClassDefContext ctx, List<Expr> decorators) {
    ClassDef cls = new ClassDef();
    cls.name = ctx.identifier().getText();
    cls.decorators = new ArrayList<>(decorators);
    cls.bases = new ArrayList<>();
    if (ctx.arguments() != null) {
      for (ArgumentContext a : ctx.arguments().argument()) {
        if (a instanceof PositionalArgumentContext p) cls.bases.add(expr(p.test()));
      }
    }
    cls.body = block(ctx.block());
    return cls;
  }

  // ---- 表达式 ----

  private Expr testList(TestListContext ctx) {
    if (ctx.test().size() == 1 && ctx.trailingComma == null) return expr(ctx.test(0));
    List<Expr> elts = new ArrayList<>();
    for (TestContext t : ctx.test()) elts.add(expr(t));
    return SourceTrees.tuple(elts);
  }

  private Expr expr(TestContext ctx) {
    return orTest(ctx.orTest());
  }

  private Expr orTest(OrTestContext ctx) {
    if (ctx.andTest().size() == 1) return andTest(ctx.andTest(0));
    BoolOp op = new BoolOp();
    op.op = "or";
    op.values = new ArrayList<>();
    for (AndTestContext a : ctx.andTest()) op.values.add(andTest(a));
    return op;
  }

  private Expr andTest(AndTestContext ctx) {
    if (ctx.notTest().size() == 1) return notTest(ctx.notTest(0));
    BoolOp op = new BoolOp();
    op.op = "and";
    op.values = new ArrayList<>();
    for (NotTestContext n : ctx.notTest()) op.values.add(notTest(n));
    return op;
  }

  private Expr notTest(NotTestContext ctx) {
    if (ctx instanceof NotExprContext n) {
      UnaryOp u = new UnaryOp();
      u.op = "not";
      u.operand = notTest(n.notTest());
      return u;
    }
    return comparison(((ComparisonExprContext) ctx).comparison());
  }

  private Expr comparison(ComparisonContext ctx) {
    Expr left = arith(ctx.arith(0));
    if (ctx.compOp().isEmpty()) return left;
    Compare c = new Compare();
    c.left = left;
    c.ops = new ArrayList<>();
    c.comparators = new ArrayList<>();
    for (int i = 0; i < ctx.compOp().size(); i++) {
      c.ops.add(compOp(ctx.compOp(i)));
      c.comparators.add(arith(ctx.arith(i + 1)));
    }
    return c;
  }

  private static String compOp(CompOpContext ctx) {
    // getText 会去掉空白
    return switch (ctx.getText()) {
      case "notin" -> "not in";
      case "isnot" -> "is not";
      default -> ctx.getText();
    };
  }

  private Expr arith(ArithContext ctx) {
    Expr left = term(ctx.term(0));
    for (int i = 0; i < ctx.addOp().size(); i++) {
      left = binOp(left, ctx.addOp(i).getText(), term(ctx.term(i + 1)));
    }
    return left;
  }

  private Expr term(TermContext ctx) {
    Expr left = factor(ctx.factor(0));
    for (int i = 0; i < ctx.mulOp().size(); i++) {
      left = binOp(left, ctx.mulOp(i).getText(), factor(ctx.factor(i + 1)));
    }
    return left;
  }

  private Expr factor(FactorContext ctx) {
    if (ctx instanceof UnaryExprContext u) {
      UnaryOp op = new UnaryOp();
      op.op = u.unaryOp.getText();
      op.operand = factor(u.factor());
      return op;
    }
    PowerExprContext p = (PowerExprContext) ctx;
    Expr base = atomExpr(p.atomExpr());
    return p.factor() != null ? binOp(base, "**", factor(p.factor())) : base;
  }

  private static BinOp binOp(Expr left, String op, Expr right) {
    BinOp b = new BinOp();
    b.left = left;
    b.op = op;
    b.right = right;
    return b;
  }

  private Expr atomExpr(AtomExprContext ctx) {
    Expr e = atom(ctx.atom());
    for (TrailerContext t : ctx.trailer()) {
      if (t instanceof CallTrailerContext c) {
        e = call(e, c.arguments());
      } else if (t instanceof SubscriptTrailerContext s) {
        Subscript sub = new Subscript();
        sub.value = e;
        sub.index = expr(s.test());
        e = sub;
      } else {
        e = SourceTrees.attribute(e, ((AttributeTrailerContext) t).identifier().getText());
      }
    }
    return e;
  }

  private Call call(Expr func, ArgumentsContext args) {
    List<Expr> positional = new ArrayList<>();
    List<Keyword> keywords = new ArrayList<>();
    if (args != null) {
      for (ArgumentContext a : args.argument()) {
        if (a instanceof KeywordArgumentContext k) {
          keywords.add(SourceTrees.keyword(k.identifier().getText(), expr(k.test())));
        } else {
          positional.add(expr(((PositionalArgumentContext) a).test()));
        }
      }
    }
    return SourceTrees.call(func, positional, keywords);
  }

  private Expr atom(AtomContext ctx) {
    if (ctx instanceof ParenAtomContext p) {
      return p.testList() != null ? testList(p.testList()) : SourceTrees.tuple(List.of());
    } else if (ctx instanceof ListAtomContext l) {
      List<Expr> elts = new ArrayList<>();
      for (TestContext t : l.test()) elts.add(expr(t));
      return SourceTrees.list(elts);
    } else if (ctx instanceof DictAtomContext d) {
      DictE dict = new DictE();
      dict.keys = new ArrayList<>();
      dict.values = new ArrayList<>();
      if (d.dictItems() != null) {
        List<TestContext> items = d.dictItems().test();
        for (int i = 0; i + 1 < items.size(); i += 2) {
          dict.keys.add(expr(items.get(i)));
          dict.values.add(expr(items.get(i + 1)));
        }
      }
      return dict;
    } else if (ctx instanceof NameAtomContext n) {
      return SourceTrees.name(n.identifier().getText());
    } else if (ctx instanceof IntAtomContext i) {
      return SourceTrees.intLit(parseInt(i.INTEGER().getText()));
    } else if (ctx instanceof FloatAtomContext f) {
      return SourceTrees.floatLit(Double.parseDouble(f.FLOAT_NUMBER().getText().replace("_", "")));
    } else if (ctx instanceof StringAtomContext s) {
      return strings(s.stringPart());
    } else if (ctx instanceof TrueAtomContext) {
      return SourceTrees.bool(true);
    } else if (ctx instanceof FalseAtomContext) {
      return SourceTrees.bool(false);
    }
    return SourceTrees.none();
  }

  private static long parseInt(String text) {
    String t = text.replace("_", "").toLowerCase(java.util.Locale.ROOT);
    if (t.startsWith("0x")) return Long.parseLong(t.substring(2), 16);
    if (t.startsWith("0b")) return Long.parseLong(t.substring(2), 2);
    return Long.parseLong(t);
  }

  /** 相邻字符串字面量拼接；任一部分为 f-string 时整体为 f-string */
  private static Expr strings(List<StringPartContext> parts) {
    StringBuilder sb = new StringBuilder();
    boolean formatted = false;
    for (StringPartContext p : parts) {
      String text = p.getText();
      int prefixEnd = 0;
      while (prefixEnd < text.length() && text.charAt(prefixEnd) != '"' && text.charAt(prefixEnd) != '\'') prefixEnd++;
      String prefix = text.substring(0, prefixEnd).toLowerCase(java.util.Locale.ROOT);
      String body = text.substring(prefixEnd);
      int q = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
      String content = body.substring(q, body.length() - q);
      if (p.FSTRING() != null) {
        formatted = true;
        sb.append(content);
      } else {
        sb.append(prefix.contains("r") ? content : unescape(content));
      }
    }
    if (formatted) {
      FString f = new FString();
      f.raw = sb.toString();
      return f;
    }
    return SourceTrees.str(sb.toString());
  }

  static String unescape(String s) {
    if (s.indexOf('\\') < 0) return s;
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c != '\\' || i + 1 >= s.length()) {
        sb.append(c);
        continue;
      }
      char next = s.charAt(++i);
      switch (next) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case '0' -> sb.append('\0');
        case '\\', '\'', '"' -> sb.append(next);
        case '\n' -> { }
        case 'u' -> {
          if (i + 4 < s.length()) {
            sb.append((char) Integer.parseInt(s.substring(i + 1, i + 5), 16));
            i += 4;
          } else {
            sb.append('\\').append(next);
          }
        }
        default -> sb.append('\\').append(next);
      }
    }
    return sb.toString();
  }

  // ---- 行号 ----

  private <T extends Stmt> T span(T stmt, ParserRuleContext ctx) {
    stmt.line = ctx.getStart().getLine();
    stmt.endLine = lastContentLine(ctx.getStop());
    return stmt;
  }

  private int lastContentLine(Token stop) {
    int index = stop.getTokenIndex();
    while (index > 0) {
      Token t = tokens.get(index);
      int type = t.getType();
      if (type != GraphScriptLexer.NEWLINE && type != GraphScriptLexer.DEDENT && type != GraphScriptLexer.INDENT) {
        return t.getLine();
      }
      index--;
    }
    return stop.getLine();
  }
}
