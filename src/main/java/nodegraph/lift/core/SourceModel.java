package nodegraph.lift.core;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * 节点图脚本的源码模型。
 *
 * <p>文本前端与 JSON 输入都落到这套结构上，字段保持公开以便 Jackson 直接绑定。
 * 语句携带源码行号（{@code line}/{@code endLine}），用于节点的源码区间记录。</p>
 */
public final class SourceModel {
  private SourceModel() {}

  public static final class Module { public String name; public List<Stmt> body; }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = AnnAssign.class, name = "AnnAssign"),
    @JsonSubTypes.Type(value = ExprStmt.class, name = "Expr"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Match.class, name = "Match"),
    @JsonSubTypes.Type(value = For.class, name = "For"),
    @JsonSubTypes.Type(value = While.class, name = "While"),
    @JsonSubTypes.Type(value = Break.class, name = "Break"),
    @JsonSubTypes.Type(value = Pass.class, name = "Pass"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = Import.class, name = "Import"),
    @JsonSubTypes.Type(value = FunctionDef.class, name = "FunctionDef"),
    @JsonSubTypes.Type(value = ClassDef.class, name = "ClassDef")
  })
  public abstract static sealed class Stmt
      permits Assign, AnnAssign, ExprStmt, If, Match, For, While, Break, Pass, Return, Import, FunctionDef, ClassDef {
    public int line;
    public int endLine;
  }

  @JsonTypeName("Assign") public static final class Assign extends Stmt { public Expr target; public Expr value; }
  @JsonTypeName("AnnAssign") public static final class AnnAssign extends Stmt { public Expr target; public Expr annotation; public Expr value; }
  @JsonTypeName("Expr") public static final class ExprStmt extends Stmt { public Expr value; }
  @JsonTypeName("If") public static final class If extends Stmt { public Expr test; public List<Stmt> body; public List<Stmt> orelse; }
  @JsonTypeName("Match") public static final class Match extends Stmt { public Expr subject; public List<Case> cases; }
  public static final class Case { public Pattern pattern; public List<Stmt> body; }
  @JsonTypeName("For") public static final class For extends Stmt { public Expr target; public Expr iter; public List<Stmt> body; }
  @JsonTypeName("While") public static final class While extends Stmt { public Expr test; public List<Stmt> body; }
  @JsonTypeName("Break") public static final class Break extends Stmt {}
  @JsonTypeName("Pass") public static final class Pass extends Stmt {}
  @JsonTypeName("Return") public static final class Return extends Stmt { public Expr value; }
  @JsonTypeName("Import") public static final class Import extends Stmt { public String module; public java.util.List<String> names; }
  @JsonTypeName("FunctionDef")
  public static final class FunctionDef extends Stmt {
    public String name;
    public List<Param> params;
    public List<Expr> decorators;
    public List<Stmt> body;
  }
  @JsonTypeName("ClassDef")
  public static final class ClassDef extends Stmt {
    public String name;
    public java.util.List<Expr> bases;
    public java.util.List<Expr> decorators;
    public List<Stmt> body;
  }
  public static final class Param { public String name; public Expr annotation; public Expr defaultValue; }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Name.class, name = "Name"),
    @JsonSubTypes.Type(value = Attribute.class, name = "Attribute"),
    @JsonSubTypes.Type(value = Call.class, name = "Call"),
    @JsonSubTypes.Type(value = IntE.class, name = "Int"),
    @JsonSubTypes.Type(value = FloatE.class, name = "Float"),
    @JsonSubTypes.Type(value = StringE.class, name = "String"),
    @JsonSubTypes.Type(value = BoolE.class, name = "Bool"),
    @JsonSubTypes.Type(value = NoneE.class, name = "None"),
    @JsonSubTypes.Type(value = FString.class, name = "FString"),
    @JsonSubTypes.Type(value = TupleE.class, name = "Tuple"),
    @JsonSubTypes.Type(value = ListE.class, name = "List"),
    @JsonSubTypes.Type(value = DictE.class, name = "Dict"),
    @JsonSubTypes.Type(value = UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = BinOp.class, name = "BinOp"),
    @JsonSubTypes.Type(value = Compare.class, name = "Compare"),
    @JsonSubTypes.Type(value = BoolOp.class, name = "BoolOp"),
    @JsonSubTypes.Type(value = Subscript.class, name = "Subscript")
  })
  public sealed interface Expr
      permits Name, Attribute, Call, IntE, FloatE, StringE, BoolE, NoneE, FString, TupleE, ListE, DictE,
      UnaryOp, BinOp, Compare, BoolOp, Subscript {}

  @JsonTypeName("Name") public static final class Name implements Expr { public String id; }
  @JsonTypeName("Attribute") public static final class Attribute implements Expr { public Expr value; public String attr; }
  @JsonTypeName("Call") public static final class Call implements Expr { public Expr func; public List<Expr> args; public List<Keyword> keywords; }
  public static final class Keyword { public String name; public Expr value; }
  @JsonTypeName("Int") public static final class IntE implements Expr { public long value; }
  @JsonTypeName("Float") public static final class FloatE implements Expr { public double value; }
  @JsonTypeName("String") public static final class StringE implements Expr { public String value; }
  @JsonTypeName("Bool") public static final class BoolE implements Expr { public boolean value; }
  @JsonTypeName("None") public static final class NoneE implements Expr {}
  @JsonTypeName("FString") public static final class FString implements Expr { public String raw; }
  @JsonTypeName("Tuple") public static final class TupleE implements Expr { public List<Expr> elts; }
  @JsonTypeName("List") public static final class ListE implements Expr { public List<Expr> elts; }
  @JsonTypeName("Dict") public static final class DictE implements Expr { public List<Expr> keys; public List<Expr> values; }
  @JsonTypeName("UnaryOp") public static final class UnaryOp implements Expr { public String op; public Expr operand; }
  @JsonTypeName("BinOp") public static final class BinOp implements Expr { public Expr left; public String op; public Expr right; }
  @JsonTypeName("Compare") public static final class Compare implements Expr { public Expr left; public List<String> ops; public List<Expr> comparators; }
  @JsonTypeName("BoolOp") public static final class BoolOp implements Expr { public String op; public List<Expr> values; }
  @JsonTypeName("Subscript") public static final class Subscript implements Expr { public Expr value; public Expr index; }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = PatValue.class, name = "PatValue"),
    @JsonSubTypes.Type(value = PatWildcard.class, name = "PatWildcard")
  })
  public sealed interface Pattern permits PatValue, PatWildcard {}
  @JsonTypeName("PatValue") public static final class PatValue implements Pattern { public Expr value; }
  @JsonTypeName("PatWildcard") public static final class PatWildcard implements Pattern {}
}
