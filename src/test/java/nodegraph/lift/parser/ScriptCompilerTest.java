package nodegraph.lift.parser;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScriptCompiler 单元测试
 *
 * 测试目标：
 * 1. 脚本源码到源码模型的结构映射
 * 2. 语法错误报告（行号与可读的标记名）
 * 3. JSON 输入识别与解析
 */
public class ScriptCompilerTest {

  @Test
  public void testCompileClassWithEventMethod() throws Exception {
    String source = """
        class Demo:
            def on_start(self, flag: "Boolean"):
                x = add_numbers(left=1, right=2)
                if flag:
                    print_string(string="yes")
        """;

    SourceModel.Module module = ScriptCompiler.compile(source, "demo");

    assertEquals("demo", module.name);
    assertEquals(1, module.body.size());
    ClassDef cls = assertInstanceOf(ClassDef.class, module.body.get(0));
    FunctionDef fn = assertInstanceOf(FunctionDef.class, cls.body.get(0));
    assertEquals("on_start", fn.name);
    assertEquals(2, fn.params.size());
    assertEquals("Boolean", ((StringE) fn.params.get(1).annotation).value);
    assertEquals(2, fn.line, "方法起始行号");
    assertEquals(5, fn.endLine, "方法结束行号取最后一个实际 token");

    Assign assign = assertInstanceOf(Assign.class, fn.body.get(0));
    Call call = assertInstanceOf(Call.class, assign.value);
    assertEquals("left", call.keywords.get(0).name);
    assertInstanceOf(If.class, fn.body.get(1));
  }

  @Test
  public void testElifBecomesNestedIf() throws Exception {
    SourceModel.Module module = ScriptCompiler.compile("""
        if a:
            pass
        elif b:
            pass
        else:
            x = 1
        """, "m");

    If root = (If) module.body.get(0);
    If nested = assertInstanceOf(If.class, root.orelse.get(0));
    assertEquals("b", ((Name) nested.test).id);
    assertInstanceOf(Assign.class, nested.orelse.get(0));
  }

  @Test
  public void testMatchPatterns() throws Exception {
    SourceModel.Module module = ScriptCompiler.compile("""
        match mode:
            case 1:
                pass
            case _:
                pass
        """, "m");

    Match match = (Match) module.body.get(0);
    assertEquals(2, match.cases.size());
    PatValue first = assertInstanceOf(PatValue.class, match.cases.get(0).pattern);
    assertEquals(1L, ((IntE) first.value).value);
    assertInstanceOf(PatWildcard.class, match.cases.get(1).pattern);
  }

  @Test
  public void testLiterals() throws Exception {
    SourceModel.Module module = ScriptCompiler.compile("""
        a = 0x1F
        b = 1_000
        c = "x" 'y'
        d = r"\\n"
        e = "tab\\there"
        f = f"hi {name}"
        g = -2.5
        """, "m");

    assertEquals(31L, ((IntE) value(module, 0)).value, "十六进制");
    assertEquals(1000L, ((IntE) value(module, 1)).value, "数字分隔符");
    assertEquals("xy", ((StringE) value(module, 2)).value, "相邻字符串拼接");
    assertEquals("\\n", ((StringE) value(module, 3)).value, "原始字符串不解码转义");
    assertEquals("tab\there", ((StringE) value(module, 4)).value);
    assertEquals("hi {name}", ((FString) value(module, 5)).raw);
    UnaryOp neg = assertInstanceOf(UnaryOp.class, value(module, 6));
    assertEquals("-", neg.op);
  }

  @Test
  public void testComparisonOperatorsAreNormalized() throws Exception {
    SourceModel.Module module = ScriptCompiler.compile("ok = a not in b and c is not None\n", "m");
    BoolOp and = (BoolOp) value(module, 0);
    assertEquals("not in", ((Compare) and.values.get(0)).ops.get(0));
    assertEquals("is not", ((Compare) and.values.get(1)).ops.get(0));
  }

  @Test
  public void testSyntaxErrorReportsLine() {
    ScriptCompiler.CompilationException ex = assertThrows(ScriptCompiler.CompilationException.class,
      () -> ScriptCompiler.compile("x = 1\ny = (2 +\n", "broken"));
    assertTrue(ex.getMessage().contains("语法错误"), ex.getMessage());
    assertFalse(ex.getMessage().contains(String.valueOf(Canonicalizer.NEWLINE)), "内部标记字符应替换为可读名称");
  }

  @Test
  public void testMissingIndentIsSyntaxError() {
    assertThrows(ScriptCompiler.CompilationException.class,
      () -> ScriptCompiler.compile("if a:\nx = 1\n", "broken"));
  }

  @Test
  public void testJsonInputDetection() {
    assertTrue(ScriptCompiler.isJsonInput("  {\"kind\": \"Module\"}"));
    assertFalse(ScriptCompiler.isJsonInput("class Demo:\n    pass\n"));
    assertFalse(ScriptCompiler.isJsonInput(""));
    assertFalse(ScriptCompiler.isJsonInput(null));
  }

  @Test
  public void testParseJsonRejectsMalformedInput() {
    ScriptCompiler.CompilationException ex = assertThrows(ScriptCompiler.CompilationException.class,
      () -> ScriptCompiler.parseJson("{not json"));
    assertTrue(ex.getMessage().startsWith("JSON 解析失败"));
  }

  private static Expr value(SourceModel.Module module, int index) {
    return ((Assign) module.body.get(index)).value;
  }
}
