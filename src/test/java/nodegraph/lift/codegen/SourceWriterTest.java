package nodegraph.lift.codegen;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nodegraph.lift.LiftFixtures.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SourceWriter 输出格式测试：解析后再写出应得到规范化的相同文本。
 */
public class SourceWriterTest {

  private static String rewrite(String source) {
    return SourceWriter.write(parse(source));
  }

  @Test
  public void testAssignmentsAndCalls() {
    String source = """
        x = add_numbers(left=1, right=2)
        low, high = min_max(values=[1, 2, 3])
        print_string(string="a\\"b")
        """;
    assertEquals(source, rewrite(source));
  }

  @Test
  public void testCompoundOperandsAreParenthesized() {
    assertEquals("x = (1 + 2) * 3\n", rewrite("x = (1 + 2) * 3\n"));
    assertEquals("y = (a + b) + c\n", rewrite("y = a + b + c\n"), "左结合折叠后左操作数加括号");
    assertEquals("z = not (a and b)\n", rewrite("z = not (a and b)\n"));
  }

  @Test
  public void testElifChain() {
    String source = """
        if a:
            pass
        elif b:
            x = 1
        else:
            y = 2
        """;
    assertEquals(source, rewrite(source));
  }

  @Test
  public void testMatchAndLoop() {
    String source = """
        match mode:
            case 1:
                print_string(string="one")
            case "two":
                pass
            case _:
                break
        for i in range(0, 3):
            pass
        """;
    assertEquals(source, rewrite(source));
  }

  @Test
  public void testClassWithDecoratedMethod() {
    String source = """
        import os
        from helpers import tool
        @composite_class
        class Gate:

            @flow_entry()
            def run(self, label: "String", count=3):
                flow_in("start")
        """;
    assertEquals(source, rewrite(source));
  }

  @Test
  public void testEmptyBlockGetsPass() {
    SourceModel.For loop = new SourceModel.For();
    loop.target = SourceTrees.name("i");
    loop.iter = SourceTrees.name("items");
    loop.body = List.of();
    SourceModel.Module module = new SourceModel.Module();
    module.body = List.of(loop);
    assertEquals("for i in items:\n    pass\n", SourceWriter.write(module));
  }

  @Test
  public void testQuoteEscapesControlCharacters() {
    assertEquals("\"a\\nb\\t\\\\\"", SourceWriter.quote("a\nb\t\\"));
  }
}
