package nodegraph.lift.codegen;

import nodegraph.lift.GraphLifter;
import nodegraph.lift.LiftResult;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.registry.NodeLibrary;
import nodegraph.lift.support.Diagnostics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;

import static nodegraph.lift.LiftFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 回写测试：提升 → 回写 → 写出文本 → 再解析 → 再提升，两次提升的图结构一致。
 */
public class GraphLoweringTest {

  private NodeLibrary library;

  @BeforeEach
  public void setUp() {
    library = library();
  }

  private String lowerToText(Graph graph, Diagnostics diagnostics) {
    return SourceWriter.write(new GraphLowering(library, diagnostics).lower(graph));
  }

  private void assertRoundTrip(String source) {
    Graph first = lift(source).graph();
    Diagnostics diagnostics = new Diagnostics();
    String text = lowerToText(first, diagnostics);
    LiftResult again = new GraphLifter(library).lift(parse(text));
    Graph second = again.graph();

    assertEquals(first.nodes().size(), second.nodes().size(), "节点数一致:\n" + text);
    assertEquals(first.edges().size(), second.edges().size(), "连线数一致:\n" + text);
    assertEquals(first.flowEdges().size(), second.flowEdges().size(), "流程连线数一致:\n" + text);
    assertEquals(titleCounts(first), titleCounts(second), "节点种类一致:\n" + text);
    assertTrue(again.diagnostics().isEmpty(), "回写文本再次提升不应有诊断: " + again.diagnostics().messages());
  }

  private static Map<String, Integer> titleCounts(Graph graph) {
    Map<String, Integer> counts = new TreeMap<>();
    for (GraphNode n : graph.nodes()) counts.merge(n.title(), 1, Integer::sum);
    return counts;
  }

  @Test
  public void testStraightLineRoundTrip() {
    assertRoundTrip("""
        class Demo:
            def on_start(self, who: "Entity"):
                n = add_numbers(left=1, right=2)
                spawned = spawn_entity(template="orc")
                print_string(string=n)
                set_custom_variable(variable_name="last", variable_value=spawned)
        """);
  }

  @Test
  public void testBranchJoinAndLoopRoundTrip() {
    assertRoundTrip("""
        class Demo:
            def on_start(self, flag):
                n = add_numbers(left=1, right=2)
                if flag:
                    print_string(string="yes")
                else:
                    print_string(string="no")
                set_custom_variable(variable_name="n", variable_value=n)
                for i in range(3):
                    print_string(string="tick")
                    break
        """);
  }

  @Test
  public void testMatchAndLocalVariableRoundTrip() {
    assertRoundTrip("""
        class Demo:
            def on_start(self, mode):
                match mode:
                    case 1:
                        x = get_value(key="a")
                    case "two":
                        x = get_value(key="b")
                print_string(string=x)

            def on_stop(self, items):
                for item in items:
                    print_string(string=item)
                print_string(string="stopped")
        """);
  }

  @Test
  public void testDuplicateCaseLabelRoundTrip() {
    assertRoundTrip("""
        class Demo:
            def on_start(self, mode):
                match mode:
                    case 1:
                        print_string(string="a")
                    case 1:
                        print_string(string="b")
                print_string(string="after")
        """);
  }

  @Test
  public void testVariadicNodesRoundTrip() {
    assertRoundTrip("""
        class Demo:
            def on_start(self):
                lst = assemble_list(1, 2, 3)
                d = assemble_dict("hp", 10)
                set_custom_variable(variable_name="list", variable_value=lst)
                set_custom_variable(variable_name="dict", variable_value=d)
        """);
  }

  @Test
  public void testLoweredTextShape() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, flag):
                if flag:
                    print_string(string="yes")
                print_string(string="after")
        """).graph();

    String text = lowerToText(graph, new Diagnostics());
    assertEquals("""
        class Demo:

            def on_start(self, flag):
                if flag:
                    print_string(string="yes")
                print_string(string="after")
        """, text, "空的 else 分支省略，汇合点写在 if 之后");
  }

  @Test
  public void testLocalVariablesLowerToExplicitCalls() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, flag):
                if flag:
                    x = get_value(key="a")
                else:
                    x = get_value(key="b")
                print_string(string=x)
        """).graph();

    String text = lowerToText(graph, new Diagnostics());
    assertTrue(text.contains(BuiltinNodes.GET_LOCAL_VARIABLE + "()"), text);
    assertTrue(text.contains(BuiltinNodes.SET_LOCAL_VARIABLE + "(local_variable="), text);
  }

  @Test
  public void testCompositeCallIsSkippedWithWarning() {
    Graph graph = lift("""
        class Demo:
            def __init__(self, game, owner_entity):
                self.timer = TimerSwitch()

            def on_start(self):
                self.timer.check(value=1)
        """).graph();

    Diagnostics diagnostics = new Diagnostics();
    lowerToText(graph, diagnostics);
    assertTrue(diagnostics.contains("lowering skipped"), diagnostics.messages().toString());
  }

  @Test
  public void testLiteralAndLabelHelpers() {
    assertEquals("None", SourceWriter.expr(GraphLowering.literal(null)));
    assertEquals("[1, \"a\"]", SourceWriter.expr(GraphLowering.literal(java.util.List.of(1L, "a"))));
    assertEquals("-5", SourceWriter.expr(GraphLowering.caseLabel("-5")));
    assertEquals("True", SourceWriter.expr(GraphLowering.caseLabel("True")));
    assertEquals("\"idle\"", SourceWriter.expr(GraphLowering.caseLabel("idle")));
    assertEquals("v_1st", GraphLowering.identifier("1st", "x"));
    assertEquals("self_", GraphLowering.identifier("self", "x"));
  }
}
