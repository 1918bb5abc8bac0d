package nodegraph.lift;

import nodegraph.lift.graph.Edge;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.BuiltinNodes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nodegraph.lift.LiftFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * GraphLifter 端到端测试：脚本文本 → 源码模型 → 事件图。
 */
public class GraphLifterTest {

  @Test
  public void testStraightLineCallsChainFlow() {
    LiftResult result = lift("""
        class Demo:
            def on_start(self):
                print_string(self.game, string="a")
                print_string(string="b")
                print_string(string="c")
        """);
    Graph graph = result.graph();

    assertEquals(4, graph.nodes().size(), "事件节点加三个调用节点");
    assertEquals(3, graph.flowEdges().size(), "三条流程连线");
    List<GraphNode> prints = nodesTitled(graph, "print_string");
    int between = 0;
    for (Edge e : graph.flowEdges()) {
      if (prints.stream().anyMatch(n -> n.id().equals(e.srcNode))) between++;
    }
    assertEquals(2, between, "调用之间两条连线");
    assertEquals("a", prints.get(0).constant("string"), "关键字字面量写入常量表");
    assertTrue(result.diagnostics().isEmpty(), "不应产生诊断: " + result.diagnostics().messages());
  }

  @Test
  public void testEventNodeIdsAndOrder() {
    Graph graph = lift("""
        class Demo:
            def on_start(self):
                print_string(string="a")

            def on_stop(self, reason: "String"):
                print_string(string=reason)
        """).graph();

    assertEquals(List.of("start", "stop"), graph.eventFlowTitles());
    assertEquals("event_start_1", graph.eventFlowOrder().get(0), "事件 id 与节点共用计数器");
    GraphNode stop = graph.node(graph.eventFlowOrder().get(1));
    assertEquals("String", stop.output("reason").type, "字符串注解决定端口类型");
    GraphNode secondPrint = nodesTitled(graph, "print_string").get(1);
    assertTrue(hasEdge(graph, stop, "reason", secondPrint, "string"), "事件参数连到读取它的端口");
  }

  @Test
  public void testVariableAssignedInBothBranchesGetsLocalVariable() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, flag):
                if flag:
                    x = get_value(key="a")
                else:
                    x = get_value(key="b")
                print_string(string=x)
        """).graph();

    GraphNode get = single(graph, BuiltinNodes.GET_LOCAL_VARIABLE);
    List<GraphNode> sets = nodesTitled(graph, BuiltinNodes.SET_LOCAL_VARIABLE);
    assertEquals(2, sets.size(), "每个分支一个设置节点");
    for (GraphNode set : sets) {
      assertTrue(hasEdge(graph, get, BuiltinNodes.LOCAL_VARIABLE, set, BuiltinNodes.LOCAL_VARIABLE),
        "设置节点写入获取节点的句柄");
    }
    GraphNode print = single(graph, "print_string");
    assertTrue(hasEdge(graph, get, BuiltinNodes.VALUE, print, "string"), "分支后的读取连到获取节点");
    assertEquals(2, graph.incoming(print.id(), PortKinds.FLOW_IN).size(), "两个分支汇合到后续调用");
  }

  @Test
  public void testVariableAssignedInOneBranchWithoutLaterReadStaysPlain() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, flag):
                if flag:
                    x = get_value(key="a")
                print_string(string="done")
        """).graph();

    assertTrue(nodesTitled(graph, BuiltinNodes.GET_LOCAL_VARIABLE).isEmpty(), "不应合成获取节点");
    assertTrue(nodesTitled(graph, BuiltinNodes.SET_LOCAL_VARIABLE).isEmpty(), "不应合成设置节点");
    assertEquals(1, nodesTitled(graph, "get_value").size(), "赋值语句照常实例化");
  }

  @Test
  public void testBreakInsideLoopWiresToBreakPort() {
    Graph graph = lift("""
        class Demo:
            def on_start(self):
                for i in range(3):
                    print_string(string="tick")
                    break
                    print_string(string="never")
        """).graph();

    GraphNode loop = single(graph, BuiltinNodes.FINITE_LOOP);
    List<GraphNode> prints = nodesTitled(graph, "print_string");
    assertEquals(1, prints.size(), "break 之后的语句不再提升");
    assertTrue(hasEdge(graph, prints.get(0), PortKinds.FLOW_OUT, loop, PortKinds.BREAK_LOOP));
    assertEquals(0L, loop.constant(BuiltinNodes.START_VALUE), "单参数 range 起始值为 0");
    assertEquals(3L, loop.constant(BuiltinNodes.END_VALUE));
  }

  @Test
  public void testBreakOutsideLoopIsReported() {
    LiftResult result = lift("""
        class Demo:
            def on_start(self):
                print_string(string="a")
                break
                print_string(string="b")
        """);

    assertTrue(result.diagnostics().contains("break outside loop"), "应报告循环外的 break");
    for (Edge e : result.graph().edges()) {
      assertNotEquals(PortKinds.BREAK_LOOP, e.dstPort, "不应生成 break 连线");
    }
    assertEquals(2, nodesTitled(result.graph(), "print_string").size(), "后续语句继续提升");
  }

  @Test
  public void testNestedCallFlattensIntoTwoNodes() {
    LiftResult result = new GraphLifter(library()).liftStatements(parse("""
        total = add_numbers(left=get_value(key="a"), right=3)
        """).body);
    Graph graph = result.graph();

    assertEquals(2, graph.nodes().size(), "内外两层各一个节点");
    assertEquals(1, graph.edges().size(), "一条数据连线");
    GraphNode inner = single(graph, "get_value");
    GraphNode outer = single(graph, "add_numbers");
    assertTrue(hasEdge(graph, inner, "value", outer, "left"));
    assertEquals("node_get_value_1", inner.id(), "最内层先创建");
    assertEquals("node_add_numbers_2", outer.id());
  }

  @Test
  public void testBareDataCallIsDropped() {
    Graph graph = lift("""
        class Demo:
            def on_start(self):
                add_numbers(left=1, right=2)
                print_string(string="a")
        """).graph();

    assertTrue(nodesTitled(graph, "add_numbers").isEmpty(), "没有消费者的纯数据调用不生成节点");
    assertEquals(1, graph.flowEdges().size());
  }

  @Test
  public void testTupleTargetsBindOutputsByIndex() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, values):
                low, high = min_max(values=values)
                print_string(string=high)
        """).graph();

    GraphNode minMax = single(graph, "min_max");
    GraphNode print = single(graph, "print_string");
    assertTrue(hasEdge(graph, minMax, "maximum", print, "string"), "第二个目标绑定第二个数据输出");
    assertEquals("low", minMax.customVarNames().get("minimum"));
  }

  @Test
  public void testMatchWithoutWildcardFallsThroughDefault() {
    Graph graph = lift("""
        class Demo:
            def on_start(self, mode):
                match mode:
                    case 1:
                        print_string(string="one")
                    case 2:
                        print_string(string="two")
                print_string(string="after")
        """).graph();

    GraphNode branch = single(graph, BuiltinNodes.MULTIPLE_BRANCHES);
    assertTrue(branch.hasOutput("1") && branch.hasOutput("2"), "每个 case 一个出口");
    GraphNode after = nodesTitled(graph, "print_string").get(2);
    assertEquals(3, graph.incoming(after.id(), PortKinds.FLOW_IN).size(), "两个 case 加默认出口汇合");
    assertTrue(hasEdge(graph, branch, PortKinds.DEFAULT, after, PortKinds.FLOW_IN));
  }

  @Test
  public void testDuplicateCaseLabelKeepsFirstBody() {
    LiftResult result = lift("""
        class Demo:
            def on_start(self, mode):
                match mode:
                    case 1:
                        print_string(string="a")
                    case 1:
                        print_string(string="b")
        """);
    Graph graph = result.graph();

    GraphNode branch = single(graph, BuiltinNodes.MULTIPLE_BRANCHES);
    List<GraphNode> prints = nodesTitled(graph, "print_string");
    assertEquals(1, prints.size(), "只有第一个 case 会执行");
    assertEquals("a", prints.get(0).constant("string"));
    assertEquals(1, graph.outgoing(branch.id(), "1").size(), "同一出口只接一个分支体");
    assertTrue(result.diagnostics().contains("duplicate case label: '1'"), result.diagnostics().messages().toString());
  }

  @Test
  public void testUnresolvedCallIsReportedAndSkipped() {
    LiftResult result = lift("""
        class Demo:
            def on_start(self):
                launch_rocket(speed=3)
                print_string(string="a")
        """);

    assertTrue(result.diagnostics().contains("unresolved call: launch_rocket"));
    assertEquals(2, result.graph().nodes().size(), "无法解析的调用不生成节点");
    assertEquals(1, result.graph().flowEdges().size(), "后续调用仍接在事件之后");
  }

  @Test
  public void testCompositeMatchUsesExitsDirectly() {
    Graph graph = lift("""
        class Demo:
            def __init__(self, game, owner_entity):
                self.timer = TimerSwitch()

            def on_start(self):
                match self.timer.check(value=5):
                    case 0:
                        print_string(string="zero")
                    case 1:
                        print_string(string="one")
                    case _:
                        print_string(string="other")
        """).graph();

    assertTrue(nodesTitled(graph, BuiltinNodes.MULTIPLE_BRANCHES).isEmpty(), "不应生成多分支节点");
    GraphNode timer = single(graph, "TimerSwitch");
    assertEquals("composite_timer_switch", timer.compositeId());
    List<GraphNode> prints = nodesTitled(graph, "print_string");
    assertTrue(hasEdge(graph, timer, "0", prints.get(0), PortKinds.FLOW_IN));
    assertTrue(hasEdge(graph, timer, "1", prints.get(1), PortKinds.FLOW_IN));
    assertTrue(hasEdge(graph, timer, PortKinds.DEFAULT, prints.get(2), PortKinds.FLOW_IN));
    assertEquals(1, graph.incoming(timer.id(), "start").size(), "事件接入复合节点的流程入口");
  }

  @Test
  public void testCompositeMatchWithUnknownExitIsDropped() {
    LiftResult result = lift("""
        class Demo:
            def __init__(self, game, owner_entity):
                self.timer = TimerSwitch()

            def on_start(self):
                match self.timer.check(value=5):
                    case 0:
                        print_string(string="zero")
                    case 7:
                        print_string(string="seven")
        """);

    assertTrue(result.diagnostics().contains("ambiguous match dispatch"));
    assertTrue(nodesTitled(result.graph(), "TimerSwitch").isEmpty(), "整条语句丢弃");
    assertTrue(nodesTitled(result.graph(), "print_string").isEmpty());
  }

  @Test
  public void testModuleWithoutEventsYieldsEmptyGraph() {
    LiftResult result = lift("""
        LIMIT = 3
        """);
    assertTrue(result.graph().nodes().isEmpty());
    assertTrue(result.graph().eventFlowOrder().isEmpty());
  }
}
