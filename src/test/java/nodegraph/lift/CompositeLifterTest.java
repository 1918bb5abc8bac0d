package nodegraph.lift;

import nodegraph.lift.composite.PortRef;
import nodegraph.lift.composite.VirtualPin;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.registry.BuiltinNodes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nodegraph.lift.LiftFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 复合节点类提升与虚拟引脚解析测试。
 */
public class CompositeLifterTest {

  private static final String GATE = resource("/scripts/timer_gate.py");

  private CompositeLiftResult liftComposite(String source) {
    return new CompositeLifter(library()).lift(parse(source));
  }

  @Test
  public void testPinsFollowDeclarationOrder() {
    CompositeLiftResult result = liftComposite(GATE);
    List<String> names = result.pins().stream().map(VirtualPin::name).toList();
    assertEquals(List.of("start", "label", "threshold", "result", "done"), names, "流程入口在前，数据输入随后");
    assertEquals("String", result.pin("label").spec().type(), "签名注解决定引脚类型");
    assertEquals("TimerGate", result.graph().metadata().get("composite_class"));
  }

  @Test
  public void testMarkerCallsProduceNoNodes() {
    Graph graph = liftComposite(GATE).graph();
    for (GraphNode n : graph.nodes()) {
      assertFalse(n.title().startsWith("flow_") || n.title().startsWith("data_"), "标记调用不应生成节点: " + n);
    }
    assertEquals(4, graph.nodes().size(), "分支、两个打印与一个加法");
  }

  @Test
  public void testFlowInputMapsToFirstOpenBranch() {
    CompositeLiftResult result = liftComposite(GATE);
    GraphNode branch = single(result.graph(), BuiltinNodes.DOUBLE_BRANCH);
    assertEquals(List.of(new PortRef(branch.id(), PortKinds.FLOW_IN)), result.pin("start").mappings());
    assertTrue(result.graph().incoming(branch.id(), PortKinds.FLOW_IN).isEmpty(), "方法图没有入口连线");
  }

  @Test
  public void testDataPinsMapToUsageSites() {
    CompositeLiftResult result = liftComposite(GATE);
    Graph graph = result.graph();
    GraphNode firstPrint = nodesTitled(graph, "print_string").get(0);
    GraphNode branch = single(graph, BuiltinNodes.DOUBLE_BRANCH);
    GraphNode adder = single(graph, "add_numbers");

    assertTrue(result.pin("label").mappings().contains(new PortRef(firstPrint.id(), "string")));
    assertTrue(result.pin("threshold").mappings().contains(new PortRef(branch.id(), PortKinds.CONDITION)),
      "条件参数落到分支的条件端口");
    assertEquals(List.of(new PortRef(adder.id(), "result")), result.pin("result").mappings(),
      "数据输出按 variable 找到变量绑定");
  }

  @Test
  public void testSingleFlowOutputMapsToFinalFrontier() {
    CompositeLiftResult result = liftComposite(GATE);
    GraphNode lastPrint = nodesTitled(result.graph(), "print_string").get(1);
    assertEquals(List.of(new PortRef(lastPrint.id(), PortKinds.FLOW_OUT)), result.pin("done").mappings());
    assertTrue(result.diagnostics().isEmpty(), "全部引脚已映射: " + result.diagnostics().messages());
  }

  @Test
  public void testUnusedPinIsMarkedAllowUnmapped() {
    CompositeLiftResult result = liftComposite("""
        class Relay:
            @event_handler("tick")
            def relay(self):
                data_in("unused", pin_type="Integer")
                print_string(string="x")
        """);

    VirtualPin unused = result.pin("unused");
    assertNotNull(unused);
    assertTrue(unused.allowUnmapped(), "未找到位置的引脚显式允许未映射");
    assertTrue(unused.mappings().isEmpty());
    assertTrue(result.diagnostics().contains("unresolved pin anchor: unused"));
  }

  @Test
  public void testLocalAliasOfParameterIsTracked() {
    CompositeLiftResult result = liftComposite("""
        class Relay:
            @flow_entry()
            def relay(self, message):
                alias = message
                again = alias
                print_string(string=again)
        """);

    GraphNode print = single(result.graph(), "print_string");
    assertEquals(List.of(new PortRef(print.id(), "string")), result.pin("message").mappings(), "别名可传递");
  }

  @Test
  public void testFieldStoredInEntryIsReadInHandler() {
    CompositeLiftResult result = liftComposite("""
        class Ticker:
            @flow_entry()
            def start(self, tid):
                self._tid = tid
                print_string(string="started")

            @event_handler("tick")
            def on_tick(self):
                print_string(string=self._tid)
        """);

    GraphNode reader = nodesTitled(result.graph(), "print_string").get(1);
    VirtualPin tid = result.pin("tid");
    assertEquals(List.of(new PortRef(reader.id(), "string")), tid.mappings(),
      "事件方法读取的字段归到写入它的入口方法的引脚");
    assertFalse(tid.allowUnmapped());
    assertFalse(result.diagnostics().contains("unresolved pin anchor: tid"), result.diagnostics().messages().toString());
  }

  @Test
  public void testSameParameterNameInAnotherMethodDoesNotShareField() {
    CompositeLiftResult result = liftComposite("""
        class Relay:
            def helper(self, message):
                self.saved = message

            @flow_entry()
            def relay(self, message):
                print_string(string=self.saved)
        """);

    VirtualPin message = result.pin("message");
    assertTrue(message.mappings().isEmpty(), "字段由 helper 的参数写入，与 relay 的同名参数无关");
    assertTrue(message.allowUnmapped());
    assertTrue(result.diagnostics().contains("unresolved pin anchor: message"));
  }

  @Test
  public void testMethodGraphsMergeWithoutIdClash() {
    CompositeLiftResult result = liftComposite("""
        class Twin:
            @flow_entry()
            def first(self):
                print_string(string="a")

            @flow_entry()
            def second(self):
                print_string(string="b")
        """);

    List<String> ids = result.graph().nodes().stream().map(GraphNode::id).toList();
    assertEquals(List.of("node_print_string_1", "node_print_string_2"), ids, "共享 id 生成器，合并时不需要改名");
    assertTrue(result.pins().isEmpty());
  }

  @Test
  public void testModuleWithoutCompositeClassIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> liftComposite("""
        class Plain:
            def on_start(self):
                print_string(string="a")
        """));
  }
}
