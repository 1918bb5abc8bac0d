package nodegraph.lift.ir;

import nodegraph.lift.LiftFixtures;
import nodegraph.lift.core.SourceModel.Call;
import nodegraph.lift.core.SourceModel.Expr;
import nodegraph.lift.core.SourceModel.Keyword;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.registry.NodeLibrary;
import nodegraph.lift.registry.NodeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentBinderTest {

  private NodeLibrary library;
  private final LiftOptions options = LiftOptions.defaults();

  @BeforeEach
  public void setUp() {
    library = LiftFixtures.library();
  }

  private static Call call(String func, List<Expr> args, List<Keyword> keywords) {
    return SourceTrees.call(SourceTrees.name(func), args, keywords);
  }

  private ArgumentBinder.Bindings bind(Call call) {
    NodeSpec spec = library.resolve(SourceTrees.calleeName(call)).orElseThrow();
    return ArgumentBinder.bind(call, spec, options);
  }

  private static List<String> ports(ArgumentBinder.Bindings b) {
    return b.arguments().stream().map(ArgumentBinder.BoundArgument::port).toList();
  }

  @Test
  public void testReservedContextArgumentIsSkipped() {
    ArgumentBinder.Bindings b = bind(call("add_numbers",
      List.of(SourceTrees.dotted("self.game"), SourceTrees.intLit(1), SourceTrees.intLit(2)), List.of()));
    assertEquals(List.of("left", "right"), ports(b));
    assertTrue(b.overflow().isEmpty());
  }

  @Test
  public void testKeywordPortsAreExcludedFromPositionalFilling() {
    ArgumentBinder.Bindings b = bind(call("add_numbers",
      List.of(SourceTrees.intLit(1)), List.of(SourceTrees.keyword("left", SourceTrees.intLit(5)))));
    assertEquals(List.of("right", "left"), ports(b), "位置参数跳过已由关键字占用的端口");
  }

  @Test
  public void testExtraPositionalArgumentsOverflow() {
    ArgumentBinder.Bindings b = bind(call("add_numbers",
      List.of(SourceTrees.intLit(1), SourceTrees.intLit(2), SourceTrees.intLit(3)), List.of()));
    assertEquals(1, b.overflow().size());
  }

  @Test
  public void testSimpleVariadicArguments() {
    ArgumentBinder.Bindings b = bind(call("assemble_list",
      List.of(SourceTrees.str("a"), SourceTrees.str("b"), SourceTrees.str("c")), List.of()));
    assertEquals(List.of("0", "1", "2"), ports(b));
    assertEquals(3, b.variadicCount());
    assertTrue(b.arguments().get(0).variadic());
  }

  @Test
  public void testKeyedVariadicArgumentsArePaired() {
    ArgumentBinder.Bindings b = bind(call("assemble_dict",
      List.of(SourceTrees.str("hp"), SourceTrees.intLit(10), SourceTrees.str("mp"), SourceTrees.intLit(5),
        SourceTrees.str("odd")), List.of()));
    assertEquals(List.of("key0", "value0", "key1", "value1"), ports(b));
    assertEquals(2, b.variadicCount(), "按 (键, 值) 成对计数");
    assertEquals(1, b.overflow().size(), "落单的键进入溢出");
    assertEquals("String", b.arguments().get(0).type());
  }

  @Test
  public void testNoVariadicArguments() {
    ArgumentBinder.Bindings b = bind(call("assemble_list", List.of(), List.of()));
    assertTrue(b.arguments().isEmpty());
    assertEquals(0, b.variadicCount());
  }

  @Test
  public void testDuplicateKeywordOverflows() {
    ArgumentBinder.Bindings b = bind(call("add_numbers", List.of(),
      List.of(SourceTrees.keyword("left", SourceTrees.intLit(1)), SourceTrees.keyword("left", SourceTrees.intLit(2)))));
    assertEquals(List.of("left"), ports(b));
    assertEquals(1, b.overflow().size());
  }
}
