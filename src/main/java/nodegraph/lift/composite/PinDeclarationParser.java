package nodegraph.lift.composite;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.ir.NodeFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 从复合节点类的方法声明中读取引脚。
 *
 * <p>入口方法以 {@code @flow_entry()} 或 {@code @event_handler(...)} 装饰。方法签名参数（除 self）
 * 是数据输入；方法体中的标记调用声明其余引脚：</p>
 * <pre>
 * flow_in("入口")
 * flow_out("出口")
 * data_in("x", pin_type="整数")
 * data_out("y", pin_type="整数", variable="y")
 * </pre>
 */
public final class PinDeclarationParser {
  public static final Set<String> ENTRY_DECORATORS = Set.of("flow_entry", "event_handler");

  public static final String FLOW_IN = "flow_in";
  public static final String FLOW_OUT = "flow_out";
  public static final String DATA_IN = "data_in";
  public static final String DATA_OUT = "data_out";

  private PinDeclarationParser() {}

  public static boolean isEntryMethod(FunctionDef fn) {
    for (Expr d : SourceTrees.orEmpty(fn.decorators)) {
      String name = d instanceof Call c ? SourceTrees.dottedName(c.func) : SourceTrees.dottedName(d);
      if (name == null) continue;
      String last = name.substring(name.lastIndexOf('.') + 1);
      if (ENTRY_DECORATORS.contains(last)) return true;
    }
    return false;
  }

  /** 类中全部入口方法，按源码顺序 */
  public static List<FunctionDef> entryMethods(ClassDef cls) {
    List<FunctionDef> out = new ArrayList<>();
    for (Stmt s : SourceTrees.orEmpty(cls.body)) {
      if (s instanceof FunctionDef fn && isEntryMethod(fn)) out.add(fn);
    }
    return out;
  }

  /**
   * 解析单个入口方法的引脚。data_in 与签名参数同名时以 data_in 的类型为准。
   */
  public static List<PinSpec> parse(FunctionDef method) {
    Map<String, PinSpec> inputs = new LinkedHashMap<>();
    List<PinSpec> others = new ArrayList<>();

    for (Param p : SourceTrees.orEmpty(method.params)) {
      if ("self".equals(p.name)) continue;
      inputs.put(p.name, PinSpec.dataInput(p.name, NodeFactory.annotationType(p.annotation), method.name));
    }

    SourceTrees.walk(method.body, s -> {
      if (!(s instanceof ExprStmt es) || !(es.value instanceof Call call) || !(call.func instanceof Name n)) return;
      String pin = firstString(call);
      if (pin == null) return;
      switch (n.id) {
        case FLOW_IN -> others.add(PinSpec.flowInput(pin, method.name));
        case FLOW_OUT -> others.add(PinSpec.flowOutput(pin, method.name));
        case DATA_IN -> {
          PinSpec existing = inputs.get(pin);
          String type = keywordString(call, "pin_type");
          if (existing == null) {
            inputs.put(pin, PinSpec.dataInput(pin, type != null ? type : PortKinds.GENERIC_TYPE, method.name));
          } else if (type != null) {
            inputs.put(pin, existing.withType(type));
          }
        }
        case DATA_OUT -> {
          String type = keywordString(call, "pin_type");
          others.add(PinSpec.dataOutput(pin, type != null ? type : PortKinds.GENERIC_TYPE,
            keywordString(call, "variable"), method.name));
        }
        default -> { }
      }
    });

    List<PinSpec> pins = new ArrayList<>();
    // 流程入口排在最前，便于调用方按声明顺序展示
    for (PinSpec p : others) if (p.flow() && p.isInput()) pins.add(p);
    pins.addAll(inputs.values());
    for (PinSpec p : others) if (!(p.flow() && p.isInput())) pins.add(p);
    return pins;
  }

  private static String firstString(Call call) {
    List<Expr> args = SourceTrees.orEmpty(call.args);
    if (!args.isEmpty() && args.get(0) instanceof StringE s) return s.value;
    return keywordString(call, "name");
  }

  private static String keywordString(Call call, String keyword) {
    for (Keyword k : SourceTrees.orEmpty(call.keywords)) {
      if (keyword.equals(k.name) && k.value instanceof StringE s) return s.value;
    }
    return null;
  }
}
