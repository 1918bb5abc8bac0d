package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.Call;
import nodegraph.lift.core.SourceModel.Expr;
import nodegraph.lift.core.SourceModel.Keyword;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.registry.PortSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 调用实参到端口名的绑定规则，工厂、展平器与连线共用同一份顺序逻辑。
 *
 * <ul>
 *   <li>首个位置参数若为保留上下文参数（如 {@code self.game}）则跳过</li>
 *   <li>关键字参数按端口名绑定</li>
 *   <li>其余位置参数依次填入声明的非流程端口，用尽后进入可变参数范围；
 *       键值范围按 (键, 值) 成对消耗</li>
 * </ul>
 */
final class ArgumentBinder {

  /**
   * 绑定结果。port 为 null 表示该实参没有可用端口。
   */
  record BoundArgument(String port, Expr expr, String type, boolean variadic) {}

  /** 绑定结果及其中的可变参数个数 */
  record Bindings(List<BoundArgument> arguments, int variadicCount, List<Expr> overflow) {}

  private ArgumentBinder() {}

  static boolean isReserved(Expr e, LiftOptions options) {
    String dotted = SourceTrees.dottedName(e);
    return dotted != null && options.reservedArguments().contains(dotted);
  }

  /** 去掉保留上下文参数后的位置参数 */
  static List<Expr> effectivePositional(Call call, LiftOptions options) {
    List<Expr> args = SourceTrees.orEmpty(call.args);
    if (!args.isEmpty() && isReserved(args.get(0), options)) {
      return args.subList(1, args.size());
    }
    return args;
  }

  static Bindings bind(Call call, NodeSpec spec, LiftOptions options) {
    List<BoundArgument> out = new ArrayList<>();
    List<Expr> overflow = new ArrayList<>();
    Set<String> used = new HashSet<>();

    Set<String> keywordPorts = new HashSet<>();
    for (Keyword k : SourceTrees.orEmpty(call.keywords)) keywordPorts.add(k.name);

    List<PortSpec> fixed = new ArrayList<>();
    for (PortSpec p : spec.positionalInputs()) {
      if (!keywordPorts.contains(p.name)) fixed.add(p);
    }
    NodeSpec.VariadicRange range = spec.variadicRange();

    List<Expr> positional = effectivePositional(call, options);
    int index = 0;
    for (; index < positional.size() && index < fixed.size(); index++) {
      PortSpec p = fixed.get(index);
      out.add(new BoundArgument(p.name, positional.get(index), p.type, false));
      used.add(p.name);
    }

    int variadicCount = 0;
    if (range != null) {
      List<Expr> rest = positional.subList(index, positional.size());
      if (range.keyed()) {
        int pairs = 0;
        for (int i = 0; i + 1 < rest.size() && pairs < range.capacity(); i += 2, pairs++) {
          out.add(new BoundArgument(range.keyPort(pairs), rest.get(i), range.keyType(), true));
          out.add(new BoundArgument(range.valuePort(pairs), rest.get(i + 1), range.valueType(), true));
          used.add(range.keyPort(pairs));
          used.add(range.valuePort(pairs));
        }
        variadicCount = pairs;
        if (rest.size() > pairs * 2) overflow.addAll(rest.subList(pairs * 2, rest.size()));
      } else {
        int n = Math.min(rest.size(), range.capacity());
        for (int i = 0; i < n; i++) {
          out.add(new BoundArgument(range.simplePort(i), rest.get(i), range.valueType(), true));
          used.add(range.simplePort(i));
        }
        variadicCount = n;
        if (rest.size() > n) overflow.addAll(rest.subList(n, rest.size()));
      }
    } else if (index < positional.size()) {
      overflow.addAll(positional.subList(index, positional.size()));
    }

    for (Keyword k : SourceTrees.orEmpty(call.keywords)) {
      if (!used.add(k.name)) {
        overflow.add(k.value);
        continue;
      }
      PortSpec declared = spec.findInput(k.name);
      out.add(new BoundArgument(k.name, k.value, declared != null ? declared.type : null, false));
    }
    return new Bindings(out, variadicCount, overflow);
  }
}
