package nodegraph.lift.codegen;

import nodegraph.lift.core.SourceModel;
import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;
import nodegraph.lift.graph.Edge;
import nodegraph.lift.graph.Graph;
import nodegraph.lift.graph.GraphNode;
import nodegraph.lift.graph.Port;
import nodegraph.lift.graph.PortKinds;
import nodegraph.lift.ir.LiftOptions;
import nodegraph.lift.registry.BuiltinNodes;
import nodegraph.lift.registry.NodeRegistry;
import nodegraph.lift.registry.NodeSpec;
import nodegraph.lift.registry.PortSpec;
import nodegraph.lift.support.DiagnosticSink;
import nodegraph.lift.support.ErrorMessages;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 把事件图回写为源码模型：一个图类，每个事件一个事件方法。
 *
 * <p>回写结果再次提升后节点数、连线数与拓扑不变：</p>
 * <ul>
 *   <li>每个节点对应一条赋值或调用语句，输出变量名全图唯一，不会触发局部变量合成</li>
 *   <li>纯数据节点在其全部数据来源可用后立即写出，放在最近的语句块中</li>
 *   <li>局部变量节点写成显式的 {@code get_local_variable}/{@code set_local_variable} 调用</li>
 *   <li>流程汇合点（多条流程入边的节点）在汇入它的全部分支结束后写出</li>
 * </ul>
 *
 * <p>复合节点调用无法回写，只产生诊断。</p>
 */
public final class GraphLowering {
  private static final Logger LOGGER = Logger.getLogger(GraphLowering.class.getName());

  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}\\p{Mn}\\p{Mc}_]*");
  private static final Pattern INTEGER_LABEL = Pattern.compile("-?\\d{1,18}");
  private static final Set<String> KEYWORDS = Set.of(
    "if", "elif", "else", "for", "in", "while", "def", "class", "return", "pass", "break", "import", "from",
    "as", "not", "and", "or", "is", "None", "True", "False", "self");

  private final NodeRegistry registry;
  private final DiagnosticSink diagnostics;
  private final LiftOptions options;

  public GraphLowering(NodeRegistry registry, DiagnosticSink diagnostics) {
    this(registry, diagnostics, LiftOptions.defaults());
  }

  public GraphLowering(NodeRegistry registry, DiagnosticSink diagnostics, LiftOptions options) {
    this.registry = registry;
    this.diagnostics = diagnostics;
    this.options = options;
  }

  public SourceModel.Module lower(Graph graph) {
    ClassDef cls = new ClassDef();
    cls.name = identifier(graph.graphName(), "Graph");
    cls.bases = new ArrayList<>();
    cls.decorators = new ArrayList<>();
    cls.body = new ArrayList<>();

    Map<String, List<GraphNode>> owned = dataNodesByEvent(graph);
    Set<String> usedNames = new HashSet<>();
    for (String eventId : graph.eventFlowOrder()) {
      GraphNode event = graph.node(eventId);
      if (event == null) continue;
      cls.body.add(new MethodLowering(graph, event, owned.getOrDefault(eventId, List.of()), usedNames).lower());
    }
    if (cls.body.isEmpty()) cls.body.add(new Pass());

    SourceModel.Module module = new SourceModel.Module();
    module.name = graph.graphId();
    module.body = new ArrayList<>(List.of(cls));
    LOGGER.log(Level.FINE, "回写完成：{0} 个事件方法", graph.eventFlowOrder().size());
    return module;
  }

  /** 纯数据节点按插入顺序归属到其前最近的事件节点 */
  private static Map<String, List<GraphNode>> dataNodesByEvent(Graph graph) {
    Set<String> events = new HashSet<>(graph.eventFlowOrder());
    Map<String, List<GraphNode>> owned = new LinkedHashMap<>();
    String current = null;
    for (GraphNode n : graph.nodes()) {
      if (events.contains(n.id())) {
        current = n.id();
      } else if (current != null && !PortKinds.isFlowNode(n)) {
        owned.computeIfAbsent(current, k -> new ArrayList<>()).add(n);
      }
    }
    return owned;
  }

  /** 流程遍历结果：停在某个汇合点（附带到达次数），或在 END 处结束 */
  private record Segment(String stopNode, int arrivals) {
    static final Segment END = new Segment(null, 0);

    boolean ended() {
      return stopNode == null;
    }
  }

  private final class MethodLowering {
    private final Graph graph;
    private final GraphNode event;
    private final Set<String> usedNames;
    private final Set<String> pending = new LinkedHashSet<>();
    private final Set<String> available = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final Map<String, String> names = new HashMap<>();

    MethodLowering(Graph graph, GraphNode event, List<GraphNode> dataNodes, Set<String> usedNames) {
      this.graph = graph;
      this.event = event;
      this.usedNames = usedNames;
      for (GraphNode n : dataNodes) pending.add(n.id());
    }

    FunctionDef lower() {
      FunctionDef fn = new FunctionDef();
      fn.name = options.eventPrefix() + event.title();
      fn.decorators = new ArrayList<>();
      fn.params = new ArrayList<>();
      fn.params.add(param("self", null));
      for (Port p : PortKinds.dataOutputs(event)) {
        usedNames.add(p.name);
        names.put(key(event.id(), p.name), p.name);
        fn.params.add(param(p.name, p.type));
      }
      available.add(event.id());

      List<Stmt> body = new ArrayList<>();
      flush(body);
      Segment tail = follow(event.id(), PortKinds.FLOW_OUT, body);
      if (!tail.ended()) {
        // 汇合点的入边来自其他事件，按普通节点继续
        enter(tail.stopNode(), body, false);
      }
      if (!pending.isEmpty()) {
        LOGGER.log(Level.FINE, "事件 {0} 有 {1} 个数据节点的来源不可用", new Object[]{event.id(), pending.size()});
        for (String id : new ArrayList<>(pending)) emitData(graph.node(id), body);
      }
      fn.body = body.isEmpty() ? new ArrayList<>(List.of(new Pass())) : body;
      return fn;
    }

    private Param param(String name, String type) {
      Param p = new Param();
      p.name = name;
      if (type != null && !PortKinds.GENERIC_TYPE.equals(type)) p.annotation = SourceTrees.str(type);
      return p;
    }

    // ---- 流程遍历 ----

    private Segment follow(String nodeId, String port, List<Stmt> block) {
      List<Edge> out = graph.outgoing(nodeId, port);
      if (out.isEmpty()) return Segment.END;
      if (out.size() > 1) {
        LOGGER.log(Level.FINE, "流程出口 {0}.{1} 有多条连线，只回写第一条", new Object[]{nodeId, port});
      }
      Edge e = out.get(0);
      if (PortKinds.BREAK_LOOP.equals(e.dstPort)) {
        block.add(new Break());
        return Segment.END;
      }
      return enter(e.dstNode, block, true);
    }

    private Segment enter(String nodeId, List<Stmt> block, boolean checkJoin) {
      if (checkJoin && arrivalsExpected(nodeId) > 1) return new Segment(nodeId, 1);
      if (!visited.add(nodeId)) {
        LOGGER.log(Level.FINE, "节点 {0} 已回写，停止遍历", nodeId);
        return Segment.END;
      }
      GraphNode node = graph.node(nodeId);
      String title = node.title();

      if (BuiltinNodes.DOUBLE_BRANCH.equals(title)) {
        If iff = new If();
        iff.test = valueOf(node, PortKinds.CONDITION, SourceTrees.none());
        iff.body = new ArrayList<>();
        iff.orelse = new ArrayList<>();
        available.add(nodeId);
        Segment yes = follow(nodeId, PortKinds.YES, iff.body);
        Segment no = follow(nodeId, PortKinds.NO, iff.orelse);
        if (iff.body.isEmpty()) iff.body.add(new Pass());
        block.add(iff);
        return rejoin(List.of(yes, no), block);
      }

      if (BuiltinNodes.MULTIPLE_BRANCHES.equals(title)) {
        Match match = new Match();
        match.subject = valueOf(node, PortKinds.CONTROL_EXPRESSION, SourceTrees.none());
        match.cases = new ArrayList<>();
        available.add(nodeId);
        List<Segment> arms = new ArrayList<>();
        for (Port p : PortKinds.flowOutputs(node)) {
          if (PortKinds.DEFAULT.equals(p.name)) continue;
          Case c = new Case();
          PatValue pattern = new PatValue();
          pattern.value = caseLabel(p.name);
          c.pattern = pattern;
          c.body = new ArrayList<>();
          arms.add(follow(nodeId, p.name, c.body));
          if (c.body.isEmpty()) c.body.add(new Pass());
          match.cases.add(c);
        }
        List<Stmt> fallback = new ArrayList<>();
        arms.add(follow(nodeId, PortKinds.DEFAULT, fallback));
        // 默认出口没有语句时省略 case _，两种写法提升结果相同
        if (!fallback.isEmpty()) {
          Case c = new Case();
          c.pattern = new PatWildcard();
          c.body = fallback;
          match.cases.add(c);
        }
        block.add(match);
        return rejoin(arms, block);
      }

      if (BuiltinNodes.isLoop(title)) {
        block.add(loop(node));
        return follow(nodeId, PortKinds.LOOP_COMPLETE, block);
      }

      if (node.compositeId() != null || registry.resolve(title).map(NodeSpec::isComposite).orElse(false)) {
        diagnostics.warn(ErrorMessages.loweringSkipped(nodeId, "composite call"));
      } else {
        block.add(callStatement(node));
      }
      available.add(nodeId);
      flush(block);
      return follow(nodeId, PortKinds.defaultFlowOutput(node), block);
    }

    /**
     * 合并各分支的遍历结果：到达同一汇合点的次数等于其流程入边数时，在分支语句之后继续；
     * 否则把汇合点交给外层。
     */
    private Segment rejoin(List<Segment> arms, List<Stmt> block) {
      String stop = null;
      int arrivals = 0;
      for (Segment s : arms) {
        if (s.ended()) continue;
        if (stop == null) {
          stop = s.stopNode();
        } else if (!stop.equals(s.stopNode())) {
          diagnostics.warn(ErrorMessages.loweringSkipped(s.stopNode(), "conflicting join after branch"));
          continue;
        }
        arrivals += s.arrivals();
      }
      if (stop == null) return Segment.END;
      if (arrivals >= arrivalsExpected(stop)) return enter(stop, block, false);
      return new Segment(stop, arrivals);
    }

    private int arrivalsExpected(String nodeId) {
      GraphNode node = graph.node(nodeId);
      int count = 0;
      for (Edge e : graph.incomingTo(nodeId)) {
        if (!PortKinds.BREAK_LOOP.equals(e.dstPort) && PortKinds.isFlowInput(node, e.dstPort)) count++;
      }
      return count;
    }

    private For loop(GraphNode node) {
      For f = new For();
      if (BuiltinNodes.FINITE_LOOP.equals(node.title())) {
        f.iter = SourceTrees.call(SourceTrees.name("range"), List.of(
          valueOf(node, BuiltinNodes.START_VALUE, SourceTrees.intLit(0)),
          valueOf(node, BuiltinNodes.END_VALUE, SourceTrees.intLit(0))), List.of());
        f.target = SourceTrees.name(nameOf(node, BuiltinNodes.CURRENT_VALUE));
      } else {
        f.iter = valueOf(node, BuiltinNodes.ITERATION_LIST, SourceTrees.list(List.of()));
        f.target = SourceTrees.name(nameOf(node, BuiltinNodes.ITERATION_VALUE));
      }
      f.body = new ArrayList<>();
      available.add(node.id());
      flush(f.body);
      follow(node.id(), PortKinds.LOOP_BODY, f.body);
      if (f.body.isEmpty()) f.body.add(new Pass());
      return f;
    }

    // ---- 数据节点 ----

    /** 把来源均已可用的待写数据节点写入当前语句块，直到没有新的节点就绪 */
    private void flush(List<Stmt> block) {
      boolean progress = true;
      while (progress) {
        progress = false;
        Iterator<String> it = pending.iterator();
        while (it.hasNext()) {
          GraphNode n = graph.node(it.next());
          if (!ready(n)) continue;
          it.remove();
          block.add(callStatement(n));
          available.add(n.id());
          progress = true;
        }
      }
    }

    private void emitData(GraphNode n, List<Stmt> block) {
      pending.remove(n.id());
      block.add(callStatement(n));
      available.add(n.id());
    }

    private boolean ready(GraphNode n) {
      for (Edge e : graph.incomingTo(n.id())) {
        if (!available.contains(e.srcNode)) return false;
      }
      return true;
    }

    // ---- 调用语句 ----

    private Stmt callStatement(GraphNode node) {
      Call call = SourceTrees.call(SourceTrees.name(node.title()), new ArrayList<>(), new ArrayList<>());
      bindArguments(node, call);

      List<Port> outputs = PortKinds.dataOutputs(node);
      if (outputs.isEmpty()) {
        SourceModel.ExprStmt es = new SourceModel.ExprStmt();
        es.value = call;
        return es;
      }
      Optional<NodeSpec> spec = registry.resolve(node.title());
      boolean fromTargets = spec.isPresent() && spec.get().outputsFromTargets;
      List<Expr> targets = new ArrayList<>();
      for (Port p : outputs) {
        String name = fromTargets ? p.name : nameOf(node, p.name);
        names.putIfAbsent(key(node.id(), p.name), name);
        targets.add(SourceTrees.name(name));
      }
      Assign a = new Assign();
      a.target = targets.size() == 1 ? targets.get(0) : SourceTrees.tuple(targets);
      a.value = call;
      return a;
    }

    /**
     * 有可变参数范围的节点全部按位置传参（缺失的声明端口写 None），其余节点按端口名传关键字参数。
     */
    private void bindArguments(GraphNode node, Call call) {
      Optional<NodeSpec> spec = registry.resolve(node.title());
      NodeSpec.VariadicRange range = spec.map(NodeSpec::variadicRange).orElse(null);
      Set<String> consumed = new HashSet<>();

      if (range != null) {
        for (PortSpec p : spec.get().positionalInputs()) {
          call.args.add(valueOf(node, p.name, SourceTrees.none()));
          consumed.add(p.name);
        }
        for (int i = 0; i < range.capacity(); i++) {
          List<String> ports = range.keyed() ? List.of(range.keyPort(i), range.valuePort(i)) : List.of(range.simplePort(i));
          if (!node.hasInput(ports.get(0))) break;
          for (String port : ports) {
            call.args.add(valueOf(node, port, SourceTrees.none()));
            consumed.add(port);
          }
        }
      }

      for (Port p : node.inputs()) {
        if (consumed.contains(p.name) || PortKinds.isFlowInput(node, p.name)) continue;
        Expr value = valueOf(node, p.name, null);
        if (value != null) call.keywords.add(SourceTrees.keyword(p.name, value));
      }
    }

    /** 端口的值：数据入边对应的变量名，其次常量，都没有时返回 fallback */
    private Expr valueOf(GraphNode node, String port, Expr fallback) {
      List<Edge> in = graph.incoming(node.id(), port);
      if (!in.isEmpty()) {
        Edge e = in.get(0);
        return SourceTrees.name(nameOf(graph.node(e.srcNode), e.srcPort));
      }
      if (node.hasConstant(port)) return literal(node.constant(port));
      return fallback;
    }

    private String nameOf(GraphNode node, String port) {
      return names.computeIfAbsent(key(node.id(), port), k -> {
        String base = node.customVarNames().get(port);
        String candidate = identifier(base != null ? base : port, "v_" + port);
        String unique = candidate;
        for (int i = 2; !usedNames.add(unique); i++) unique = candidate + "_" + i;
        return unique;
      });
    }
  }

  private static String key(String nodeId, String port) {
    return nodeId + "\u0000" + port;
  }

  static String identifier(String raw, String fallback) {
    String candidate = raw != null ? raw : fallback;
    if (!IDENTIFIER.matcher(candidate).matches()) {
      candidate = "v_" + candidate.replaceAll("[^\\p{L}\\p{N}_]", "_");
    }
    return KEYWORDS.contains(candidate) ? candidate + "_" : candidate;
  }

  static Expr literal(Object value) {
    if (value == null) return SourceTrees.none();
    if (value instanceof Boolean b) return SourceTrees.bool(b);
    if (value instanceof Long || value instanceof Integer) return SourceTrees.intLit(((Number) value).longValue());
    if (value instanceof Number n) return SourceTrees.floatLit(n.doubleValue());
    if (value instanceof List<?> list) {
      List<Expr> elts = new ArrayList<>();
      for (Object o : list) elts.add(literal(o));
      return SourceTrees.list(elts);
    }
    return SourceTrees.str(String.valueOf(value));
  }

  /** case 标签文本还原为字面量 */
  static Expr caseLabel(String label) {
    switch (label) {
      case "None":
        return SourceTrees.none();
      case "True":
        return SourceTrees.bool(true);
      case "False":
        return SourceTrees.bool(false);
      default:
        break;
    }
    if (INTEGER_LABEL.matcher(label).matches()) return SourceTrees.intLit(Long.parseLong(label));
    return SourceTrees.str(label);
  }
}
