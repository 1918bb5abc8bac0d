package nodegraph.lift;

import nodegraph.lift.graph.Graph;
import nodegraph.lift.support.Diagnostics;

/**
 * 一次提升的产物：图与按顺序收集的诊断。
 */
public record LiftResult(Graph graph, Diagnostics diagnostics) {
}
