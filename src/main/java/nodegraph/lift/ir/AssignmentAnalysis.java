package nodegraph.lift.ir;

import nodegraph.lift.core.SourceModel.*;
import nodegraph.lift.core.SourceTrees;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 方法体的赋值分析，在提升任何语句之前对整个语句列表（含嵌套块）执行一次。
 *
 * <ul>
 *   <li>每个变量的赋值次数</li>
 *   <li>在 if/match/for/while 块内被赋值的变量</li>
 *   <li>在某个分支结构内被赋值、且被同一语句列表中该结构之后的语句读取的变量</li>
 * </ul>
 * 后两者的交集即需要合成局部变量节点的候选。
 */
public final class AssignmentAnalysis {
  private final Map<String, Integer> assignmentCounts = new LinkedHashMap<>();
  private final Set<String> assignedInBranch = new LinkedHashSet<>();
  private final Set<String> usedAfterBranch = new LinkedHashSet<>();

  private AssignmentAnalysis() {}

  public static AssignmentAnalysis analyze(List<Stmt> body) {
    AssignmentAnalysis a = new AssignmentAnalysis();
    a.countAssignments(body, false);
    a.collectUsedAfterBranch(body);
    return a;
  }

  private void countAssignments(List<Stmt> stmts, boolean inBranch) {
    for (Stmt s : SourceTrees.orEmpty(stmts)) {
      Set<String> targets = new LinkedHashSet<>();
      if (s instanceof Assign a) {
        SourceTrees.collectTargetNames(a.target, targets);
      } else if (s instanceof AnnAssign aa && aa.value != null) {
        SourceTrees.collectTargetNames(aa.target, targets);
      }
      for (String t : targets) {
        assignmentCounts.merge(t, 1, Integer::sum);
        if (inBranch) assignedInBranch.add(t);
      }
      boolean nested = inBranch || SourceTrees.isBranchConstruct(s);
      for (List<Stmt> block : SourceTrees.childBlocks(s)) {
        countAssignments(block, nested);
      }
    }
  }

  private void collectUsedAfterBranch(List<Stmt> stmts) {
    List<Stmt> list = SourceTrees.orEmpty(stmts);
    for (int i = 0; i < list.size(); i++) {
      Stmt s = list.get(i);
      if (SourceTrees.isBranchConstruct(s)) {
        Set<String> stored = new LinkedHashSet<>();
        for (List<Stmt> block : SourceTrees.childBlocks(s)) {
          for (Stmt child : block) stored.addAll(SourceTrees.namesStored(child));
        }
        if (!stored.isEmpty()) {
          for (int j = i + 1; j < list.size(); j++) {
            Set<String> read = SourceTrees.namesRead(list.get(j));
            for (String name : stored) {
              if (read.contains(name)) usedAfterBranch.add(name);
            }
          }
        }
      }
      for (List<Stmt> block : SourceTrees.childBlocks(s)) {
        collectUsedAfterBranch(block);
      }
    }
  }

  public int assignmentCount(String name) {
    return assignmentCounts.getOrDefault(name, 0);
  }

  public boolean isAssignedInBranch(String name) {
    return assignedInBranch.contains(name);
  }

  public boolean isUsedAfterBranch(String name) {
    return usedAfterBranch.contains(name);
  }

  public Set<String> multiAssignCandidates() {
    Set<String> out = new LinkedHashSet<>(assignedInBranch);
    out.retainAll(usedAfterBranch);
    return Collections.unmodifiableSet(out);
  }
}
