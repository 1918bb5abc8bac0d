package nodegraph.lift.ir;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static nodegraph.lift.LiftFixtures.parse;
import static org.junit.jupiter.api.Assertions.*;

public class AssignmentAnalysisTest {

  private static AssignmentAnalysis analyze(String source) {
    return AssignmentAnalysis.analyze(parse(source).body);
  }

  @Test
  public void testCandidatesNeedBranchAssignmentAndLaterRead() {
    AssignmentAnalysis a = analyze("""
        x = 0
        if flag:
            x = 1
            y = 2
            z = 3
        print_string(string=x)
        print_string(string=w)
        """);

    assertEquals(2, a.assignmentCount("x"));
    assertTrue(a.isAssignedInBranch("y"));
    assertFalse(a.isUsedAfterBranch("y"), "分支后没有读取 y");
    assertEquals(Set.of("x"), a.multiAssignCandidates());
  }

  @Test
  public void testNestedBlocksCountAsBranch() {
    AssignmentAnalysis a = analyze("""
        for i in range(3):
            match i:
                case 1:
                    total = add_numbers(left=i, right=1)
        print_string(string=total)
        """);

    assertTrue(a.isAssignedInBranch("total"));
    assertEquals(Set.of("total"), a.multiAssignCandidates());
  }

  @Test
  public void testTupleTargetsAreCounted() {
    AssignmentAnalysis a = analyze("""
        if flag:
            low, high = min_max(values=v)
        else:
            low, high = min_max(values=w)
        print_string(string=high)
        """);

    assertEquals(2, a.assignmentCount("low"));
    assertEquals(Set.of("high"), a.multiAssignCandidates(), "只有被读取的目标成为候选");
  }

  @Test
  public void testReadBeforeBranchDoesNotCount() {
    AssignmentAnalysis a = analyze("""
        print_string(string=x)
        if flag:
            x = 1
        """);
    assertTrue(a.multiAssignCandidates().isEmpty());
  }
}
