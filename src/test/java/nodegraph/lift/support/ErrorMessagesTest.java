package nodegraph.lift.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorMessagesTest {

  @Test
  public void testMessagesKeepEnglishKeywords() {
    assertTrue(ErrorMessages.unresolvedCall("launch", 4).contains("unresolved call: launch"));
    assertTrue(ErrorMessages.breakOutsideLoop(2).contains("break outside loop"));
    assertTrue(ErrorMessages.ambiguousMatchDispatch("self.t.check", "7", 1).contains("ambiguous match dispatch"));
    assertTrue(ErrorMessages.unresolvedPin("go").contains("unresolved pin anchor: go"));
    assertTrue(ErrorMessages.loweringSkipped("n1", "composite call").contains("lowering skipped: n1"));
  }

  @Test
  public void testLineSuffixOnlyWhenKnown() {
    assertTrue(ErrorMessages.breakOutsideLoop(12).endsWith("[line 12]"));
    assertFalse(ErrorMessages.breakOutsideLoop(0).contains("[line"));
  }

  @Test
  public void testHintIsAppendedOnNewLine() {
    String message = ErrorMessages.unresolvedCall("launch", 0);
    assertTrue(message.contains("\n提示："));
    assertTrue(message.contains("(Hint: "));
  }

  @Test
  public void testDiagnosticsKeepOrder() {
    Diagnostics diagnostics = new Diagnostics();
    assertTrue(diagnostics.isEmpty());
    diagnostics.warn("first");
    diagnostics.warn("second");
    assertEquals(java.util.List.of("first", "second"), diagnostics.messages());
    assertTrue(diagnostics.contains("sec"));
    assertThrows(UnsupportedOperationException.class, () -> diagnostics.messages().add("x"));
  }
}
