package nodegraph.lift.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalizerTest {

  private static final String IN = String.valueOf(Canonicalizer.INDENT);
  private static final String DE = String.valueOf(Canonicalizer.DEDENT);
  private static final String NL = String.valueOf(Canonicalizer.NEWLINE);

  private Canonicalizer canonicalizer;

  @BeforeEach
  public void setUp() {
    canonicalizer = new Canonicalizer();
  }

  @Test
  public void testIndentAndDedentMarkers() {
    String out = canonicalizer.canonicalize("if a:\n    x = 1\ny = 2\n");
    assertEquals("if a:" + NL + "\n" + IN + "    x = 1" + NL + "\n" + DE + "y = 2" + NL + "\n", out);
  }

  @Test
  public void testOpenBlocksClosedAtEndOfInput() {
    String out = canonicalizer.canonicalize("if a:\n    if b:\n        x = 1");
    assertTrue(out.endsWith("x = 1" + NL + DE + DE), "文件末尾补齐换行与两层退格: " + out);
  }

  @Test
  public void testBlankAndCommentLinesProduceNoMarkers() {
    String out = canonicalizer.canonicalize("if a:\n\n        # note\n    x = 1\n");
    assertEquals(1, count(out, Canonicalizer.INDENT), "空行与注释行不影响缩进");
    assertEquals(2, count(out, Canonicalizer.NEWLINE));
  }

  @Test
  public void testNewlinesInsideBracketsContinueTheLine() {
    String out = canonicalizer.canonicalize("x = f(1,\n      2)\ny = 3\n");
    assertEquals(2, count(out, Canonicalizer.NEWLINE), "括号内换行不结束逻辑行");
    assertEquals(0, count(out, Canonicalizer.INDENT));
  }

  @Test
  public void testStringContentIsNotInterpreted() {
    String out = canonicalizer.canonicalize("x = \"(# not a comment\"\ny = 1\n");
    assertTrue(out.contains("\"(# not a comment\""));
    assertEquals(2, count(out, Canonicalizer.NEWLINE), "字符串里的括号不计入嵌套深度");
  }

  @Test
  public void testPhysicalLinesArePreserved() {
    String source = "a = 1\r\n\r\nif a:\r\n    b = 2\r\n";
    String out = canonicalizer.canonicalize(source);
    assertEquals(4, count(out, '\n'), "物理换行全部保留");
  }

  private static int count(String text, char c) {
    int n = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == c) n++;
    }
    return n;
  }
}
