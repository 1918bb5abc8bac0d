package nodegraph.lift;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口测试，结果统一通过 --out 写入临时目录。
 */
public class RunnerTest {

  @TempDir
  Path dir;

  private String registry;

  @BeforeEach
  public void setUp() throws Exception {
    registry = Path.of(RunnerTest.class.getResource("/node-library.json").toURI()).toString();
  }

  private Path script(String name, String text) throws Exception {
    Path file = dir.resolve(name);
    Files.writeString(file, text, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void testEventGraphWrittenAsJson() throws Exception {
    Path input = script("demo.py", """
        class Demo:
            def on_start(self):
                print_string(string="hi")
        """);
    Path out = dir.resolve("demo.json");

    Runner.main(new String[] {input.toString(), "--registry=" + registry, "--out=" + out});

    JsonNode root = new ObjectMapper().readTree(Files.readString(out));
    assertEquals("demo", root.get("graph_id").asText(), "图 id 取自文件名");
    assertEquals(2, root.get("nodes").size(), "事件节点与一个打印节点");
  }

  @Test
  public void testCompositeOutputCarriesVirtualPins() throws Exception {
    Path input = script("timer_gate.py", LiftFixtures.resource("/scripts/timer_gate.py"));
    Path out = dir.resolve("gate.json");

    Runner.main(new String[] {input.toString(), "--registry=" + registry, "--composite", "--out=" + out});

    JsonNode pins = new ObjectMapper().readTree(Files.readString(out)).get("virtual_pins");
    assertEquals(5, pins.size());
    assertEquals("start", pins.get(0).get("name").asText());
    assertTrue(pins.get(0).get("is_flow").asBoolean());
    assertEquals("input", pins.get(0).get("direction").asText());
  }

  @Test
  public void testLowerOptionWritesScriptText() throws Exception {
    Path input = script("demo.py", """
        class Demo:
            def on_start(self):
                print_string(string="hi")
        """);
    Path out = dir.resolve("demo_lowered.py");

    Runner.main(new String[] {input.toString(), "--registry=" + registry, "--lower", "--out=" + out});

    String text = Files.readString(out);
    assertTrue(text.contains("def on_start(self):"), text);
    assertTrue(text.contains("print_string(string=\"hi\")"), text);
  }
}
