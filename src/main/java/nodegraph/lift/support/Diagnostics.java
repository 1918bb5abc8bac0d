package nodegraph.lift.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 按上报顺序收集诊断消息，同时以 FINE 级别写入日志。
 */
public final class Diagnostics implements DiagnosticSink {
  private static final Logger LOGGER = Logger.getLogger(Diagnostics.class.getName());

  private final List<String> messages = new ArrayList<>();

  @Override
  public void warn(String message) {
    messages.add(message);
    LOGGER.log(Level.FINE, message);
  }

  public List<String> messages() {
    return Collections.unmodifiableList(messages);
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }

  /** 是否存在包含指定关键字的诊断 */
  public boolean contains(String keyword) {
    for (String m : messages) {
      if (m.contains(keyword)) return true;
    }
    return false;
  }
}
