package nodegraph.lift.ir;

/**
 * 编译单元内的节点 id 生成器。按创建顺序编号，保证同一输入多次提升得到相同的 id。
 */
public final class NodeIdGenerator {
  private int counter;

  public String nodeId(String title) {
    return "node_" + sanitize(title) + "_" + (++counter);
  }

  public String eventId(String eventName) {
    return "event_" + sanitize(eventName) + "_" + (++counter);
  }

  private static String sanitize(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
    }
    return sb.toString();
  }
}
