package nodegraph.lift.support;

/**
 * 诊断消息统一生成工具。
 *
 * <p>所有诊断均提供中英文双语描述，英文部分保留固定关键字（如 {@code unresolved call}），
 * 供下游校验器与测试按关键字匹配。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息，保持英文关键字稳定。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  private static String at(int line) {
    return line > 0 ? " [line " + line + "]" : "";
  }

  /**
   * 调用的节点名无法在节点库中解析。
   *
   * @param callee 调用名
   * @param line 源码行号，未知时为 0
   */
  public static String unresolvedCall(String callee, int line) {
    String message = bilingual("无法识别的节点调用：" + callee, "unresolved call: " + callee) + at(line);
    return withHint(message, "确认节点名拼写，或先在节点库中注册该节点", "Check the node name or register it in the node library");
  }

  public static String breakOutsideLoop(int line) {
    return bilingual("循环外的 break 已忽略", "break outside loop ignored") + at(line);
  }

  /**
   * match 语句的 case 与复合节点出口无法一一对应。
   *
   * @param callee 复合节点方法名
   * @param label 无法对应的 case 标签
   */
  public static String ambiguousMatchDispatch(String callee, String label, int line) {
    String message = bilingual(
      "match 分支 '" + label + "' 不是 " + callee + " 的流程出口，已丢弃整条语句",
      "ambiguous match dispatch: case '" + label + "' is not an exit of " + callee) + at(line);
    return withHint(message, "让每个 case 标签都对应一个已声明的出口", "Make every case label name a declared exit");
  }

  /** 重复的 case 标签，后出现的分支不会执行 */
  public static String duplicateCaseLabel(String label, int line) {
    return bilingual("重复的 case 标签 '" + label + "'，后面的分支已忽略",
      "duplicate case label: '" + label + "' ignored") + at(line);
  }

  public static String unsupportedLiteral(String target, String literalKind, int line) {
    return bilingual(
      "不支持将 " + literalKind + " 字面量赋值给 " + target,
      "unsupported literal: " + literalKind + " assigned to " + target) + at(line);
  }

  public static String unsupportedMethodCall(String dotted, int line) {
    String message = bilingual("不支持的方法调用：" + dotted, "unsupported method call: " + dotted) + at(line);
    return withHint(message, "使用节点函数调用，或通过复合节点实例调用", "Call a node function or a composite instance method");
  }

  public static String unsupportedCondition(String kind, int line) {
    return bilingual("不支持的条件表达式：" + kind, "unsupported condition: " + kind) + at(line);
  }

  public static String unsupportedExpression(String kind, int line) {
    return bilingual("不支持的表达式：" + kind, "unsupported expression: " + kind) + at(line);
  }

  public static String unknownPort(String nodeTitle, String port, int line) {
    return bilingual(
      "节点 " + nodeTitle + " 没有端口 " + port,
      "unknown port: " + nodeTitle + "." + port) + at(line);
  }

  public static String unresolvedPin(String pin) {
    return bilingual("虚拟引脚 " + pin + " 未找到映射位置，标记为允许未映射",
      "unresolved pin anchor: " + pin + " marked allow-unmapped");
  }

  /** 回写源码时无法表达的节点 */
  public static String loweringSkipped(String nodeId, String reason) {
    return bilingual("节点 " + nodeId + " 无法回写为源码：" + reason,
      "lowering skipped: " + nodeId + " (" + reason + ")");
  }
}
