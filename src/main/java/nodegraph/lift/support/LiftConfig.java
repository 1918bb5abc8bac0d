package nodegraph.lift.support;

/**
 * 节点图提升配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。
 */
public final class LiftConfig {
  private LiftConfig() {}

  /**
   * 调试模式开关
   * 环境变量：NODEGRAPH_LIFT_DEBUG
   * 启用时逐条语句打印分派日志
   */
  public static final boolean DEBUG = System.getenv("NODEGRAPH_LIFT_DEBUG") != null;

  /**
   * 事件方法前缀
   * 环境变量：NODEGRAPH_LIFT_EVENT_PREFIX
   * 如果未指定，默认为 "on_"
   */
  public static final String EVENT_PREFIX = getEnvOrDefault("NODEGRAPH_LIFT_EVENT_PREFIX", "on_");

  /**
   * 默认节点库路径（CLI 使用）
   * 环境变量：NODEGRAPH_LIFT_REGISTRY
   */
  public static final String DEFAULT_REGISTRY = getEnvOrDefault("NODEGRAPH_LIFT_REGISTRY", null);

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }
}
