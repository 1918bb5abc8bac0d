package nodegraph.lift.support;

/**
 * 诊断输出接口。提升过程中的可恢复错误都通过它上报，不中断整体提升。
 */
@FunctionalInterface
public interface DiagnosticSink {
  void warn(String message);
}
