package nodegraph.lift.parser;

import nodegraph.lift.core.SourceModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 节点图脚本编译器
 * <p>
 * 把脚本源码解析为 {@link SourceModel.Module}，供提升器消费。
 * <p>
 * 编译管道：
 * <pre>
 * 脚本源码 → Canonicalizer（缩进标记化） → ANTLR Lexer → ANTLR Parser
 *          → AstBuilder（构建源码模型）
 * </pre>
 * 也接受已序列化为 JSON 的源码模型，见 {@link #isJsonInput(String)}。
 */
public final class ScriptCompiler {

    private static final Logger LOGGER = Logger.getLogger(ScriptCompiler.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ScriptCompiler() {
        // 工具类，禁止实例化
    }

    /**
     * 将脚本源码编译为源码模型
     *
     * @param source     脚本源码
     * @param moduleName 模块名（通常取文件名）
     * @return 源码模型
     * @throws CompilationException 语法错误或构建失败时抛出
     */
    public static SourceModel.Module compile(String source, String moduleName) throws CompilationException {
        try {
            // 1. 规范化缩进
            String canonicalized = new Canonicalizer().canonicalize(source);

            // 2. ANTLR 词法分析
            CharStream charStream = CharStreams.fromString(canonicalized);
            GraphScriptLexer lexer = new GraphScriptLexer(charStream);
            CommonTokenStream tokens = new CommonTokenStream(lexer);

            // 3. ANTLR 语法分析
            GraphScriptParser parser = new GraphScriptParser(tokens);

            // 收集词法与语法错误
            StringBuilder parseErrors = new StringBuilder();
            org.antlr.v4.runtime.BaseErrorListener listener = new org.antlr.v4.runtime.BaseErrorListener() {
                @Override
                public void syntaxError(org.antlr.v4.runtime.Recognizer<?, ?> recognizer,
                                        Object offendingSymbol,
                                        int line, int charPositionInLine,
                                        String msg,
                                        org.antlr.v4.runtime.RecognitionException e) {
                    parseErrors.append(String.format("语法错误 (行 %d:%d): %s\n", line, charPositionInLine, readable(msg)));
                }
            };
            lexer.removeErrorListeners();
            lexer.addErrorListener(listener);
            parser.removeErrorListeners();
            parser.addErrorListener(listener);

            GraphScriptParser.ModuleContext moduleCtx = parser.module();

            if (parseErrors.length() > 0) {
                throw new CompilationException("脚本语法解析失败:\n" + parseErrors);
            }

            // 4. 构建源码模型
            SourceModel.Module module = new AstBuilder(tokens).buildModule(moduleCtx, moduleName);
            LOGGER.log(Level.FINE, "解析完成: {0}，顶层语句 {1} 条", new Object[]{moduleName, module.body.size()});
            return module;

        } catch (CompilationException e) {
            throw e;
        } catch (Exception e) {
            throw new CompilationException("脚本编译失败: " + e.getMessage(), e);
        }
    }

    /**
     * 解析 JSON 形式的源码模型
     *
     * @param json JSON 文本
     * @return 源码模型
     * @throws CompilationException JSON 不合法时抛出
     */
    public static SourceModel.Module parseJson(String json) throws CompilationException {
        try {
            return MAPPER.readValue(json, SourceModel.Module.class);
        } catch (IOException e) {
            throw new CompilationException("JSON 解析失败: " + e.getMessage(), e);
        }
    }

    /**
     * 判断输入是否为 JSON 源码模型（而非脚本源码）
     * <p>
     * 简单启发式：以 '{' 开头视为 JSON
     */
    public static boolean isJsonInput(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return input.stripLeading().startsWith("{");
    }

    // ANTLR 报错信息里会带出内部标记字符，替换为可读名称
    private static String readable(String msg) {
        return msg
                .replace(String.valueOf(Canonicalizer.INDENT), "<INDENT>")
                .replace(String.valueOf(Canonicalizer.DEDENT), "<DEDENT>")
                .replace(String.valueOf(Canonicalizer.NEWLINE), "<NEWLINE>");
    }

    /**
     * 脚本编译异常
     */
    public static class CompilationException extends Exception {
        public CompilationException(String message) {
            super(message);
        }

        public CompilationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
