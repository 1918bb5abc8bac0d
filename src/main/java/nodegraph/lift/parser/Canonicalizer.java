package nodegraph.lift.parser;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 脚本规范化器：把基于缩进的块结构转换为显式标记字符，供 ANTLR 词法分析使用。
 *
 * <p>规则：</p>
 * <ul>
 *   <li>每个逻辑行结束处插入 {@link #NEWLINE} 标记；括号内的换行、续行符与多行字符串不结束逻辑行</li>
 *   <li>逻辑行缩进加深时在行首插入 {@link #INDENT}，变浅时按层数插入 {@link #DEDENT}</li>
 *   <li>空行与纯注释行不产生任何标记</li>
 *   <li>物理换行全部保留，因此语法错误的行号与源码一致</li>
 * </ul>
 */
public final class Canonicalizer {
  public static final char INDENT = '\uE000';
  public static final char DEDENT = '\uE001';
  public static final char NEWLINE = '\uE002';

  private static final int TAB_SIZE = 8;

  public String canonicalize(String source) {
    String src = normalizeLineEndings(source);
    StringBuilder out = new StringBuilder(src.length() + 64);
    Deque<Integer> indents = new ArrayDeque<>();
    indents.push(0);

    int n = src.length();
    int i = 0;
    int depth = 0;
    boolean lineStart = true;
    boolean lineOpen = false;
    char quote = 0;
    boolean triple = false;

    while (i < n) {
      if (lineStart) {
        int j = i;
        int col = 0;
        while (j < n && (src.charAt(j) == ' ' || src.charAt(j) == '\t' || src.charAt(j) == '\f')) {
          col = src.charAt(j) == '\t' ? (col / TAB_SIZE + 1) * TAB_SIZE : col + 1;
          j++;
        }
        if (j >= n) {
          out.append(src, i, n);
          break;
        }
        char first = src.charAt(j);
        if (first == '\n' || first == '#') {
          // 空行或注释行：原样输出，不影响缩进
          int end = src.indexOf('\n', j);
          if (end < 0) end = n;
          out.append(src, i, end);
          if (end < n) out.append('\n');
          i = end + 1;
          continue;
        }
        if (col > indents.peek()) {
          indents.push(col);
          out.append(INDENT);
        } else {
          while (col < indents.peek()) {
            indents.pop();
            out.append(DEDENT);
          }
        }
        out.append(src, i, j);
        i = j;
        lineStart = false;
        lineOpen = true;
        continue;
      }

      char c = src.charAt(i);
      if (quote != 0) {
        if (c == '\\' && i + 1 < n) {
          out.append(c).append(src.charAt(i + 1));
          i += 2;
        } else if (triple && src.startsWith(String.valueOf(quote).repeat(3), i)) {
          out.append(quote).append(quote).append(quote);
          i += 3;
          quote = 0;
        } else if (!triple && c == quote) {
          out.append(c);
          i++;
          quote = 0;
        } else if (!triple && c == '\n') {
          // 未闭合的单行字符串：交给词法分析报错
          quote = 0;
        } else {
          out.append(c);
          i++;
        }
        continue;
      }

      switch (c) {
        case '#' -> {
          int end = src.indexOf('\n', i);
          if (end < 0) end = n;
          out.append(src, i, end);
          i = end;
        }
        case '"', '\'' -> {
          quote = c;
          triple = src.startsWith(String.valueOf(c).repeat(3), i);
          int len = triple ? 3 : 1;
          out.append(src, i, i + len);
          i += len;
        }
        case '(', '[', '{' -> {
          depth++;
          out.append(c);
          i++;
        }
        case ')', ']', '}' -> {
          depth = Math.max(0, depth - 1);
          out.append(c);
          i++;
        }
        case '\\' -> {
          if (i + 1 < n && src.charAt(i + 1) == '\n') {
            out.append("\\\n");
            i += 2;
          } else {
            out.append(c);
            i++;
          }
        }
        case '\n' -> {
          if (depth == 0) {
            out.append(NEWLINE);
            lineStart = true;
            lineOpen = false;
          }
          out.append('\n');
          i++;
        }
        default -> {
          out.append(c);
          i++;
        }
      }
    }

    if (lineOpen) out.append(NEWLINE);
    while (indents.size() > 1) {
      indents.pop();
      out.append(DEDENT);
    }
    return out.toString();
  }

  private static String normalizeLineEndings(String source) {
    String s = source.startsWith("\uFEFF") ? source.substring(1) : source;
    return s.replace("\r\n", "\n").replace('\r', '\n');
  }
}

