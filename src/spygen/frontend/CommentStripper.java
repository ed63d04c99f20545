package spygen.frontend;

/**
 * Removes line and block comments from SystemVerilog source text.
 * Line breaks inside comments are kept so that line structure survives; string literals are left untouched.
 */
public class CommentStripper {

  private CommentStripper() {}

  public static String strip(String source) {
    StringBuilder out = new StringBuilder(source.length());
    int i = 0;
    int n = source.length();
    while (i < n) {
      char c = source.charAt(i);
      char next = (i + 1 < n) ? source.charAt(i + 1) : '\0';
      if (c == '"') {
        // copy the string literal including escapes
        int end = i + 1;
        while (end < n && source.charAt(end) != '"' && source.charAt(end) != '\n') {
          if (source.charAt(end) == '\\')
            ++end;
          ++end;
        }
        end = Math.min(end + 1, n);
        out.append(source, i, end);
        i = end;
      } else if (c == '/' && next == '/') {
        while (i < n && source.charAt(i) != '\n')
          ++i;
      } else if (c == '/' && next == '*') {
        int end = source.indexOf("*/", i + 2);
        end = (end == -1) ? n : end + 2;
        out.append(' ');
        for (int j = i; j < end; ++j)
          if (source.charAt(j) == '\n')
            out.append('\n');
        i = end;
      } else {
        out.append(c);
        ++i;
      }
    }
    return out.toString();
  }
}
