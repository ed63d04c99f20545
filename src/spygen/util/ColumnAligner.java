package spygen.util;

import java.util.ArrayList;
import java.util.List;
import spygen.hier.SignalDeclaration;

/**
 * Formats declarations so that the names line up: "prefix type width  name".
 */
public class ColumnAligner {

  private ColumnAligner() {}

  /** Length of "type width" of the widest declaration. */
  public static int maxTypeWidth(List<? extends SignalDeclaration> declarations) {
    int max = 0;
    for (SignalDeclaration declaration : declarations)
      max = Math.max(max, typeAndWidth(declaration).length());
    return max;
  }

  /**
   * @param prefix text before the type, e.g. "input"; empty for none
   * @param columnWidth type column width, usually {@link #maxTypeWidth(List)} of a larger list
   */
  public static String align(SignalDeclaration declaration, String prefix, int columnWidth) {
    String typeAndWidth = typeAndWidth(declaration);
    StringBuilder line = new StringBuilder();
    if (!prefix.isEmpty())
      line.append(prefix).append(' ');
    line.append(typeAndWidth);
    line.append(" ".repeat(Math.max(0, columnWidth - typeAndWidth.length()) + 1));
    line.append(declaration.name());
    return line.toString();
  }

  public static List<String> align(List<? extends SignalDeclaration> declarations, String prefix) {
    int columnWidth = maxTypeWidth(declarations);
    ArrayList<String> lines = new ArrayList<>(declarations.size());
    for (SignalDeclaration declaration : declarations)
      lines.add(align(declaration, prefix, columnWidth));
    return lines;
  }

  private static String typeAndWidth(SignalDeclaration declaration) {
    return declaration.width().map(width -> declaration.type() + " " + width).orElse(declaration.type());
  }
}
