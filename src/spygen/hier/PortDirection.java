package spygen.hier;

import java.util.Optional;
import java.util.stream.Stream;

/** Direction of a module port, with its SystemVerilog keyword. */
public enum PortDirection {
  INPUT("input"),
  OUTPUT("output"),
  INOUT("inout");

  public final String keyword;

  private PortDirection(String keyword) { this.keyword = keyword; }

  public static Optional<PortDirection> fromKeyword(String keyword) {
    return Stream.of(values()).filter(direction -> direction.keyword.equals(keyword)).findAny();
  }

  @Override
  public String toString() {
    return keyword;
  }
}
