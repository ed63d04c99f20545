package spygen;

import java.util.Optional;
import java.util.stream.Stream;

/** Selects which flattened signal categories are passed to the renderer. */
public enum SpyMode {
  PORTS("ports", true, false),
  REGISTERS("regs", false, true),
  BOTH("both", true, true);

  public final String serialName;
  public final boolean ports;
  public final boolean registers;

  private SpyMode(String serialName, boolean ports, boolean registers) {
    this.serialName = serialName;
    this.ports = ports;
    this.registers = registers;
  }

  public static Optional<SpyMode> fromSerialName(String serialName) {
    return Stream.of(values()).filter(mode -> mode.serialName.equalsIgnoreCase(serialName)).findAny();
  }
}
