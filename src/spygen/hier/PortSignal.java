package spygen.hier;

import java.util.Objects;
import java.util.Optional;

/** A module port. Unlike registers, ports always carry a direction. */
public record PortSignal(PortDirection direction, String type, Optional<String> width, String name) implements SignalDeclaration {
  public PortSignal {
    Objects.requireNonNull(direction);
    Objects.requireNonNull(type);
    Objects.requireNonNull(width);
    Objects.requireNonNull(name);
  }

  @Override
  public PortSignal withName(String newName) {
    return new PortSignal(direction, type, width, newName);
  }

  public boolean isOutput() { return direction == PortDirection.OUTPUT; }
}
