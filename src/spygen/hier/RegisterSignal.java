package spygen.hier;

import java.util.Objects;
import java.util.Optional;

/** Internal state matching the register naming convention. */
public record RegisterSignal(String type, Optional<String> width, String name) implements SignalDeclaration {
  public RegisterSignal {
    Objects.requireNonNull(type);
    Objects.requireNonNull(width);
    Objects.requireNonNull(name);
  }

  @Override
  public RegisterSignal withName(String newName) {
    return new RegisterSignal(type, width, newName);
  }
}
