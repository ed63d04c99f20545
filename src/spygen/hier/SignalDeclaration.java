package spygen.hier;

import java.util.Optional;

/**
 * A signal declared by a module, either a port ({@link PortSignal}) or an observable register ({@link RegisterSignal}).
 * The name is unique within the declaring module only.
 */
public interface SignalDeclaration {
  /** Base type token as written in the source, e.g. "logic" or "state_t". */
  String type();

  /** Packed range qualifier as written in the source (e.g. "[7:0]"), if any. */
  Optional<String> width();

  /** Local identifier. */
  String name();

  /** Returns a copy of this declaration under another name. */
  SignalDeclaration withName(String newName);
}
