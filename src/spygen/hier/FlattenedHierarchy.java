package spygen.hier;

import java.util.List;

/**
 * Output of one flattening pass: every port and register occurrence below the top module, each list sorted by owner module.
 */
public class FlattenedHierarchy {
  private final ModuleRecord top;
  private final List<SignalRecord<PortSignal>> ports;
  private final List<SignalRecord<RegisterSignal>> registers;

  public FlattenedHierarchy(ModuleRecord top, List<SignalRecord<PortSignal>> ports, List<SignalRecord<RegisterSignal>> registers) {
    this.top = top;
    this.ports = List.copyOf(ports);
    this.registers = List.copyOf(registers);
  }

  public ModuleRecord getTop() { return top; }
  public List<SignalRecord<PortSignal>> getPorts() { return ports; }
  public List<SignalRecord<RegisterSignal>> getRegisters() { return registers; }
}
