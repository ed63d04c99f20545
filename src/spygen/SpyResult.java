package spygen;

import java.util.ArrayList;
import java.util.List;
import spygen.hier.ModuleRecord;
import spygen.hier.PortSignal;
import spygen.hier.RegisterSignal;
import spygen.hier.SignalRecord;

/**
 * Resolved signals of one run, as handed to the renderer.
 * A category not selected by the mode has an empty list.
 */
public class SpyResult {
  private final ModuleRecord top;
  private final SpyMode mode;
  private final List<SignalRecord<PortSignal>> ports;
  private final List<SignalRecord<RegisterSignal>> registers;

  public SpyResult(ModuleRecord top, SpyMode mode, List<SignalRecord<PortSignal>> ports, List<SignalRecord<RegisterSignal>> registers) {
    this.top = top;
    this.mode = mode;
    this.ports = mode.ports ? List.copyOf(ports) : List.of();
    this.registers = mode.registers ? List.copyOf(registers) : List.of();
  }

  public ModuleRecord getTop() { return top; }
  public SpyMode getMode() { return mode; }
  public List<SignalRecord<PortSignal>> getPorts() { return ports; }
  public List<SignalRecord<RegisterSignal>> getRegisters() { return registers; }

  /** Ports followed by registers. */
  public List<SignalRecord<?>> getCombined() {
    ArrayList<SignalRecord<?>> combined = new ArrayList<>(ports.size() + registers.size());
    combined.addAll(ports);
    combined.addAll(registers);
    return combined;
  }

  /** Number of leading entries of {@link #getCombined()} that are ports; the renderer places its section divider there. */
  public int getPortCount() { return ports.size(); }
}
