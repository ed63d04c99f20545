package spygen.hier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Extracted representation of one module definition.
 * Owned by the {@link ModuleRegistry} it was added to; other stages refer to modules by name.
 */
public class ModuleRecord {
  private final String name;
  private final List<Parameter> parameters;
  private final List<PortSignal> ports;
  private final List<RegisterSignal> registers;
  private final String body;
  /** Filled by {@link InstanceGraphBuilder}, in textual order. */
  private final ArrayList<InstanceEdge> instances = new ArrayList<>();

  public ModuleRecord(String name, List<Parameter> parameters, List<PortSignal> ports, List<RegisterSignal> registers, String body) {
    this.name = name;
    this.parameters = List.copyOf(parameters);
    this.ports = List.copyOf(ports);
    this.registers = List.copyOf(registers);
    this.body = body;
  }

  public String getName() { return name; }
  public List<Parameter> getParameters() { return parameters; }
  public List<PortSignal> getPorts() { return ports; }
  public List<RegisterSignal> getRegisters() { return registers; }
  /** The raw text between the port list and 'endmodule'. */
  public String getBody() { return body; }
  public List<InstanceEdge> getInstances() { return Collections.unmodifiableList(instances); }

  void addInstance(InstanceEdge edge) { instances.add(edge); }

  @Override
  public String toString() {
    return String.format("module %s (%d parameters, %d ports, %d registers, instances %s)", name, parameters.size(), ports.size(),
                         registers.size(), instances);
  }
}
