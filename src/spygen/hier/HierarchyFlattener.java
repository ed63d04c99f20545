package spygen.hier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks the instantiation tree depth-first from the top module and emits every register and port occurrence with its qualified path.
 *
 * Within a module, own declarations come first, followed by the instances in the order they appear in the body. The resulting lists are
 * then stably sorted by owner module, so all occurrences of one module definition are grouped together.
 */
public class HierarchyFlattener {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Orders records by owner module name; the sort using it must be stable. */
  public static final Comparator<SignalRecord<?>> BY_OWNER = Comparator.comparing((SignalRecord<?> record) -> record.ownerModule());

  private final ModuleRegistry registry;
  private final String rootToken;

  /**
   * @param registry the registry with the instance graph already built
   * @param rootToken path prefix of the top module, e.g. "`DUT_PATH"
   */
  public HierarchyFlattener(ModuleRegistry registry, String rootToken) {
    this.registry = registry;
    this.rootToken = rootToken;
  }

  /**
   * Flattens the hierarchy below top.
   * @throws CycleDetectedException if a module (transitively) instantiates itself; nothing is returned in that case
   */
  public FlattenedHierarchy flatten(ModuleRecord top) throws CycleDetectedException {
    ArrayList<SignalRecord<PortSignal>> ports = new ArrayList<>();
    ArrayList<SignalRecord<RegisterSignal>> registers = new ArrayList<>();
    LinkedHashSet<String> expanding = new LinkedHashSet<>();
    expanding.add(top.getName());
    visit(top, rootToken, expanding, ports, registers);

    ports.sort(BY_OWNER);
    registers.sort(BY_OWNER);
    logger.debug("Flattened {}: {} ports, {} registers", top.getName(), ports.size(), registers.size());
    return new FlattenedHierarchy(top, ports, registers);
  }

  /**
   * @param expanding modules on the active recursion path, in expansion order; includes module itself
   */
  private void visit(ModuleRecord module, String prefix, LinkedHashSet<String> expanding, List<SignalRecord<PortSignal>> ports,
                     List<SignalRecord<RegisterSignal>> registers) throws CycleDetectedException {
    for (RegisterSignal register : module.getRegisters())
      registers.add(new SignalRecord<>(register, prefix + SignalRecord.PATH_SEPARATOR + register.name(), module.getName()));
    for (PortSignal port : module.getPorts())
      ports.add(new SignalRecord<>(port, prefix + SignalRecord.PATH_SEPARATOR + port.name(), module.getName()));

    for (InstanceEdge edge : module.getInstances()) {
      Optional<ModuleRecord> child = registry.lookup(edge.childModuleName());
      if (child.isEmpty()) {
        logger.warn("Module {} instantiated as {} in {} not found, skipping the instance", edge.childModuleName(), edge.instanceAlias(),
                    module.getName());
        continue;
      }
      if (expanding.contains(edge.childModuleName())) {
        List<String> cycle = Stream.concat(expanding.stream().dropWhile(name -> !name.equals(edge.childModuleName())),
                                           Stream.of(edge.childModuleName()))
                                 .collect(Collectors.toList());
        throw new CycleDetectedException(cycle);
      }
      expanding.add(edge.childModuleName());
      visit(child.get(), prefix + SignalRecord.PATH_SEPARATOR + edge.instanceAlias(), expanding, ports, registers);
      expanding.remove(edge.childModuleName());
    }
  }
}
