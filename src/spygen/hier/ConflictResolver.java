package spygen.hier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renames or prunes flattened signals so that every exposed name is unique within its category.
 *
 * <ul>
 * <li>Registers are never dropped. Every register whose local name occurs more than once is renamed to its flattened path.</li>
 * <li>Ports of the top module itself (depth 1) are never kept. Among ports sharing a name, all outputs are kept and renamed to their
 * flattened paths; if the group holds no output, only the port with the shortest path is kept, under its own name.</li>
 * </ul>
 * Both results are sorted by owner module, stably.
 */
public class ConflictResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Orders candidates for the representative of an input/inout group: shortest path, then lexical path. */
  private static final Comparator<SignalRecord<?>> REPRESENTATIVE_ORDER =
      Comparator.comparingInt((SignalRecord<?> record) -> record.path().length())
          .thenComparing((SignalRecord<?> record) -> record.path());

  private final String rootToken;

  /** @param rootToken the path prefix used during flattening */
  public ConflictResolver(String rootToken) { this.rootToken = rootToken; }

  public List<SignalRecord<RegisterSignal>> resolveRegisters(List<SignalRecord<RegisterSignal>> registers) {
    Map<String, List<SignalRecord<RegisterSignal>>> groups = groupByName(registers);
    ArrayList<SignalRecord<RegisterSignal>> resolved = new ArrayList<>(registers.size());
    for (SignalRecord<RegisterSignal> register : registers) {
      if (groups.get(register.name()).size() > 1) {
        SignalRecord<RegisterSignal> renamed = register.renamed(register.flatName(rootToken));
        logger.debug("Register {} renamed to {}", register.path(), renamed.name());
        resolved.add(renamed);
      } else
        resolved.add(register);
    }
    ensureUnique(resolved);
    resolved.sort(HierarchyFlattener.BY_OWNER);
    return resolved;
  }

  public List<SignalRecord<PortSignal>> resolvePorts(List<SignalRecord<PortSignal>> ports) {
    Map<String, List<SignalRecord<PortSignal>>> groups = groupByName(ports);
    // Decisions are made per group, the output keeps the input order.
    HashMap<SignalRecord<PortSignal>, SignalRecord<PortSignal>> kept = new HashMap<>();
    for (List<SignalRecord<PortSignal>> group : groups.values()) {
      if (group.size() == 1) {
        SignalRecord<PortSignal> port = group.get(0);
        if (port.depth(rootToken) > 1)
          kept.put(port, port);
        continue;
      }
      if (group.stream().anyMatch(port -> port.declaration().isOutput())) {
        for (SignalRecord<PortSignal> port : group) {
          if (!port.declaration().isOutput())
            continue;
          // A top-level output renamed to its flat path would simply drive itself.
          if (port.depth(rootToken) == 1)
            continue;
          kept.put(port, port.renamed(port.flatName(rootToken)));
        }
      } else {
        SignalRecord<PortSignal> representative = group.stream().min(REPRESENTATIVE_ORDER).get();
        if (representative.depth(rootToken) > 1)
          kept.put(representative, representative);
        logger.debug("Port {} represents {} occurrences of {}", representative.path(), group.size(), representative.name());
      }
    }

    ArrayList<SignalRecord<PortSignal>> resolved = new ArrayList<>(kept.size());
    for (SignalRecord<PortSignal> port : ports) {
      SignalRecord<PortSignal> result = kept.remove(port);
      if (result != null)
        resolved.add(result);
    }
    ensureUnique(resolved);
    resolved.sort(HierarchyFlattener.BY_OWNER);
    return resolved;
  }

  /**
   * Renames records whose name is already taken outside their category, e.g. by a spied port or a port of the interface itself.
   * Such a record takes its flattened path as name, with a numeric suffix if that is taken as well. Order is kept.
   * @param records records that are already unique among themselves
   * @param taken names used by the other signals of the same interface
   */
  public <D extends SignalDeclaration> List<SignalRecord<D>> avoidNames(List<SignalRecord<D>> records, Set<String> taken) {
    HashSet<String> used = new HashSet<>(taken);
    records.forEach(record -> used.add(record.name()));
    ArrayList<SignalRecord<D>> resolved = new ArrayList<>(records.size());
    for (SignalRecord<D> record : records) {
      if (!taken.contains(record.name())) {
        resolved.add(record);
        continue;
      }
      String flatName = record.flatName(rootToken);
      String candidate = flatName;
      for (int suffix = 1; used.contains(candidate); ++suffix)
        candidate = flatName + SignalRecord.FLAT_SEPARATOR + suffix;
      used.add(candidate);
      logger.warn("Name {} of {} is already used in the interface, using {}", record.name(), record.path(), candidate);
      resolved.add(record.renamed(candidate));
    }
    return resolved;
  }

  /**
   * Renames records in place until no two share a name.
   * Colliding records first take their flattened path as name; records already carrying it get a numeric suffix.
   */
  <D extends SignalDeclaration> void ensureUnique(List<SignalRecord<D>> records) {
    while (true) {
      Map<String, List<SignalRecord<D>>> groups = groupByName(records);
      List<String> duplicates =
          groups.entrySet().stream().filter(entry -> entry.getValue().size() > 1).map(Map.Entry::getKey).collect(Collectors.toList());
      if (duplicates.isEmpty())
        return;

      boolean changed = false;
      for (int i = 0; i < records.size(); ++i) {
        SignalRecord<D> record = records.get(i);
        String flatName = record.flatName(rootToken);
        if (groups.get(record.name()).size() > 1 && !record.name().equals(flatName)) {
          logger.debug("Name {} of {} still collides, using {}", record.name(), record.path(), flatName);
          records.set(i, record.renamed(flatName));
          changed = true;
        }
      }
      if (changed)
        continue;

      // Only flattened names collide: keep the first of each group, number the others.
      HashSet<String> used = new HashSet<>(groups.keySet());
      for (String duplicate : duplicates) {
        List<SignalRecord<D>> group = groups.get(duplicate);
        int suffix = 1;
        for (SignalRecord<D> record : group.subList(1, group.size())) {
          String candidate;
          do {
            candidate = duplicate + SignalRecord.FLAT_SEPARATOR + suffix++;
          } while (used.contains(candidate));
          used.add(candidate);
          logger.warn("Flattened name {} of {} is ambiguous, using {}", duplicate, record.path(), candidate);
          records.set(indexOfIdentity(records, record), record.renamed(candidate));
        }
      }
    }
  }

  private static <T extends SignalRecord<?>> Map<String, List<T>> groupByName(List<T> records) {
    LinkedHashMap<String, List<T>> groups = new LinkedHashMap<>();
    for (T record : records)
      groups.computeIfAbsent(record.name(), name -> new ArrayList<>()).add(record);
    return groups;
  }

  private static int indexOfIdentity(List<?> list, Object element) {
    for (int i = 0; i < list.size(); ++i)
      if (list.get(i) == element)
        return i;
    return -1;
  }
}
