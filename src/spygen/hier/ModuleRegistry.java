package spygen.hier;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Indexed collection of {@link ModuleRecord}s keyed by module name.
 * Filled once from the extractor output and treated as read-only once the instance graph is built.
 */
public class ModuleRegistry {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  // Keeps insertion order for stable enumeration.
  private final LinkedHashMap<String, ModuleRecord> modules = new LinkedHashMap<>();

  public ModuleRegistry() {}
  public ModuleRegistry(Collection<ModuleRecord> records) { records.forEach(this::add); }

  /**
   * Adds a module. A later module with an already known name is ignored, the first definition wins.
   * @return true if the module was added
   */
  public boolean add(ModuleRecord record) {
    if (modules.containsKey(record.getName())) {
      logger.warn("Module {} is defined more than once, ignoring the later definition", record.getName());
      return false;
    }
    modules.put(record.getName(), record);
    return true;
  }

  public Optional<ModuleRecord> lookup(String name) { return Optional.ofNullable(modules.get(name)); }

  public boolean contains(String name) { return modules.containsKey(name); }

  /** All module names, in the order the modules were added. */
  public Set<String> getModuleNames() { return Collections.unmodifiableSet(modules.keySet()); }

  public Collection<ModuleRecord> getModules() { return Collections.unmodifiableCollection(modules.values()); }

  public int size() { return modules.size(); }

  public boolean isEmpty() { return modules.isEmpty(); }
}
